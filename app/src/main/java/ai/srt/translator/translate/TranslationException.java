package ai.srt.translator.translate;

import java.util.Objects;

/**
 * Runtime exception used to propagate translation provider failures.
 */
public class TranslationException extends RuntimeException {

    /**
     * Closed set of provider failure kinds.
     */
    public enum Failure {
        /** Provider-side character quota is used up. */
        QUOTA_EXCEEDED_REMOTE,
        /** Credential missing or rejected. */
        AUTHENTICATION_FAILED,
        /** Any other failure reported by the provider. */
        PROVIDER_ERROR,
        /** The provider could not be reached. */
        TRANSPORT_ERROR
    }

    private final Failure failure;
    private final String detail;

    public TranslationException(Failure failure, String detail) {
        this(failure, detail, null);
    }

    public TranslationException(Failure failure, String detail, Throwable cause) {
        super(failure + ": " + detail, cause);
        this.failure = Objects.requireNonNull(failure, "failure");
        this.detail = detail == null ? "" : detail;
    }

    public Failure failure() {
        return failure;
    }

    public String detail() {
        return detail;
    }

    /**
     * Rate limiting and connectivity problems may succeed when the same batch is resubmitted.
     */
    public boolean isTransient() {
        if (failure == Failure.TRANSPORT_ERROR) {
            return true;
        }
        return failure == Failure.PROVIDER_ERROR && detail.contains("429");
    }
}
