package ai.srt.translator.session;

import java.util.Objects;

/**
 * Raised when a session operation is attempted while one of its preconditions does not hold.
 */
public class SessionException extends RuntimeException {

    public enum Reason {
        NO_DOCUMENT,
        MISSING_CREDENTIAL,
        EMPTY_DOCUMENT,
        QUOTA_EXCEEDED,
        MISSING_TARGET_LANGUAGE
    }

    private final Reason reason;

    public SessionException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason reason() {
        return reason;
    }
}
