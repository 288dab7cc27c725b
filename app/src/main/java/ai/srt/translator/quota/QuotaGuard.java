package ai.srt.translator.quota;

import ai.srt.translator.subtitle.CueDocument;
import java.util.Objects;

/**
 * Pre-flight check of a document's character volume against the provider's quota.
 */
public class QuotaGuard {

    private final long limit;

    public QuotaGuard(long limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("quota limit must be positive");
        }
        this.limit = limit;
    }

    public long limit() {
        return limit;
    }

    public QuotaStatus classify(CueDocument document) {
        return classify(document, limit);
    }

    public static QuotaStatus classify(CueDocument document, long limit) {
        Objects.requireNonNull(document, "document");
        long totalChars = document.totalChars();
        QuotaVerdict verdict;
        if (totalChars == 0) {
            verdict = QuotaVerdict.EMPTY;
        } else if (totalChars > limit) {
            verdict = QuotaVerdict.EXCEEDED;
        } else {
            verdict = QuotaVerdict.OK;
        }
        return new QuotaStatus(totalChars, limit, verdict);
    }
}
