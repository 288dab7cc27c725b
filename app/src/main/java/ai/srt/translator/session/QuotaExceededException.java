package ai.srt.translator.session;

/**
 * The document holds more characters than the configured quota allows.
 */
public class QuotaExceededException extends SessionException {

    private final long totalChars;
    private final long limit;

    public QuotaExceededException(long totalChars, long limit) {
        super(Reason.QUOTA_EXCEEDED, "Document has " + totalChars + " characters, quota limit is " + limit);
        this.totalChars = totalChars;
        this.limit = limit;
    }

    public long totalChars() {
        return totalChars;
    }

    public long limit() {
        return limit;
    }
}
