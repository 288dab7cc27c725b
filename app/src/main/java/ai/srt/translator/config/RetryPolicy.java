package ai.srt.translator.config;

/**
 * Backoff settings for resubmitting a batch after a transient provider failure.
 */
public record RetryPolicy(int maxAttempts, int initialBackoffSeconds, int maxBackoffSeconds, double jitterFactor) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(6, 2, 60, 0.3);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialBackoffSeconds < 1) {
            throw new IllegalArgumentException("initialBackoffSeconds must be at least 1");
        }
        if (maxBackoffSeconds < initialBackoffSeconds) {
            throw new IllegalArgumentException("maxBackoffSeconds must be at least initialBackoffSeconds");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0");
        }
    }
}
