package ai.srt.translator.translate;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resubmits the whole batch when the provider reports a transient failure.
 *
 * <p>Every attempt carries the complete request, so a caller still sees either all results or one
 * final {@link TranslationException}.
 */
public class RetryingTranslationClient implements TranslationClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetryingTranslationClient.class);

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final TranslationClient delegate;
    private final int maxRetryAttempts;
    private final int initialBackoffSeconds;
    private final int maxBackoffSeconds;
    private final double jitterFactor;
    private final Sleeper sleeper;

    public RetryingTranslationClient(TranslationClient delegate, int maxRetryAttempts, int initialBackoffSeconds,
                                     int maxBackoffSeconds, double jitterFactor) {
        this(delegate, maxRetryAttempts, initialBackoffSeconds, maxBackoffSeconds, jitterFactor,
                duration -> Thread.sleep(duration.toMillis()));
    }

    RetryingTranslationClient(TranslationClient delegate, int maxRetryAttempts, int initialBackoffSeconds,
                              int maxBackoffSeconds, double jitterFactor, Sleeper sleeper) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        if (maxRetryAttempts < 1) {
            throw new IllegalArgumentException("maxRetryAttempts must be at least 1");
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
        this.maxRetryAttempts = maxRetryAttempts;
        this.initialBackoffSeconds = initialBackoffSeconds;
        this.maxBackoffSeconds = maxBackoffSeconds;
        this.jitterFactor = jitterFactor;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    public Optional<String> credentialKey() {
        return delegate.credentialKey();
    }

    @Override
    public List<String> translateBatch(TranslationRequest request) {
        for (int attempt = 0; ; attempt++) {
            try {
                return delegate.translateBatch(request);
            } catch (TranslationException ex) {
                if (!ex.isTransient() || attempt >= maxRetryAttempts - 1) {
                    if (ex.isTransient()) {
                        LOGGER.error("Translation failed after {} attempts: {}", attempt + 1, ex.getMessage());
                    }
                    throw ex;
                }
                Duration delay = backoff(attempt);
                LOGGER.warn("Transient translation failure ({}); retrying in {} seconds (attempt {}/{})",
                        ex.failure(), delay.toSeconds(), attempt + 1, maxRetryAttempts);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interruptedException) {
                    Thread.currentThread().interrupt();
                    LOGGER.warn("Translation retry interrupted");
                    throw ex;
                }
            }
        }
    }

    Duration backoff(int attemptNumber) {
        // initialBackoff * 2^attempt, capped, then spread by +/- jitterFactor
        long baseDelaySeconds = initialBackoffSeconds * (1L << Math.min(attemptNumber, 30));
        long cappedDelaySeconds = Math.min(baseDelaySeconds, maxBackoffSeconds);
        double jitterMultiplier = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0) * jitterFactor;
        long finalDelaySeconds = Math.max(1, (long) (cappedDelaySeconds * jitterMultiplier));
        return Duration.ofSeconds(finalDelaySeconds);
    }
}
