package ai.srt.translator.translate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.srt.translator.translate.TranslationException.Failure;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class RetryingTranslationClientTest {

    private static final TranslationRequest REQUEST = new TranslationRequest(List.of("Hello"), Optional.empty(), "DE");

    private final List<Duration> sleeps = new ArrayList<>();

    @Test
    void retriesTransientFailureAndEventuallySucceeds() {
        AtomicInteger attemptCount = new AtomicInteger();
        TranslationClient flaky = request -> {
            if (attemptCount.incrementAndGet() < 3) {
                throw new TranslationException(Failure.PROVIDER_ERROR, "HTTP 429: Too many requests");
            }
            return List.of("Hallo");
        };
        RetryingTranslationClient client = new RetryingTranslationClient(flaky, 6, 1, 60, 0.1, sleeps::add);

        assertThat(client.translateBatch(REQUEST)).containsExactly("Hallo");
        assertThat(attemptCount.get()).isEqualTo(3);
        assertThat(sleeps).hasSize(2);
    }

    @Test
    void failsAfterMaxAttempts() {
        AtomicInteger attemptCount = new AtomicInteger();
        TranslationClient unreachable = request -> {
            attemptCount.incrementAndGet();
            throw new TranslationException(Failure.TRANSPORT_ERROR, "connection refused");
        };
        RetryingTranslationClient client = new RetryingTranslationClient(unreachable, 3, 1, 60, 0.1, sleeps::add);

        assertThatThrownBy(() -> client.translateBatch(REQUEST))
                .isInstanceOf(TranslationException.class)
                .hasMessageContaining("connection refused");
        assertThat(attemptCount.get()).isEqualTo(3);
    }

    @Test
    void doesNotRetryPermanentFailures() {
        AtomicInteger attemptCount = new AtomicInteger();
        TranslationClient rejecting = request -> {
            attemptCount.incrementAndGet();
            throw new TranslationException(Failure.AUTHENTICATION_FAILED, "HTTP 403: Forbidden");
        };
        RetryingTranslationClient client = new RetryingTranslationClient(rejecting, 6, 1, 60, 0.1, sleeps::add);

        assertThatThrownBy(() -> client.translateBatch(REQUEST)).isInstanceOf(TranslationException.class);
        assertThat(attemptCount.get()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void backoffGrowsAndIsCapped() {
        RetryingTranslationClient client = new RetryingTranslationClient(new PassThroughTranslationClient(), 6, 2, 10, 0.0, sleeps::add);

        assertThat(client.backoff(0)).isEqualTo(Duration.ofSeconds(2));
        assertThat(client.backoff(1)).isEqualTo(Duration.ofSeconds(4));
        assertThat(client.backoff(5)).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void exposesDelegateCredentialKey() {
        TranslationClient delegate = new TranslationClient() {
            @Override
            public List<String> translateBatch(TranslationRequest request) {
                return request.texts();
            }

            @Override
            public Optional<String> credentialKey() {
                return Optional.of("some_key");
            }
        };

        assertThat(new RetryingTranslationClient(delegate, 1, 1, 1, 0.0).credentialKey()).contains("some_key");
    }
}
