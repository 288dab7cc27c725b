package ai.srt.translator.translate;

import java.util.List;
import java.util.Optional;

/**
 * Remote text-translation provider.
 *
 * <p>Each call is one logical batch submission: either every text comes back translated in request
 * order, or a {@link TranslationException} is thrown and nothing is returned.
 */
public interface TranslationClient {

    List<String> translateBatch(TranslationRequest request);

    /**
     * Config Store key of the credential this client needs, if any.
     */
    default Optional<String> credentialKey() {
        return Optional.empty();
    }
}
