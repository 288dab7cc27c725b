package ai.srt.translator.config;

import java.util.Optional;

/**
 * Small key-value store for user settings such as the provider credential.
 */
public interface ConfigStore {

    String DEEPL_API_KEY = "deepl_api_key";
    String GEMINI_API_KEY = "gemini_api_key";

    Optional<String> get(String key);

    /**
     * @throws ConfigStoreException when the value cannot be persisted
     */
    void set(String key, String value);
}
