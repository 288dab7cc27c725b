package ai.srt.translator.config;

import java.util.Objects;
import java.util.Optional;

/**
 * Holds runtime settings for the translation provider. {@code baseUrl} overrides the DeepL endpoint or
 * points at the Ollama server.
 */
public record TranslatorConfig(TranslationProvider provider, String modelName, Optional<String> baseUrl) {

    public TranslatorConfig {
        provider = Objects.requireNonNull(provider, "provider");
        modelName = requireNonBlank(modelName, "modelName");
        baseUrl = baseUrl == null ? Optional.empty() : baseUrl;
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
