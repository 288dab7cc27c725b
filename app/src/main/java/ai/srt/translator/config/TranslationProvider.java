package ai.srt.translator.config;

import java.util.Locale;

/**
 * Remote services that can translate subtitle text.
 */
public enum TranslationProvider {
    DEEPL("deepl"),
    GEMINI("gemini-2.5-flash"),
    OLLAMA("llama3.1");

    private final String defaultModel;

    TranslationProvider(String defaultModel) {
        this.defaultModel = defaultModel;
    }

    public String defaultModel() {
        return defaultModel;
    }

    public static TranslationProvider from(String value) {
        if (value == null) {
            return DEEPL;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "deepl", "" -> DEEPL;
            case "gemini" -> GEMINI;
            case "ollama" -> OLLAMA;
            default -> throw new IllegalArgumentException("Unsupported translation provider: " + value);
        };
    }
}
