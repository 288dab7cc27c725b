package ai.srt.translator.config;

import ai.srt.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Optional<Path> inputFile,
        Optional<Path> outputFile,
        Optional<String> sourceLang,
        Optional<String> targetLang,
        long quotaLimit,
        TranslationMode translationMode,
        LogFormat logFormat,
        TranslatorConfig translatorConfig,
        RetryPolicy retryPolicy,
        Path configFile,
        Optional<String> apiKeyToSave,
        boolean showUsage
) {

    private static final String SRT_EXTENSION = ".srt";

    public Config {
        inputFile = inputFile == null ? Optional.empty() : inputFile;
        outputFile = outputFile == null ? Optional.empty() : outputFile;
        sourceLang = normalizeLanguage(sourceLang);
        targetLang = normalizeLanguage(targetLang);
        if (quotaLimit < 1) {
            throw new IllegalArgumentException("quotaLimit must be positive");
        }
        translationMode = Objects.requireNonNull(translationMode, "translationMode");
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
        translatorConfig = Objects.requireNonNull(translatorConfig, "translatorConfig");
        retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        configFile = Objects.requireNonNull(configFile, "configFile");
        apiKeyToSave = apiKeyToSave == null ? Optional.empty() : apiKeyToSave.filter(value -> !value.isBlank());
        if (inputFile.isEmpty() && outputFile.isPresent()) {
            throw new IllegalArgumentException("--output requires --input");
        }
        if (inputFile.isEmpty() && apiKeyToSave.isEmpty() && !showUsage) {
            throw new IllegalArgumentException("an input subtitle file must be provided");
        }
    }

    /**
     * Explicit output path, or {@code <name>.<target>.srt} next to the input.
     */
    public Optional<Path> resolvedOutputFile() {
        if (outputFile.isPresent()) {
            return outputFile;
        }
        return inputFile.map(input -> {
            String name = input.getFileName().toString();
            String lower = name.toLowerCase(Locale.ROOT);
            String stem = lower.endsWith(SRT_EXTENSION) ? name.substring(0, name.length() - SRT_EXTENSION.length()) : name;
            String suffix = targetLang.map(lang -> "." + lang.toLowerCase(Locale.ROOT)).orElse(".translated");
            return input.resolveSibling(stem + suffix + SRT_EXTENSION);
        });
    }

    private static Optional<String> normalizeLanguage(Optional<String> value) {
        return value == null ? Optional.empty() : value.map(String::trim).filter(lang -> !lang.isEmpty());
    }
}
