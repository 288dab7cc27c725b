package ai.srt.translator.config;

import ai.srt.translator.cli.CliArguments;
import ai.srt.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_SOURCE_LANG = "SRT_SOURCE_LANG";
    static final String ENV_TARGET_LANG = "SRT_TARGET_LANG";
    static final String ENV_QUOTA_LIMIT = "SRT_QUOTA_LIMIT";
    static final String ENV_CONFIG_FILE = "SRT_CONFIG_FILE";
    static final String ENV_TRANSLATION_PROVIDER = "TRANSLATION_PROVIDER";
    static final String ENV_TRANSLATION_MODE = "TRANSLATION_MODE";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_DEEPL_API_URL = "DEEPL_API_URL";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_MAX_RETRY_ATTEMPTS = "TRANSLATION_MAX_RETRY_ATTEMPTS";
    static final String ENV_INITIAL_BACKOFF_SECONDS = "TRANSLATION_INITIAL_BACKOFF_SECONDS";
    static final String ENV_MAX_BACKOFF_SECONDS = "TRANSLATION_MAX_BACKOFF_SECONDS";
    static final String ENV_RETRY_JITTER_FACTOR = "TRANSLATION_RETRY_JITTER_FACTOR";

    /** DeepL Free monthly character allowance. */
    static final long DEFAULT_QUOTA_LIMIT = 500_000L;
    static final String DEFAULT_CONFIG_FILE = "config.json";
    static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");

        Optional<String> sourceLang = firstNonBlank(arguments.sourceLang(), ENV_SOURCE_LANG);
        Optional<String> targetLang = firstNonBlank(arguments.targetLang(), ENV_TARGET_LANG);
        long quotaLimit = resolveQuotaLimit(arguments);
        TranslationMode translationMode = resolveTranslationMode(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);
        Path configFile = Optional.ofNullable(arguments.configFile())
                .or(() -> env(ENV_CONFIG_FILE).map(Path::of))
                .orElse(Path.of(DEFAULT_CONFIG_FILE));

        TranslationProvider provider = Optional.ofNullable(arguments.provider())
                .or(() -> env(ENV_TRANSLATION_PROVIDER).map(TranslationProvider::from))
                .orElse(TranslationProvider.DEEPL);
        String modelName = env(ENV_LLM_MODEL).orElse(provider.defaultModel());
        Optional<String> baseUrl = switch (provider) {
            case DEEPL -> env(ENV_DEEPL_API_URL);
            case OLLAMA -> Optional.of(env(ENV_OLLAMA_BASE_URL).orElse(DEFAULT_OLLAMA_BASE_URL));
            case GEMINI -> Optional.empty();
        };

        RetryPolicy retryPolicy = new RetryPolicy(
                envNumber(ENV_MAX_RETRY_ATTEMPTS, ConfigLoader::parseNonNegativeInteger).orElse(RetryPolicy.DEFAULT.maxAttempts()),
                envNumber(ENV_INITIAL_BACKOFF_SECONDS, ConfigLoader::parseNonNegativeInteger).orElse(RetryPolicy.DEFAULT.initialBackoffSeconds()),
                envNumber(ENV_MAX_BACKOFF_SECONDS, ConfigLoader::parseNonNegativeInteger).orElse(RetryPolicy.DEFAULT.maxBackoffSeconds()),
                envNumber(ENV_RETRY_JITTER_FACTOR, ConfigLoader::parseDouble).orElse(RetryPolicy.DEFAULT.jitterFactor()));

        return new Config(
                Optional.ofNullable(arguments.inputFile()),
                Optional.ofNullable(arguments.outputFile()),
                sourceLang,
                targetLang,
                quotaLimit,
                translationMode,
                logFormat,
                new TranslatorConfig(provider, modelName, baseUrl),
                retryPolicy,
                configFile,
                Optional.ofNullable(arguments.apiKeyToSave()),
                arguments.showUsage());
    }

    private long resolveQuotaLimit(CliArguments arguments) {
        Long cliLimit = arguments.quotaLimit();
        if (cliLimit != null) {
            if (cliLimit < 1) {
                throw new IllegalArgumentException("--quota-limit must be positive");
            }
            return cliLimit;
        }
        return env(ENV_QUOTA_LIMIT)
                .map(ConfigLoader::parsePositiveLong)
                .orElse(DEFAULT_QUOTA_LIMIT);
    }

    private TranslationMode resolveTranslationMode(CliArguments arguments) {
        TranslationMode cliMode = arguments.translationMode();
        if (cliMode != null) {
            return cliMode;
        }
        return env(ENV_TRANSLATION_MODE)
                .map(TranslationMode::from)
                .orElse(TranslationMode.PRODUCTION);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return env(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private Optional<String> firstNonBlank(String cliValue, String envKey) {
        if (isNotBlank(cliValue)) {
            return Optional.of(cliValue.trim());
        }
        return env(envKey);
    }

    private Optional<String> env(String key) {
        return environmentReader.get(key)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim);
    }

    private <T> Optional<T> envNumber(String key, Function<String, T> parser) {
        return env(key).map(raw -> {
            try {
                return parser.apply(raw);
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException(key + ": " + ex.getMessage(), ex);
            }
        });
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static long parsePositiveLong(String raw) {
        try {
            long value = Long.parseLong(raw);
            if (value < 1) {
                throw new IllegalArgumentException(ENV_QUOTA_LIMIT + " must be positive");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_QUOTA_LIMIT + " must be an integer", ex);
        }
    }

    private static int parseNonNegativeInteger(String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 0) {
                throw new IllegalArgumentException("value must be zero or greater");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("value must be an integer", ex);
        }
    }

    private static double parseDouble(String raw) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid double value: " + raw, ex);
        }
    }
}
