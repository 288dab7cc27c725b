package ai.srt.translator.cli;

import ai.srt.translator.config.Config;
import ai.srt.translator.config.ConfigLoader;
import ai.srt.translator.config.ConfigStore;
import ai.srt.translator.config.ConfigStoreException;
import ai.srt.translator.config.JsonFileConfigStore;
import ai.srt.translator.config.RetryPolicy;
import ai.srt.translator.config.SystemEnvironmentReader;
import ai.srt.translator.config.TranslatorConfig;
import ai.srt.translator.logging.LoggingConfigurator;
import ai.srt.translator.quota.QuotaGuard;
import ai.srt.translator.quota.QuotaStatus;
import ai.srt.translator.session.SessionException;
import ai.srt.translator.session.TranslationSession;
import ai.srt.translator.subtitle.SrtCodec;
import ai.srt.translator.subtitle.SubtitleException;
import ai.srt.translator.translate.ChatModelTranslationClient;
import ai.srt.translator.translate.DeepLTranslationClient;
import ai.srt.translator.translate.MockTranslationClient;
import ai.srt.translator.translate.PassThroughTranslationClient;
import ai.srt.translator.translate.ProviderUsage;
import ai.srt.translator.translate.RetryingTranslationClient;
import ai.srt.translator.translate.TranslationClient;
import ai.srt.translator.translate.TranslationClientFactory;
import ai.srt.translator.translate.TranslationException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and translation session.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID_CONFIG = 2;
    static final int EXIT_SUBTITLE_DEFECT = 3;
    static final int EXIT_PRECONDITION = 4;
    static final int EXIT_PROVIDER_FAILURE = 5;
    static final int EXIT_IO_FAILURE = 6;

    private final ConfigLoader configLoader;
    private final BiFunction<Config, ConfigStore, TranslationClient> productionClientFactory;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), CliApplication::createProductionClient);
    }

    CliApplication(ConfigLoader configLoader, BiFunction<Config, ConfigStore, TranslationClient> productionClientFactory) {
        this.configLoader = configLoader;
        this.productionClientFactory = productionClientFactory;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        try {
            Config config = configLoader.load(cliArguments);
            LoggingConfigurator.configure(config.logFormat());
            return execute(config, commandLine);
        } catch (SubtitleException ex) {
            LOGGER.error("Invalid subtitle file: {}", ex.getMessage());
            return EXIT_SUBTITLE_DEFECT;
        } catch (SessionException ex) {
            LOGGER.error("Cannot translate ({}): {}", ex.reason(), ex.getMessage());
            return EXIT_PRECONDITION;
        } catch (TranslationException ex) {
            LOGGER.error("Translation provider failed ({}): {}", ex.failure(), ex.detail());
            return EXIT_PROVIDER_FAILURE;
        } catch (CharacterCodingException ex) {
            LOGGER.error("Invalid subtitle file: input is not valid UTF-8 ({})", ex.getMessage());
            return EXIT_SUBTITLE_DEFECT;
        } catch (IOException | UncheckedIOException | ConfigStoreException ex) {
            LOGGER.error("I/O failure: {}", ex.getMessage(), ex);
            return EXIT_IO_FAILURE;
        } catch (IllegalArgumentException | IllegalStateException ex) {
            LOGGER.error("Invalid configuration: {}", ex.getMessage());
            commandLine.getErr().println(ex.getMessage());
            return EXIT_INVALID_CONFIG;
        }
    }

    private int execute(Config config, CommandLine commandLine) throws IOException {
        ConfigStore configStore = new JsonFileConfigStore(config.configFile());

        if (config.apiKeyToSave().isPresent()) {
            configStore.set(ConfigStore.DEEPL_API_KEY, config.apiKeyToSave().get());
            LOGGER.info("Stored DeepL API key in {}", config.configFile());
        }

        if (config.showUsage()) {
            ProviderUsage usage = createDeepLClient(config.translatorConfig(), configStore).usage();
            commandLine.getOut().printf("DeepL usage: %d of %d characters (%d remaining)%n",
                    usage.characterCount(), usage.characterLimit(), usage.remaining());
            commandLine.getOut().flush();
        }

        if (config.inputFile().isEmpty()) {
            return EXIT_OK;
        }
        Path input = config.inputFile().get();
        Path output = config.resolvedOutputFile().orElseThrow();
        LOGGER.info("Translating {} with {} ({} mode) into {}", input, config.translatorConfig().provider(),
                config.translationMode(), output);

        TranslationClientFactory clientFactory = new TranslationClientFactory(
                () -> productionClientFactory.apply(config, configStore),
                new PassThroughTranslationClient(),
                new MockTranslationClient());
        TranslationSession session = new TranslationSession(new SrtCodec(), new QuotaGuard(config.quotaLimit()),
                clientFactory.select(config.translationMode()), configStore);

        QuotaStatus loaded = session.load(Files.readString(input, StandardCharsets.UTF_8));
        LOGGER.info("{} cues, {} of {} characters", session.cues().size(), loaded.totalChars(), loaded.limit());
        session.translate(config.sourceLang().orElse(null), config.targetLang().orElse(null));
        session.save(content -> Files.writeString(output, content, StandardCharsets.UTF_8));
        LOGGER.info("Wrote {}", output);
        return EXIT_OK;
    }

    private static TranslationClient createProductionClient(Config config, ConfigStore configStore) {
        TranslatorConfig translatorConfig = config.translatorConfig();
        TranslationClient client = switch (translatorConfig.provider()) {
            case DEEPL -> createDeepLClient(translatorConfig, configStore);
            case GEMINI -> new ChatModelTranslationClient(createGeminiChatModel(translatorConfig, configStore),
                    translatorConfig.provider().name(), translatorConfig.modelName());
            case OLLAMA -> new ChatModelTranslationClient(createOllamaChatModel(translatorConfig),
                    translatorConfig.provider().name(), translatorConfig.modelName());
        };
        RetryPolicy retryPolicy = config.retryPolicy();
        return new RetryingTranslationClient(client, retryPolicy.maxAttempts(), retryPolicy.initialBackoffSeconds(),
                retryPolicy.maxBackoffSeconds(), retryPolicy.jitterFactor());
    }

    private static DeepLTranslationClient createDeepLClient(TranslatorConfig translatorConfig, ConfigStore configStore) {
        return new DeepLTranslationClient(configStore, translatorConfig.baseUrl().map(URI::create));
    }

    private static ChatModel createOllamaChatModel(TranslatorConfig translatorConfig) {
        try {
            String baseUrl = translatorConfig.baseUrl()
                    .orElseThrow(() -> new IllegalStateException("OLLAMA_BASE_URL must be configured when TRANSLATION_PROVIDER=ollama"));
            LOGGER.info("Using Ollama model '{}' via {}", translatorConfig.modelName(), baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(translatorConfig.modelName())
                    .temperature(0.1)
                    .timeout(Duration.ofMinutes(2))
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }

    private static ChatModel createGeminiChatModel(TranslatorConfig translatorConfig, ConfigStore configStore) {
        String apiKey = configStore.get(ConfigStore.GEMINI_API_KEY)
                .orElseThrow(() -> new IllegalStateException(ConfigStore.GEMINI_API_KEY + " must be stored when TRANSLATION_PROVIDER=gemini"));
        try {
            LOGGER.info("Using Gemini model '{}'", translatorConfig.modelName());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(translatorConfig.modelName())
                    .temperature(0.1)
                    .timeout(Duration.ofMinutes(2))
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }
}
