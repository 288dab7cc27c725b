package ai.srt.translator.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.srt.translator.config.Config;
import ai.srt.translator.config.ConfigLoader;
import ai.srt.translator.config.ConfigStore;
import ai.srt.translator.config.JsonFileConfigStore;
import ai.srt.translator.translate.TranslationClient;
import ai.srt.translator.translate.TranslationException;
import ai.srt.translator.translate.TranslationRequest;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    private static final String SUBTITLES = """
            1
            00:00:01,000 --> 00:00:02,500
            Hello

            2
            00:00:03,000 --> 00:00:04,000
            Good bye
            """;

    @TempDir
    Path tempDir;

    private Path input;
    private Path configFile;

    @BeforeEach
    void setUp() throws IOException {
        input = tempDir.resolve("episode.srt");
        Files.writeString(input, SUBTITLES, StandardCharsets.UTF_8);
        configFile = tempDir.resolve("config.json");
    }

    @Test
    void translatesFileInMockMode() throws IOException {
        CliApplication application = application((config, store) -> {
            throw new AssertionError("production client must not be created in mock mode");
        });

        int exitCode = application.run(args("--translation-mode", "mock", "-t", "JA"));

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
        assertThat(Files.readString(tempDir.resolve("episode.ja.srt"), StandardCharsets.UTF_8)).isEqualTo("""
                1
                00:00:01,000 --> 00:00:02,500
                [JA] Hello

                2
                00:00:03,000 --> 00:00:04,000
                [JA] Good bye

                """);
    }

    @Test
    void dryRunKeepsTextAndTiming() throws IOException {
        Path output = tempDir.resolve("out/copy.srt");
        Files.createDirectories(output.getParent());

        int exitCode = application(CliApplicationTest::unusedFactory)
                .run(args("--translation-mode", "dry-run", "-t", "DE", "-o", output.toString()));

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
        assertThat(Files.readString(output, StandardCharsets.UTF_8)).contains("Hello", "00:00:03,000 --> 00:00:04,000");
    }

    @Test
    void usesProductionClientWithStoredCredential() throws IOException {
        new JsonFileConfigStore(configFile).set(ConfigStore.DEEPL_API_KEY, "secret:fx");
        CliApplication application = application((config, store) -> new TranslationClient() {
            @Override
            public List<String> translateBatch(TranslationRequest request) {
                return request.texts().stream().map(text -> text.toUpperCase(Locale.ROOT)).collect(Collectors.toList());
            }

            @Override
            public Optional<String> credentialKey() {
                return Optional.of(ConfigStore.DEEPL_API_KEY);
            }
        });

        int exitCode = application.run(args("-t", "EN-US"));

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
        assertThat(Files.readString(tempDir.resolve("episode.en-us.srt"), StandardCharsets.UTF_8))
                .contains("HELLO", "GOOD BYE");
    }

    @Test
    void savesApiKeyWithoutInput() {
        int exitCode = application(CliApplicationTest::unusedFactory)
                .run(new String[] {"--config-file", configFile.toString(), "--save-api-key", "abc:fx"});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
        assertThat(new JsonFileConfigStore(configFile).get(ConfigStore.DEEPL_API_KEY)).contains("abc:fx");
    }

    @Test
    void missingCredentialIsPreconditionFailure() {
        CliApplication application = application((config, store) -> new TranslationClient() {
            @Override
            public List<String> translateBatch(TranslationRequest request) {
                throw new AssertionError("must not be called without a credential");
            }

            @Override
            public Optional<String> credentialKey() {
                return Optional.of(ConfigStore.DEEPL_API_KEY);
            }
        });

        int exitCode = application.run(args("-t", "JA"));

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_PRECONDITION);
        assertThat(tempDir.resolve("episode.ja.srt")).doesNotExist();
    }

    @Test
    void missingTargetLanguageIsPreconditionFailure() {
        int exitCode = application(CliApplicationTest::unusedFactory).run(args("--translation-mode", "mock"));

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_PRECONDITION);
    }

    @Test
    void quotaOverflowIsPreconditionFailure() {
        int exitCode = application(CliApplicationTest::unusedFactory)
                .run(args("--translation-mode", "mock", "-t", "JA", "--quota-limit", "5"));

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_PRECONDITION);
        assertThat(tempDir.resolve("episode.ja.srt")).doesNotExist();
    }

    @Test
    void malformedSubtitleFileIsReported() throws IOException {
        Files.writeString(input, "1\nnot a timing line\nHello\n", StandardCharsets.UTF_8);

        int exitCode = application(CliApplicationTest::unusedFactory).run(args("--translation-mode", "mock", "-t", "JA"));

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_SUBTITLE_DEFECT);
    }

    @Test
    void fileThatIsNotUtf8IsSubtitleDefect() throws IOException {
        byte[] latin1 = "1\n00:00:01,000 --> 00:00:02,000\nCaf\u00e9\n".getBytes(StandardCharsets.ISO_8859_1);
        Files.write(input, latin1);

        int exitCode = application(CliApplicationTest::unusedFactory).run(args("--translation-mode", "mock", "-t", "JA"));

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_SUBTITLE_DEFECT);
        assertThat(tempDir.resolve("episode.ja.srt")).doesNotExist();
    }

    @Test
    void providerFailureLeavesNoOutput() {
        CliApplication application = application((config, store) -> request -> {
            throw new TranslationException(TranslationException.Failure.QUOTA_EXCEEDED_REMOTE, "456: Quota exceeded");
        });

        int exitCode = application.run(args("-t", "JA"));

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_PROVIDER_FAILURE);
        assertThat(tempDir.resolve("episode.ja.srt")).doesNotExist();
    }

    @Test
    void missingInputFileIsIoFailure() {
        int exitCode = application(CliApplicationTest::unusedFactory).run(new String[] {
                "--config-file", configFile.toString(), "--translation-mode", "mock", "-t", "JA",
                "-i", tempDir.resolve("missing.srt").toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_IO_FAILURE);
    }

    @Test
    void missingInputOptionIsConfigurationError() {
        int exitCode = application(CliApplicationTest::unusedFactory)
                .run(new String[] {"--config-file", configFile.toString(), "-t", "JA"});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_INVALID_CONFIG);
    }

    @Test
    void unknownOptionIsRejected() {
        int exitCode = application(CliApplicationTest::unusedFactory).run(new String[] {"--no-such-option"});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_INVALID_CONFIG);
    }

    private String[] args(String... extra) {
        String[] base = {"--config-file", configFile.toString(), "-i", input.toString()};
        String[] all = new String[base.length + extra.length];
        System.arraycopy(base, 0, all, 0, base.length);
        System.arraycopy(extra, 0, all, base.length, extra.length);
        return all;
    }

    private static CliApplication application(BiFunction<Config, ConfigStore, TranslationClient> factory) {
        return new CliApplication(new ConfigLoader(key -> Optional.empty()), factory);
    }

    private static TranslationClient unusedFactory(Config config, ConfigStore store) {
        throw new AssertionError("production client must not be created");
    }
}
