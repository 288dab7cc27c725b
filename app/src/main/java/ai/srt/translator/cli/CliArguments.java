package ai.srt.translator.cli;

import ai.srt.translator.config.LogFormat;
import ai.srt.translator.config.TranslationProvider;
import ai.srt.translator.translate.TranslationMode;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "srt-translator", mixinStandardHelpOptions = true,
        description = "Translates SubRip subtitle files while preserving cue timing")
public class CliArguments {

    @CommandLine.Option(names = {"-i", "--input"}, description = "Subtitle file to translate", paramLabel = "FILE")
    private Path inputFile;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Where to write the translated file (default: <name>.<target>.srt)", paramLabel = "FILE")
    private Path outputFile;

    @CommandLine.Option(names = {"-s", "--source-lang"}, description = "Source language code; detected by the provider when omitted", paramLabel = "LANG")
    private String sourceLang;

    @CommandLine.Option(names = {"-t", "--target-lang"}, description = "Target language code, e.g. JA or EN-US", paramLabel = "LANG")
    private String targetLang;

    @CommandLine.Option(names = "--quota-limit", description = "Maximum characters allowed in one translation", paramLabel = "CHARS")
    private Long quotaLimit;

    @CommandLine.Option(names = "--provider", description = "Translation provider: deepl, gemini or ollama", converter = TranslationProviderConverter.class)
    private TranslationProvider provider;

    @CommandLine.Option(names = "--translation-mode", description = "Translation execution mode: production, dry-run, or mock", converter = TranslationModeConverter.class)
    private TranslationMode translationMode;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = "--config-file", description = "Settings file holding the API key (default: config.json)", paramLabel = "FILE")
    private Path configFile;

    @CommandLine.Option(names = "--save-api-key", description = "Store the DeepL API key in the settings file", paramLabel = "KEY")
    private String apiKeyToSave;

    @CommandLine.Option(names = "--show-usage", description = "Print DeepL character usage for the current period")
    private boolean showUsage;

    public Path inputFile() {
        return inputFile;
    }

    public Path outputFile() {
        return outputFile;
    }

    public String sourceLang() {
        return sourceLang;
    }

    public String targetLang() {
        return targetLang;
    }

    public Long quotaLimit() {
        return quotaLimit;
    }

    public TranslationProvider provider() {
        return provider;
    }

    public TranslationMode translationMode() {
        return translationMode;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public Path configFile() {
        return configFile;
    }

    public String apiKeyToSave() {
        return apiKeyToSave;
    }

    public boolean showUsage() {
        return showUsage;
    }
}
