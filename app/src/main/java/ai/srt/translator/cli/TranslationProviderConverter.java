package ai.srt.translator.cli;

import ai.srt.translator.config.TranslationProvider;
import picocli.CommandLine;

public class TranslationProviderConverter implements CommandLine.ITypeConverter<TranslationProvider> {

    @Override
    public TranslationProvider convert(String value) {
        return TranslationProvider.from(value);
    }
}
