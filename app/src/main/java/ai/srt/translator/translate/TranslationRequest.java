package ai.srt.translator.translate;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered batch of texts to translate. Results are matched back to the texts by position only.
 */
public record TranslationRequest(List<String> texts, Optional<String> sourceLang, String targetLang) {

    public TranslationRequest {
        texts = List.copyOf(Objects.requireNonNull(texts, "texts"));
        sourceLang = sourceLang == null ? Optional.empty() : sourceLang.filter(value -> !value.isBlank());
        if (targetLang == null || targetLang.isBlank()) {
            throw new IllegalArgumentException("targetLang must not be blank");
        }
    }

    public int size() {
        return texts.size();
    }
}
