package ai.srt.translator.translate;

import java.util.ArrayList;
import java.util.List;

/**
 * Mock client that tags every text with the target language.
 */
public class MockTranslationClient implements TranslationClient {

    @Override
    public List<String> translateBatch(TranslationRequest request) {
        List<String> result = new ArrayList<>(request.size());
        for (String text : request.texts()) {
            result.add("[" + request.targetLang() + "] " + text);
        }
        return result;
    }
}
