package ai.srt.translator.translate;

import java.util.ArrayList;
import java.util.List;

/**
 * Client used for dry runs that returns the original texts without invoking remote APIs.
 */
public class PassThroughTranslationClient implements TranslationClient {

    @Override
    public List<String> translateBatch(TranslationRequest request) {
        return new ArrayList<>(request.texts());
    }
}
