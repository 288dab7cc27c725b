package ai.srt.translator.translate;

import ai.srt.translator.translate.TranslationException.Failure;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.TimeoutException;
import dev.langchain4j.model.chat.ChatModel;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translation client backed by a LangChain4j {@link ChatModel} implementation.
 *
 * <p>Texts are sent in a single prompt, each introduced by a numbered marker line, and the reply is
 * split on the same markers. Cue texts may span several lines, so markers rather than line counts
 * delimit the entries.
 */
public class ChatModelTranslationClient implements TranslationClient {

    private static final Pattern MARKER = Pattern.compile("^\\s*<<<(\\d+)>>>\\s*$");

    private final ChatModel model;
    private final String providerName;
    private final String modelName;

    public ChatModelTranslationClient(ChatModel model, String providerName, String modelName) {
        this.model = Objects.requireNonNull(model, "model");
        this.providerName = requireNonBlank(providerName, "providerName");
        this.modelName = requireNonBlank(modelName, "modelName");
    }

    @Override
    public List<String> translateBatch(TranslationRequest request) {
        Objects.requireNonNull(request, "request");
        if (request.texts().isEmpty()) {
            return List.of();
        }
        String response;
        try {
            response = model.chat(buildPrompt(request));
        } catch (RuntimeException ex) {
            throw classify(ex);
        }
        if (response == null || response.isBlank()) {
            throw new TranslationException(Failure.PROVIDER_ERROR, providerName + " returned an empty response");
        }
        return parseResponse(response, request.size());
    }

    String buildPrompt(TranslationRequest request) {
        StringBuilder entries = new StringBuilder();
        for (int i = 0; i < request.size(); i++) {
            entries.append("<<<").append(i + 1).append(">>>\n").append(request.texts().get(i)).append('\n');
        }
        String source = request.sourceLang().map(lang -> " from " + lang).orElse("");
        return """
Translate each subtitle entry below%s into the language with code %s.
Rules:
- Every entry starts with a marker line such as <<<1>>>. Repeat each marker line unchanged, followed by the translation of that entry.
- Keep the same number of entries and the same order. Never merge or split entries.
- Keep line breaks inside an entry where they make sense for subtitles.
- Output only the markers and translations. Do not add commentary.

""".formatted(source, request.targetLang()) + entries;
    }

    List<String> parseResponse(String response, int expectedCount) {
        List<String> result = new ArrayList<>(expectedCount);
        List<String> current = null;
        int expectedNumber = 1;
        for (String line : response.split("\\R", -1)) {
            Matcher matcher = MARKER.matcher(line);
            if (matcher.matches()) {
                int number = Integer.parseInt(matcher.group(1));
                if (number != expectedNumber) {
                    throw new TranslationException(Failure.PROVIDER_ERROR,
                            "%s reply has entry %d where %d was expected".formatted(providerName, number, expectedNumber));
                }
                if (current != null) {
                    result.add(joinEntry(current));
                }
                current = new ArrayList<>();
                expectedNumber++;
            } else if (current != null) {
                current.add(line.stripTrailing());
            }
        }
        if (current != null) {
            result.add(joinEntry(current));
        }
        if (result.size() != expectedCount) {
            throw new TranslationException(Failure.PROVIDER_ERROR,
                    "%s returned %d entries for %d texts".formatted(providerName, result.size(), expectedCount));
        }
        return result;
    }

    private static String joinEntry(List<String> lines) {
        int end = lines.size();
        while (end > 0 && lines.get(end - 1).isBlank()) {
            end--;
        }
        return String.join("\n", lines.subList(0, end)).strip();
    }

    private TranslationException classify(RuntimeException ex) {
        Throwable cause = ex;
        while (cause != null) {
            if (cause instanceof AuthenticationException) {
                return new TranslationException(Failure.AUTHENTICATION_FAILED, providerName + " rejected the credential", ex);
            }
            if (cause instanceof RateLimitException) {
                return new TranslationException(Failure.PROVIDER_ERROR, "429 rate limited by " + providerName, ex);
            }
            if (cause instanceof TimeoutException) {
                return new TranslationException(Failure.TRANSPORT_ERROR, providerName + " request timed out", ex);
            }
            if (cause instanceof ModelNotFoundException) {
                return new TranslationException(Failure.PROVIDER_ERROR,
                        "%s model '%s' is not available.".formatted(providerName, modelName), ex);
            }
            if (cause instanceof IOException) {
                return new TranslationException(Failure.TRANSPORT_ERROR, "Failed to reach " + providerName, ex);
            }
            cause = cause.getCause();
        }
        return new TranslationException(Failure.PROVIDER_ERROR, "LangChain translation failed: " + ex.getMessage(), ex);
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
