package ai.srt.translator.session;

import ai.srt.translator.config.ConfigStore;
import ai.srt.translator.quota.QuotaGuard;
import ai.srt.translator.quota.QuotaStatus;
import ai.srt.translator.session.SessionException.Reason;
import ai.srt.translator.subtitle.Cue;
import ai.srt.translator.subtitle.CueDocument;
import ai.srt.translator.subtitle.SrtCodec;
import ai.srt.translator.subtitle.SubtitleException;
import ai.srt.translator.translate.TranslationClient;
import ai.srt.translator.translate.TranslationException;
import ai.srt.translator.translate.TranslationException.Failure;
import ai.srt.translator.translate.TranslationRequest;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Holds one subtitle document through load, translation and save.
 *
 * <p>A session exclusively owns its document. It is not thread-safe: callers must not start a second
 * operation while {@link #translate} or {@link #save} is running.
 */
public class TranslationSession {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationSession.class);
    static final String MDC_STATE_KEY = "session.state";

    private final SrtCodec codec;
    private final QuotaGuard quotaGuard;
    private final TranslationClient client;
    private final ConfigStore configStore;

    private SessionState state = SessionState.IDLE;
    private CueDocument document;
    private QuotaStatus quotaStatus;

    public TranslationSession(SrtCodec codec, QuotaGuard quotaGuard, TranslationClient client, ConfigStore configStore) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.quotaGuard = Objects.requireNonNull(quotaGuard, "quotaGuard");
        this.client = Objects.requireNonNull(client, "client");
        this.configStore = Objects.requireNonNull(configStore, "configStore");
    }

    public SessionState state() {
        return state;
    }

    public boolean hasDocument() {
        return document != null;
    }

    /**
     * Snapshot of the current document, detached from the session.
     */
    public Optional<CueDocument> document() {
        return Optional.ofNullable(document).map(CueDocument::copy);
    }

    /**
     * Cues as they are now; later translations do not show through the returned list.
     */
    public List<Cue> cues() {
        return document == null ? List.of() : List.copyOf(document.cues());
    }

    public Optional<QuotaStatus> quotaStatus() {
        return Optional.ofNullable(quotaStatus);
    }

    /**
     * Parses raw subtitle text and replaces any previously loaded document.
     *
     * @throws SubtitleException when the text is not a valid subtitle file; the session is then idle
     */
    public QuotaStatus load(String raw) {
        CueDocument parsed;
        try {
            parsed = codec.parse(raw);
        } catch (SubtitleException ex) {
            reset();
            LOGGER.warn("Rejected subtitle input: {}", ex.getMessage());
            throw ex;
        }
        document = parsed;
        quotaStatus = quotaGuard.classify(parsed);
        state = SessionState.LOADED;
        LOGGER.info("Loaded {} cues ({} characters, quota {})", parsed.size(), quotaStatus.totalChars(), quotaStatus.verdict());
        return quotaStatus;
    }

    /**
     * Translates every cue text in one batch and replaces the texts by position.
     *
     * <p>Preconditions are checked in order: document, credential, quota, target language. On any
     * failure the document is left exactly as it was.
     *
     * @param sourceLang source language code, or {@code null}/blank to let the provider detect it
     * @param targetLang target language code
     * @throws SessionException when a precondition does not hold
     * @throws TranslationException when the provider call fails
     */
    public QuotaStatus translate(String sourceLang, String targetLang) {
        CueDocument current = requireDocument();
        client.credentialKey().ifPresent(this::requireCredential);

        QuotaStatus status = quotaGuard.classify(current);
        quotaStatus = status;
        switch (status.verdict()) {
            case EMPTY -> throw new SessionException(Reason.EMPTY_DOCUMENT, "Document has no text to translate");
            case EXCEEDED -> throw new QuotaExceededException(status.totalChars(), status.limit());
            case OK -> LOGGER.debug("Quota check passed: {}/{} characters", status.totalChars(), status.limit());
        }
        if (targetLang == null || targetLang.isBlank()) {
            throw new SessionException(Reason.MISSING_TARGET_LANGUAGE, "Target language must be provided");
        }

        TranslationRequest request = new TranslationRequest(current.texts(), Optional.ofNullable(sourceLang), targetLang.trim());
        state = SessionState.TRANSLATING;
        MDC.put(MDC_STATE_KEY, state.name());
        try {
            List<String> translated = client.translateBatch(request);
            if (translated == null || translated.size() != request.size()) {
                throw new TranslationException(Failure.PROVIDER_ERROR, "Provider returned "
                        + (translated == null ? 0 : translated.size()) + " texts for " + request.size() + " cues");
            }
            current.replaceTexts(translated);
            quotaStatus = quotaGuard.classify(current);
            LOGGER.info("Translated {} cues into {}", request.size(), request.targetLang());
            return quotaStatus;
        } catch (TranslationException ex) {
            LOGGER.error("Translation failed ({}): {}", ex.failure(), ex.detail());
            throw ex;
        } finally {
            state = SessionState.LOADED;
            MDC.remove(MDC_STATE_KEY);
        }
    }

    /**
     * Renders the current document as subtitle text. Available whether or not it has been translated.
     */
    public String serialize() {
        return codec.serialize(requireDocument());
    }

    /**
     * Serializes the document and hands it to {@code sink}.
     */
    public void save(SubtitleSink sink) throws IOException {
        Objects.requireNonNull(sink, "sink");
        String content = serialize();
        state = SessionState.SAVING;
        try {
            sink.write(content);
            LOGGER.info("Saved {} cues", document.size());
        } finally {
            state = SessionState.LOADED;
        }
    }

    private void reset() {
        document = null;
        quotaStatus = null;
        state = SessionState.IDLE;
    }

    private CueDocument requireDocument() {
        if (document == null) {
            throw new SessionException(Reason.NO_DOCUMENT, "No subtitle document is loaded");
        }
        return document;
    }

    private void requireCredential(String key) {
        if (configStore.get(key).filter(value -> !value.isBlank()).isEmpty()) {
            throw new SessionException(Reason.MISSING_CREDENTIAL, "Credential '" + key + "' is not configured");
        }
    }
}
