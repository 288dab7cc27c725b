package ai.srt.translator.session;

/**
 * Lifecycle states of a {@link TranslationSession}.
 */
public enum SessionState {
    /** No document loaded. */
    IDLE,
    /** A document is present, translated or not. */
    LOADED,
    /** A batch is in flight at the translation provider. */
    TRANSLATING,
    /** The document is being serialized and handed to a sink. */
    SAVING
}
