package ai.srt.translator.quota;

/**
 * Classification of a document's character volume against the provider limit.
 */
public enum QuotaVerdict {
    EMPTY,
    OK,
    EXCEEDED
}
