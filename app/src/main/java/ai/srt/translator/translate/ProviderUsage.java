package ai.srt.translator.translate;

/**
 * Characters consumed and allowed in the provider's current billing period.
 */
public record ProviderUsage(long characterCount, long characterLimit) {

    public long remaining() {
        return Math.max(0, characterLimit - characterCount);
    }
}
