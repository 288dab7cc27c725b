package ai.srt.translator.quota;

import java.util.Objects;

/**
 * Character volume of a document and how it compares to the limit. Derived, never persisted.
 */
public record QuotaStatus(long totalChars, long limit, QuotaVerdict verdict) {

    public QuotaStatus {
        if (totalChars < 0) {
            throw new IllegalArgumentException("totalChars must not be negative");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        Objects.requireNonNull(verdict, "verdict");
    }
}
