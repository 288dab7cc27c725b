package ai.srt.translator.subtitle;

import java.util.Locale;

/**
 * Point in time of a subtitle cue, formatted as {@code HH:MM:SS,mmm}.
 */
public record Timestamp(int hours, int minutes, int seconds, int milliseconds) implements Comparable<Timestamp> {

    public Timestamp {
        if (hours < 0) {
            throw new InvalidTimestampException("hours must not be negative: " + hours);
        }
        if (minutes < 0 || minutes > 59) {
            throw new InvalidTimestampException("minutes must be between 0 and 59: " + minutes);
        }
        if (seconds < 0 || seconds > 59) {
            throw new InvalidTimestampException("seconds must be between 0 and 59: " + seconds);
        }
        if (milliseconds < 0 || milliseconds > 999) {
            throw new InvalidTimestampException("milliseconds must be between 0 and 999: " + milliseconds);
        }
    }

    public long toMillis() {
        return hours * 3_600_000L + minutes * 60_000L + seconds * 1_000L + milliseconds;
    }

    @Override
    public int compareTo(Timestamp other) {
        return Long.compare(toMillis(), other.toMillis());
    }

    /**
     * Formats as {@code HH:MM:SS,mmm}; hours widen beyond two digits when needed.
     */
    public String format() {
        return String.format(Locale.ROOT, "%02d:%02d:%02d,%03d", hours, minutes, seconds, milliseconds);
    }

    @Override
    public String toString() {
        return format();
    }
}
