package ai.srt.translator.subtitle;

import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * One timed subtitle entry. The index reflects position in its document and is re-derived on serialize.
 *
 * <p>Text lines are separated by LF and never blank, since a blank line terminates a block in the file.
 */
public record Cue(int index, Timestamp start, Timestamp end, String text) {

    private static final Pattern LINE_BREAK = Pattern.compile("\\R");

    public Cue {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        text = normalizeText(text);
    }

    /**
     * Checks the cue invariants.
     *
     * @throws InvalidTimestampException when the index is not positive or the cue ends before it starts
     */
    public Cue validate() {
        if (index < 1) {
            throw new InvalidTimestampException("cue index must be positive: " + index);
        }
        if (start.compareTo(end) > 0) {
            throw new InvalidTimestampException("cue " + index + " ends (" + end + ") before it starts (" + start + ")");
        }
        return this;
    }

    public Cue withText(String translatedText) {
        return new Cue(index, start, end, translatedText);
    }

    public Cue withIndex(int newIndex) {
        return new Cue(newIndex, start, end, text);
    }

    /**
     * Number of Unicode code points in the cue text.
     */
    public int charCount() {
        return text.codePointCount(0, text.length());
    }

    private static String normalizeText(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return LINE_BREAK.splitAsStream(text)
                .filter(line -> !line.isBlank())
                .collect(Collectors.joining("\n"));
    }
}
