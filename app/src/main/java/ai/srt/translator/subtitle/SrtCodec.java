package ai.srt.translator.subtitle;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes SubRip ({@code .srt}) subtitle text.
 *
 * <p>A block is an index line, a {@code start --> end} line and zero or more text lines; blocks are
 * separated by blank lines. Input may use CRLF or LF and may carry a UTF-8 byte order mark. Output always
 * uses LF, renumbers cues from 1 and terminates every block with a blank line.
 */
public class SrtCodec {

    private static final Logger LOGGER = LoggerFactory.getLogger(SrtCodec.class);

    private static final String ARROW = "-->";
    private static final char BOM = '\uFEFF';
    private static final Pattern INDEX_PATTERN = Pattern.compile("\\d+");
    private static final Pattern TIMESTAMP_PATTERN = Pattern.compile("(\\d+):(\\d{2}):(\\d{2})[,.](\\d{3})");

    public CueDocument parse(String raw) {
        Objects.requireNonNull(raw, "raw");
        List<String> lines = splitLines(raw);
        List<Cue> cues = new ArrayList<>();
        int position = 0;
        while (position < lines.size()) {
            if (isBlank(lines.get(position))) {
                position++;
                continue;
            }
            int indexLineNumber = position + 1;
            int index = parseIndex(lines.get(position), indexLineNumber);
            position++;

            if (position >= lines.size() || isBlank(lines.get(position)) || !lines.get(position).contains(ARROW)) {
                throw new MalformedSubtitleException("cue " + index + " is missing its timestamp line", position + 1);
            }
            String timingLine = lines.get(position);
            int timingLineNumber = position + 1;
            position++;

            List<String> textLines = new ArrayList<>();
            while (position < lines.size() && !isBlank(lines.get(position))) {
                textLines.add(lines.get(position));
                position++;
            }
            cues.add(buildCue(index, timingLine, timingLineNumber, String.join("\n", textLines)));
        }
        LOGGER.debug("Parsed {} cues from {} lines", cues.size(), lines.size());
        return new CueDocument(cues);
    }

    public String serialize(CueDocument document) {
        Objects.requireNonNull(document, "document");
        StringBuilder builder = new StringBuilder();
        int number = 1;
        for (Cue cue : document.cues()) {
            cue.validate();
            builder.append(number++).append('\n')
                    .append(cue.start().format()).append(' ').append(ARROW).append(' ').append(cue.end().format()).append('\n')
                    .append(cue.text()).append('\n')
                    .append('\n');
        }
        return builder.toString();
    }

    private Cue buildCue(int index, String timingLine, int lineNumber, String text) {
        int arrow = timingLine.indexOf(ARROW);
        Timestamp start = parseTimestamp(timingLine.substring(0, arrow), lineNumber);
        Timestamp end = parseTimestamp(timingLine.substring(arrow + ARROW.length()), lineNumber);
        try {
            return new Cue(index, start, end, text).validate();
        } catch (InvalidTimestampException ex) {
            throw new InvalidTimestampException("Line " + lineNumber + ": " + ex.getMessage());
        }
    }

    private Timestamp parseTimestamp(String raw, int lineNumber) {
        String value = raw.strip();
        // Some tools append positioning hints after the end time, e.g. "X1:40 X2:600".
        int space = value.indexOf(' ');
        if (space > 0) {
            value = value.substring(0, space);
        }
        Matcher matcher = TIMESTAMP_PATTERN.matcher(value);
        if (!matcher.matches()) {
            throw new MalformedSubtitleException("cannot split timestamp line into start and end: '" + raw.strip() + "'", lineNumber);
        }
        try {
            return new Timestamp(
                    Integer.parseInt(matcher.group(1)),
                    Integer.parseInt(matcher.group(2)),
                    Integer.parseInt(matcher.group(3)),
                    Integer.parseInt(matcher.group(4)));
        } catch (NumberFormatException ex) {
            throw new MalformedSubtitleException("timestamp out of range: '" + value + "'", lineNumber, ex);
        } catch (InvalidTimestampException ex) {
            throw new InvalidTimestampException("Line " + lineNumber + ": " + ex.getMessage());
        }
    }

    private int parseIndex(String line, int lineNumber) {
        String value = line.strip();
        if (!INDEX_PATTERN.matcher(value).matches()) {
            throw new MalformedSubtitleException("expected a cue index but found '" + value + "'", lineNumber);
        }
        try {
            int index = Integer.parseInt(value);
            if (index < 1) {
                throw new MalformedSubtitleException("cue index must be positive: " + value, lineNumber);
            }
            return index;
        } catch (NumberFormatException ex) {
            throw new MalformedSubtitleException("cue index out of range: " + value, lineNumber, ex);
        }
    }

    private static List<String> splitLines(String raw) {
        String content = raw;
        if (!content.isEmpty() && content.charAt(0) == BOM) {
            content = content.substring(1);
        }
        content = content.replace("\r\n", "\n").replace('\r', '\n');
        List<String> lines = new ArrayList<>(List.of(content.split("\n", -1)));
        while (!lines.isEmpty() && isBlank(lines.get(lines.size() - 1))) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    private static boolean isBlank(String line) {
        return line.isBlank();
    }
}
