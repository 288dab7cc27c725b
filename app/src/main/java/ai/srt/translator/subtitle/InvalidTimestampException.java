package ai.srt.translator.subtitle;

/**
 * Raised when a timestamp field is out of range or a cue ends before it starts.
 */
public class InvalidTimestampException extends SubtitleException {

    public InvalidTimestampException(String message) {
        super(message);
    }
}
