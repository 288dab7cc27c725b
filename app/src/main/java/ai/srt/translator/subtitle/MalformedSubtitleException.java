package ai.srt.translator.subtitle;

/**
 * Raised when raw subtitle text does not follow the block structure.
 */
public class MalformedSubtitleException extends SubtitleException {

    private final int lineNumber;

    public MalformedSubtitleException(String message, int lineNumber) {
        super("Line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    public MalformedSubtitleException(String message, int lineNumber, Throwable cause) {
        super("Line " + lineNumber + ": " + message, cause);
        this.lineNumber = lineNumber;
    }

    /**
     * 1-based line of the input where the defect was detected.
     */
    public int lineNumber() {
        return lineNumber;
    }
}
