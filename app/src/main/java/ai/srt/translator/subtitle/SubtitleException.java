package ai.srt.translator.subtitle;

/**
 * Base type for defects in subtitle input data.
 */
public abstract class SubtitleException extends RuntimeException {

    protected SubtitleException(String message) {
        super(message);
    }

    protected SubtitleException(String message, Throwable cause) {
        super(message, cause);
    }
}
