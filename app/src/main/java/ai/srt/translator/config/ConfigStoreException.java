package ai.srt.translator.config;

/**
 * Raised when the config store cannot be read or written.
 */
public class ConfigStoreException extends RuntimeException {

    public ConfigStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
