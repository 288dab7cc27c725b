package ai.srt.translator.config;

import java.util.Optional;

/**
 * Reads values from {@link System#getenv(String)}.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(System.getenv(key));
    }
}
