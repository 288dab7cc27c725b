package ai.srt.translator.config;

import java.util.Optional;

/**
 * Abstraction over environment variable lookups so configuration can be tested without the process environment.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);
}
