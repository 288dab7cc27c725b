package ai.srt.translator.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Non-persistent store used for dry runs and tests.
 */
public class InMemoryConfigStore implements ConfigStore {

    private final Map<String, String> values = new LinkedHashMap<>();

    public InMemoryConfigStore() {
    }

    public InMemoryConfigStore(Map<String, String> initialValues) {
        values.putAll(Objects.requireNonNull(initialValues, "initialValues"));
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key)).filter(value -> !value.isBlank());
    }

    @Override
    public void set(String key, String value) {
        values.put(Objects.requireNonNull(key, "key"), value);
    }
}
