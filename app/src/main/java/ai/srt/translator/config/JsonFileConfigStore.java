package ai.srt.translator.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists settings as a flat JSON object, e.g. {@code {"deepl_api_key": "..."}}.
 */
public class JsonFileConfigStore implements ConfigStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonFileConfigStore.class);
    private static final TypeReference<LinkedHashMap<String, String>> MAP_TYPE = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper mapper;

    public JsonFileConfigStore(Path file) {
        this(file, new ObjectMapper());
    }

    public JsonFileConfigStore(Path file, ObjectMapper mapper) {
        this.file = Objects.requireNonNull(file, "file");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public Optional<String> get(String key) {
        Objects.requireNonNull(key, "key");
        return Optional.ofNullable(readAll().get(key)).filter(value -> !value.isBlank());
    }

    @Override
    public void set(String key, String value) {
        Objects.requireNonNull(key, "key");
        Map<String, String> values = readAll();
        values.put(key, value == null ? "" : value);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), values);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            LOGGER.info("Saved setting '{}' to {}", key, file);
        } catch (IOException ex) {
            throw new ConfigStoreException("Failed to write config file " + file, ex);
        }
    }

    private Map<String, String> readAll() {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, String> values = mapper.readValue(file.toFile(), MAP_TYPE);
            return values == null ? new LinkedHashMap<>() : values;
        } catch (IOException ex) {
            throw new ConfigStoreException("Failed to read config file " + file, ex);
        }
    }
}
