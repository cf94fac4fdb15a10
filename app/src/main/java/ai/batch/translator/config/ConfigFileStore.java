package ai.batch.translator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads and saves {@link StoredSettings} as pretty-printed JSON.
 */
public class ConfigFileStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigFileStore.class);

    private final ObjectMapper objectMapper;

    public ConfigFileStore() {
        this(new ObjectMapper());
    }

    public ConfigFileStore(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper").copy()
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Optional<StoredSettings> load(Path file) {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            String json = Files.readString(file, StandardCharsets.UTF_8);
            if (json.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, StoredSettings.class));
        } catch (IOException ex) {
            throw new IllegalArgumentException("Invalid config file " + file + ": " + ex.getMessage(), ex);
        }
    }

    public void save(Path file, StoredSettings settings) {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(settings, "settings");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, objectMapper.writeValueAsString(settings), StandardCharsets.UTF_8);
            LOGGER.info("Saved settings to {}", file);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to save config file: " + file, ex);
        }
    }
}
