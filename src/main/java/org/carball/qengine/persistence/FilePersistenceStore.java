package org.carball.qengine.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.qengine.util.JsonMappers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Stores each key as a pretty-printed {@code <key>.json} file in one directory. Writes go to a
 * temporary file first and are moved into place.
 */
@Slf4j
public class FilePersistenceStore implements PersistenceStore {

    private static final Pattern VALID_KEY = Pattern.compile("[A-Za-z0-9_.-]+");

    private final Path directory;
    private final ObjectMapper mapper = JsonMappers.json();

    public FilePersistenceStore(Path directory) {
        this.directory = directory;
    }

    @Override
    public <T> Optional<T> load(String key, TypeReference<T> type) throws IOException {
        Path file = fileFor(key);
        if (!Files.exists(file)) {
            log.debug("No persisted state for {} at {}", key, file);
            return Optional.empty();
        }
        return Optional.ofNullable(mapper.readValue(file.toFile(), type));
    }

    @Override
    public synchronized void save(String key, Object value) throws IOException {
        Files.createDirectories(directory);
        Path target = fileFor(key);
        Path temp = directory.resolve(key + ".json.tmp");
        mapper.writeValue(temp.toFile(), value);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        log.debug("Persisted {} to {}", key, target);
    }

    private Path fileFor(String key) {
        if (!VALID_KEY.matcher(key).matches()) {
            throw new IllegalArgumentException("Invalid persistence key: " + key);
        }
        return directory.resolve(key + ".json");
    }
}
