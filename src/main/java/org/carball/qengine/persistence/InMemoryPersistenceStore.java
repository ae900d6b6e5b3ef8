package org.carball.qengine.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.qengine.util.JsonMappers;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps serialized snapshots in memory. Values are stored as JSON so loaded objects never
 * alias the saved ones.
 */
public class InMemoryPersistenceStore implements PersistenceStore {

    private final Map<String, String> snapshots = new ConcurrentHashMap<>();
    private final ObjectMapper mapper = JsonMappers.json();

    @Override
    public <T> Optional<T> load(String key, TypeReference<T> type) throws IOException {
        String json = snapshots.get(key);
        if (json == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(mapper.readValue(json, type));
    }

    @Override
    public void save(String key, Object value) throws IOException {
        snapshots.put(key, mapper.writeValueAsString(value));
    }

    public boolean contains(String key) {
        return snapshots.containsKey(key);
    }
}
