package com.chunkvault.core.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Volatile StorageAdapter for tests and throwaway runs.
 *
 * <p>Values are kept as JSON trees so that reads see a copy with the same shape a
 * durable medium would return, never the caller's object.
 */
@Singleton
@IfBuildProperty(name = "chunkvault.storage.type", stringValue = "memory")
public class InMemoryStorageAdapter implements StorageAdapter {

    private final ConcurrentSkipListMap<String, JsonNode> entries = new ConcurrentSkipListMap<>();
    private final ObjectMapper mapper;

    @Inject
    public InMemoryStorageAdapter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public Uni<Void> save(String key, Object value) {
        return Uni.createFrom().voidItem().invoke(() -> {
            StorageKeys.requireValid(key);
            try {
                entries.put(key, mapper.valueToTree(value));
            } catch (IllegalArgumentException e) {
                throw new StorageException("Failed to serialize value for: " + key, e);
            }
        });
    }

    @Override
    public <T> Uni<Optional<T>> load(String key, Class<T> type) {
        return Uni.createFrom().item(() -> {
            JsonNode node = entries.get(StorageKeys.requireValid(key));
            if (node == null) {
                return Optional.<T>empty();
            }
            try {
                return Optional.of(mapper.treeToValue(node, type));
            } catch (JsonProcessingException e) {
                throw new StorageException("Failed to read " + type.getSimpleName() + " from: " + key, e);
            }
        });
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return Uni.createFrom().item(() -> entries.containsKey(StorageKeys.requireValid(key)));
    }

    @Override
    public Uni<Boolean> delete(String key) {
        return Uni.createFrom().item(() -> entries.remove(StorageKeys.requireValid(key)) != null);
    }

    @Override
    public Multi<String> listKeys(String prefix) {
        return Multi.createFrom().items(() -> {
            List<String> keys = new ArrayList<>();
            for (String key : entries.tailMap(prefix, true).keySet()) {
                if (!key.startsWith(prefix)) {
                    break;
                }
                keys.add(key);
            }
            return keys.stream();
        });
    }

    /** Number of stored keys. */
    public int size() {
        return entries.size();
    }

    /** Removes everything. */
    public void clear() {
        entries.clear();
    }
}
