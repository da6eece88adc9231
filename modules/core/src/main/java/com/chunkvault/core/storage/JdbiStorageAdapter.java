package com.chunkvault.core.storage;

import com.chunkvault.core.concurrent.StripedLocks;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Relational StorageAdapter: one row per key in {@code storage_entry}, value as JSON text.
 *
 * <p>{@link #saveAll(Map)} writes every entry in one transaction. Writers of the same key are
 * serialised by striped locks so update-then-insert never races into a duplicate row.
 */
@Singleton
@IfBuildProperty(name = "chunkvault.storage.type", stringValue = "jdbc")
public class JdbiStorageAdapter implements StorageAdapter {

    private static final Logger log = Logger.getLogger(JdbiStorageAdapter.class);

    private final Jdbi jdbi;
    private final ObjectMapper mapper;
    private final StripedLocks locks = new StripedLocks(64);

    @Inject
    public JdbiStorageAdapter(Jdbi jdbi, ObjectMapper mapper) {
        this.jdbi = jdbi;
        this.mapper = mapper;
        jdbi.useExtension(StorageEntryDao.class, StorageEntryDao::createTable);
        log.info("JDBC storage ready (table storage_entry)");
    }

    @Override
    public Uni<Void> save(String key, Object value) {
        return Uni.createFrom().voidItem().invoke(() -> {
            String json = serialize(StorageKeys.requireValid(key), value);
            locks.runWithLock(key, () -> execute("write " + key, () ->
                    jdbi.useTransaction(h -> upsert(h.attach(StorageEntryDao.class), key, json))));
        });
    }

    @Override
    public Uni<Void> saveAll(Map<String, ?> entries) {
        return Uni.createFrom().voidItem().invoke(() -> {
            Map<String, String> serialized = new LinkedHashMap<>();
            entries.forEach((key, value) ->
                    serialized.put(StorageKeys.requireValid(key), serialize(key, value)));
            locks.runWithLocks(serialized.keySet(), () ->
                    execute("write " + serialized.size() + " entries", () ->
                            jdbi.useTransaction(h -> {
                                StorageEntryDao dao = h.attach(StorageEntryDao.class);
                                serialized.forEach((key, json) -> upsert(dao, key, json));
                            })));
            log.debugf("Wrote %d entries in one transaction", serialized.size());
        });
    }

    @Override
    public <T> Uni<Optional<T>> load(String key, Class<T> type) {
        return Uni.createFrom().item(() -> {
            StorageKeys.requireValid(key);
            Optional<StorageEntryRecord> row = query("read " + key, () ->
                    jdbi.withExtension(StorageEntryDao.class, dao -> dao.findByKey(key)));
            if (row.isEmpty()) {
                return Optional.<T>empty();
            }
            try {
                return Optional.of(mapper.readValue(row.get().value(), type));
            } catch (JsonProcessingException e) {
                throw new StorageException("Failed to read " + type.getSimpleName() + " from: " + key, e);
            }
        });
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return Uni.createFrom().item(() -> query("check " + key, () ->
                jdbi.withExtension(StorageEntryDao.class,
                        dao -> dao.countByKey(StorageKeys.requireValid(key)) > 0)));
    }

    @Override
    public Uni<Boolean> delete(String key) {
        return Uni.createFrom().item(() -> query("delete " + key, () ->
                jdbi.withExtension(StorageEntryDao.class,
                        dao -> dao.delete(StorageKeys.requireValid(key)) > 0)));
    }

    @Override
    public Multi<String> listKeys(String prefix) {
        return Multi.createFrom().items(() -> {
            List<String> keys = query("list " + prefix, () ->
                    jdbi.withExtension(StorageEntryDao.class, dao -> prefix.isEmpty()
                            ? dao.listAllKeys()
                            : dao.listKeys(prefix, prefix.length())));
            return keys.stream();
        });
    }

    // -- internals --

    private static void upsert(StorageEntryDao dao, String key, String json) {
        Instant now = Instant.now();
        if (dao.update(key, json, now) == 0) {
            dao.insert(key, json, now);
        }
    }

    private String serialize(String key, Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize value for: " + key, e);
        }
    }

    private static void execute(String description, Runnable action) {
        try {
            action.run();
        } catch (JdbiException e) {
            throw new StorageException("Failed to " + description, e);
        }
    }

    private static <T> T query(String description, Supplier<T> action) {
        try {
            return action.get();
        } catch (JdbiException e) {
            throw new StorageException("Failed to " + description, e);
        }
    }
}
