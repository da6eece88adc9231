package com.chunkvault.core.storage;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import java.util.Map;
import java.util.Optional;

/**
 * Persistence medium the storage engine writes through.
 *
 * <p>Keys are {@code /}-separated paths (for example {@code records/abc/metadata});
 * values are any Jackson-serializable object. A missing key is a normal outcome and
 * is reported as an empty {@link Optional} or {@code false}, never as an exception.
 *
 * <p>Implementations are selected at build time by {@code chunkvault.storage.type}.
 */
public interface StorageAdapter {

    /**
     * Writes (or overwrites) a value.
     *
     * @throws StorageException on I/O or serialization errors
     */
    Uni<Void> save(String key, Object value);

    /**
     * Writes several values. Implementations that support transactions apply all of
     * them or none; the default writes them one after another.
     *
     * @throws StorageException on I/O or serialization errors
     */
    default Uni<Void> saveAll(Map<String, ?> entries) {
        return Uni.createFrom().voidItem().invoke(() ->
                entries.forEach((key, value) -> save(key, value).await().indefinitely()));
    }

    /**
     * Reads a value, deserialized as {@code type}.
     *
     * @throws StorageException on I/O errors or when the stored value cannot be read
     */
    <T> Uni<Optional<T>> load(String key, Class<T> type);

    Uni<Boolean> exists(String key);

    /**
     * Deletes a value.
     *
     * @return {@code true} if the key existed
     */
    Uni<Boolean> delete(String key);

    /**
     * Lists all keys starting with {@code prefix}, in lexical order.
     */
    Multi<String> listKeys(String prefix);
}
