package com.chunkvault.core.record;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Small, frequently read part of a record. Chunk contents and large objects are stored
 * separately; the metadata only tracks their shape.
 *
 * <p>Timestamps are assigned by {@link RecordStore#saveMetadata}.
 */
public record RecordMetadata(
        String id,
        String name,
        RecordStatus status,
        Map<ChunkType, ChunkManifest> chunks,
        Set<LargeObjectKind> largeObjects,
        Map<String, Object> attributes,
        int storageVersion,
        Instant createdAt,
        Instant updatedAt
) {

    public static final int STORAGE_VERSION = 2;

    public RecordMetadata {
        Objects.requireNonNull(id, "id cannot be null");
        status = status == null ? RecordStatus.ACTIVE : status;
        chunks = chunks == null || chunks.isEmpty()
                ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(chunks));
        largeObjects = largeObjects == null || largeObjects.isEmpty()
                ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(largeObjects));
        attributes = attributes == null
                ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        storageVersion = storageVersion == 0 ? STORAGE_VERSION : storageVersion;
    }

    public static RecordMetadata create(String id, String name) {
        return new RecordMetadata(id, name, RecordStatus.ACTIVE, Map.of(), Set.of(), Map.of(),
                STORAGE_VERSION, null, null);
    }

    /** Manifest of {@code type}, empty if nothing was written yet. */
    public ChunkManifest manifest(ChunkType type) {
        ChunkManifest manifest = chunks.get(type);
        return manifest != null ? manifest : ChunkManifest.empty(type);
    }

    public RecordMetadata withName(String newName) {
        return new RecordMetadata(id, newName, status, chunks, largeObjects, attributes,
                storageVersion, createdAt, updatedAt);
    }

    public RecordMetadata withStatus(RecordStatus newStatus) {
        return new RecordMetadata(id, name, newStatus, chunks, largeObjects, attributes,
                storageVersion, createdAt, updatedAt);
    }

    public RecordMetadata withAttribute(String key, Object value) {
        Map<String, Object> updated = new LinkedHashMap<>(attributes);
        updated.put(key, value);
        return new RecordMetadata(id, name, status, chunks, largeObjects, updated,
                storageVersion, createdAt, updatedAt);
    }

    public RecordMetadata withManifest(ChunkType type, ChunkManifest manifest) {
        Map<ChunkType, ChunkManifest> updated = new EnumMap<>(ChunkType.class);
        updated.putAll(chunks);
        updated.put(type, manifest);
        return new RecordMetadata(id, name, status, updated, largeObjects, attributes,
                storageVersion, createdAt, updatedAt);
    }

    public RecordMetadata withLargeObject(LargeObjectKind kind) {
        Set<LargeObjectKind> updated = EnumSet.of(kind);
        updated.addAll(largeObjects);
        return new RecordMetadata(id, name, status, chunks, updated, attributes,
                storageVersion, createdAt, updatedAt);
    }

    public RecordMetadata withStorageVersion(int version) {
        return new RecordMetadata(id, name, status, chunks, largeObjects, attributes,
                version, createdAt, updatedAt);
    }

    RecordMetadata stamped(Instant created, Instant now) {
        return new RecordMetadata(id, name, status, chunks, largeObjects, attributes,
                storageVersion, created, now);
    }
}
