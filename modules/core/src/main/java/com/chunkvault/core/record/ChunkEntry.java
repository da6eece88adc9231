package com.chunkvault.core.record;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of a chunk. Binary payloads never live here: {@code attachmentHash} holds the
 * hex content hash of the blob in the content store, or null.
 */
public record ChunkEntry(String id, String attachmentHash, Map<String, Object> data) {

    public ChunkEntry {
        Objects.requireNonNull(id, "id cannot be null");
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static ChunkEntry of(String id, Map<String, Object> data) {
        return new ChunkEntry(id, null, data);
    }

    public ChunkEntry withAttachment(String hash) {
        return new ChunkEntry(id, hash, data);
    }
}
