package com.chunkvault.core.record;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A whole record in memory: metadata, every chunked collection and every large object.
 */
public record RecordSnapshot(
        RecordMetadata metadata,
        Map<ChunkType, List<ChunkEntry>> entries,
        Map<LargeObjectKind, Object> largeObjects
) {

    public RecordSnapshot {
        Objects.requireNonNull(metadata, "metadata");
        entries = entries == null ? Map.of() : Map.copyOf(entries);
        largeObjects = largeObjects == null ? Map.of() : Map.copyOf(largeObjects);
    }
}
