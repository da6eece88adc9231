package com.chunkvault.core.record;

import java.util.List;
import java.util.Objects;

/**
 * Stored form of one chunk.
 */
public record RecordChunk(String recordId, ChunkType type, int index, List<ChunkEntry> entries) {

    public RecordChunk {
        Objects.requireNonNull(recordId, "recordId");
        Objects.requireNonNull(type, "type");
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}
