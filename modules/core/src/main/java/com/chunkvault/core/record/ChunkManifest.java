package com.chunkvault.core.record;

/**
 * Shape of one chunked collection: total entries, chunks written and entries per chunk.
 */
public record ChunkManifest(int count, int chunkCount, int chunkSize) {

    public ChunkManifest {
        if (count < 0 || chunkCount < 0) {
            throw new IllegalArgumentException("count and chunkCount cannot be negative");
        }
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
    }

    public static ChunkManifest empty(ChunkType type) {
        return new ChunkManifest(0, 0, type.chunkSize());
    }

    public static ChunkManifest forCount(int count, int chunkSize) {
        return new ChunkManifest(count, (count + chunkSize - 1) / chunkSize, chunkSize);
    }
}
