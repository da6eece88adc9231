package com.chunkvault.core.record;

/**
 * Entry collections a record is split into. Each collection is stored as fixed-size
 * chunks so appending one entry rewrites one chunk, not the whole collection.
 */
public enum ChunkType {
    SCREENSHOTS("screenshots", 20),
    AUDIO_SEGMENTS("audio-segments", 100),
    VIDEO_CHUNKS("video-chunks", 100);

    private final String path;
    private final int chunkSize;

    ChunkType(String path, int chunkSize) {
        this.path = path;
        this.chunkSize = chunkSize;
    }

    /** Segment used in storage and cache keys. */
    public String path() {
        return path;
    }

    /** Entries per chunk. */
    public int chunkSize() {
        return chunkSize;
    }
}
