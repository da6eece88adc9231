package com.chunkvault.core.queue;

/**
 * What a queued write stores. Consecutive writes of a batchable type that share a group
 * are persisted with one {@code saveAll}.
 */
public enum QueueItemType {
    /** Standalone value (metadata, large objects). */
    SIMPLE(false),
    /** One chunk of a record; grouped by record id. */
    CHUNK(true),
    /** Index entries. */
    INDEX(true);

    private final boolean batchable;

    QueueItemType(boolean batchable) {
        this.batchable = batchable;
    }

    public boolean batchable() {
        return batchable;
    }
}
