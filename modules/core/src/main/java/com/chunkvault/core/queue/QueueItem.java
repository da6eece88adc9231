package com.chunkvault.core.queue;

import java.time.Instant;
import java.util.Objects;

/**
 * One pending write. Immutable; every retry produces a copy with an incremented
 * {@code retries} count and the failure that caused it.
 *
 * @param group    batching group, the owning record id for chunk writes (may be null)
 * @param value    value to store, null for deletes
 * @param retries  number of retries already scheduled
 * @param lastError most recent failure, null before the first one
 */
public record QueueItem(
        String id,
        QueuePriority priority,
        QueueItemType type,
        QueueOperation operation,
        String key,
        Object value,
        String group,
        int retries,
        Instant enqueuedAt,
        WriteError lastError
) {

    public QueueItem {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(priority, "priority");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(key, "key");
        if (operation == QueueOperation.PUT && value == null) {
            throw new IllegalArgumentException("PUT of " + key + " needs a value");
        }
    }

    /** Can share a {@code saveAll} with neighbouring items of the same type and group. */
    public boolean batchable() {
        return operation == QueueOperation.PUT && type.batchable();
    }

    boolean batchesWith(QueueItem other) {
        return batchable() && other.batchable()
                && type == other.type
                && Objects.equals(group, other.group);
    }

    QueueItem retried(WriteError error) {
        return new QueueItem(id, priority, type, operation, key, value, group,
                retries + 1, enqueuedAt, error);
    }

    QueueItem withPriority(QueuePriority newPriority) {
        return new QueueItem(id, newPriority, type, operation, key, value, group,
                retries, enqueuedAt, lastError);
    }

    QueueItem failed(WriteError error) {
        return new QueueItem(id, priority, type, operation, key, value, group,
                retries, enqueuedAt, error);
    }
}
