package com.chunkvault.core.queue;

import java.util.Map;

/**
 * @param pending    items not yet in a terminal state and not being written right now,
 *                   including items waiting out a retry delay
 * @param byPriority items sitting in each tier's queue
 * @param byType     items ever enqueued, per type
 * @param batched    writes that shared a {@code saveAll} with an earlier item of their batch
 * @param superseded items replaced by a newer write of the same key before they started
 */
public record QueueStats(
        int pending,
        int processing,
        long completed,
        long failed,
        long dropped,
        Map<QueuePriority, Integer> byPriority,
        Map<QueueItemType, Long> byType,
        long batched,
        long superseded
) {

    public QueueStats {
        byPriority = Map.copyOf(byPriority);
        byType = Map.copyOf(byType);
    }
}
