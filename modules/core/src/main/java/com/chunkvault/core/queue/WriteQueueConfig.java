package com.chunkvault.core.queue;

import java.time.Duration;

/**
 * @param maxSize             most items held across all tiers before low items are shed
 * @param normalBatchInterval delay between a normal enqueue and its batch being written
 * @param lowIdleDelay        idle time required before a low batch runs
 * @param lowBatchSize        low items written per idle slice
 * @param retryBaseDelay      first retry delay, doubled on every further retry
 * @param shutdownTimeout     how long {@code stop()} waits for queued items to drain
 */
public record WriteQueueConfig(
        int maxSize,
        Duration normalBatchInterval,
        Duration lowIdleDelay,
        int lowBatchSize,
        Duration retryBaseDelay,
        Duration shutdownTimeout
) {

    public WriteQueueConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        if (lowBatchSize <= 0) {
            throw new IllegalArgumentException("lowBatchSize must be positive: " + lowBatchSize);
        }
    }

    public static WriteQueueConfig defaults() {
        return new WriteQueueConfig(1000, Duration.ofMillis(100), Duration.ofMillis(500), 10,
                Duration.ofMillis(100), Duration.ofSeconds(30));
    }

    public WriteQueueConfig withMaxSize(int size) {
        return new WriteQueueConfig(size, normalBatchInterval, lowIdleDelay, lowBatchSize,
                retryBaseDelay, shutdownTimeout);
    }

    public WriteQueueConfig withRetryBaseDelay(Duration delay) {
        return new WriteQueueConfig(maxSize, normalBatchInterval, lowIdleDelay, lowBatchSize,
                delay, shutdownTimeout);
    }
}
