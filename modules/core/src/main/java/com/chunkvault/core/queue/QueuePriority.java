package com.chunkvault.core.queue;

/**
 * Urgency tier of a queued write. Each tier has its own scheduling loop and retry ceiling:
 * critical writes fail fast, low-priority writes are patient.
 */
public enum QueuePriority {
    CRITICAL(1),
    NORMAL(3),
    LOW(5);

    private final int maxRetries;

    QueuePriority(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public int maxRetries() {
        return maxRetries;
    }
}
