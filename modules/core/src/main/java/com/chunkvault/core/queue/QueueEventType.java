package com.chunkvault.core.queue;

public enum QueueEventType {
    ENQUEUED,
    PROCESSING,
    COMPLETED,
    RETRY,
    FAILED,
    DROPPED,
    /** Replaced by a newer write of the same key before it started. */
    SUPERSEDED
}
