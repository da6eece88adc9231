package com.chunkvault.core.queue;

/**
 * Lifecycle notification for a queued write. Delivered to {@link WriteQueueListener}s
 * and, inside the application, as an asynchronous CDI event.
 */
public record QueueEvent(QueueEventType type, QueueItem item) {}
