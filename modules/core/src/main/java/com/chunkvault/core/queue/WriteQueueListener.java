package com.chunkvault.core.queue;

/**
 * Receives {@link QueueEvent}s on the thread that caused them (the caller for
 * {@code ENQUEUED} and {@code DROPPED}, a queue worker otherwise). Must not block.
 */
@FunctionalInterface
public interface WriteQueueListener {

    void onEvent(QueueEvent event);
}
