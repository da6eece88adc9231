package com.chunkvault.core.queue;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Republishes {@link WriteQueue} events as asynchronous CDI {@link QueueEvent}s so
 * application beans can react with {@code @ObservesAsync}.
 */
@ApplicationScoped
public class QueueEventBridge {

    private static final Logger log = Logger.getLogger(QueueEventBridge.class);

    @Inject
    WriteQueue writeQueue;

    @Inject
    Event<QueueEvent> events;

    private final WriteQueueListener listener = this::publish;

    void onStart(@Observes StartupEvent ev) {
        writeQueue.addListener(listener);
        log.debug("Queue events bridged to CDI");
    }

    void onStop(@Observes ShutdownEvent ev) {
        writeQueue.removeListener(listener);
    }

    private void publish(QueueEvent event) {
        events.fireAsync(event).exceptionally(e -> {
            log.warnf("Async observer failed on %s of %s: %s",
                    event.type(), event.item().key(), e.getMessage());
            return event;
        });
    }
}
