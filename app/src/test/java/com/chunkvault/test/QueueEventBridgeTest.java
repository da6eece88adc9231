package com.chunkvault.test;

import com.chunkvault.core.queue.QueueEvent;
import com.chunkvault.core.queue.QueueEventType;
import com.chunkvault.core.queue.QueuePriority;
import com.chunkvault.core.queue.WriteQueue;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.ObservesAsync;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

@QuarkusTest
class QueueEventBridgeTest {

    @Inject
    WriteQueue writeQueue;

    @Inject
    QueueEventCollector collector;

    @Test
    void queueEventsReachAsyncObservers() throws Exception {
        String key = "bridge/" + UUID.randomUUID();

        writeQueue.enqueue(key, Map.of("n", 1), QueuePriority.CRITICAL);
        writeQueue.flush().await().atMost(Duration.ofSeconds(5));

        assertThat(collector.awaitTypes(key, 3, Duration.ofSeconds(5)))
                .containsExactly(QueueEventType.ENQUEUED, QueueEventType.PROCESSING, QueueEventType.COMPLETED);
    }

    @ApplicationScoped
    public static class QueueEventCollector {

        private final List<QueueEvent> events = new CopyOnWriteArrayList<>();

        void onEvent(@ObservesAsync QueueEvent event) {
            events.add(event);
        }

        /** Event types seen for {@code key}, waiting until at least {@code count} arrived. */
        List<QueueEventType> awaitTypes(String key, int count, Duration timeout) throws InterruptedException {
            long deadline = System.nanoTime() + timeout.toNanos();
            List<QueueEventType> types = typesFor(key);
            while (types.size() < count && System.nanoTime() < deadline) {
                Thread.sleep(10);
                types = typesFor(key);
            }
            return types;
        }

        private List<QueueEventType> typesFor(String key) {
            return events.stream()
                    .filter(e -> e.item().key().equals(key))
                    .map(QueueEvent::type)
                    .sorted()
                    .toList();
        }
    }
}
