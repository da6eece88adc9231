package com.chunkvault.core.queue;

import com.chunkvault.core.service.ManagedService;
import com.chunkvault.core.testing.RecordingStorageAdapter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class WriteQueueTest {

    private static final WriteQueueConfig FAST = new WriteQueueConfig(
            1000, Duration.ofMillis(20), Duration.ofMillis(40), 10,
            Duration.ofMillis(5), Duration.ofSeconds(5));

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private RecordingStorageAdapter storage;
    private WriteQueue queue;
    private final List<QueueEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        storage = new RecordingStorageAdapter(mapper);
        queue = newQueue(FAST);
    }

    @AfterEach
    void tearDown() {
        queue.shutdown();
    }

    private WriteQueue newQueue(WriteQueueConfig config) {
        WriteQueue created = new WriteQueue(storage, config);
        created.addListener(events::add);
        return created;
    }

    private CountDownLatch latchOn(QueueEventType type, int count) {
        CountDownLatch latch = new CountDownLatch(count);
        queue.addListener(event -> {
            if (event.type() == type) {
                latch.countDown();
            }
        });
        return latch;
    }

    private List<QueueEvent> eventsOf(QueueEventType type) {
        return events.stream().filter(e -> e.type() == type).toList();
    }

    @Test
    void shouldWriteEnqueuedValue() throws Exception {
        queue.start();

        queue.enqueue("greeting", Map.of("text", "hello"));
        queue.flush().await().atMost(Duration.ofSeconds(5));

        assertThat(storage.load("greeting", Map.class).await().indefinitely())
                .hasValueSatisfying(v -> assertThat(v).containsEntry("text", "hello"));
        assertThat(queue.stats().completed()).isEqualTo(1);
        assertThat(queue.stats().pending()).isZero();
    }

    @Test
    void shouldFireLifecycleEventsInOrder() throws Exception {
        queue.start();

        String id = queue.enqueue("k", "v", QueuePriority.CRITICAL);
        queue.flush().await().atMost(Duration.ofSeconds(5));

        assertThat(events).filteredOn(e -> e.item().id().equals(id))
                .extracting(QueueEvent::type)
                .containsExactly(QueueEventType.ENQUEUED, QueueEventType.PROCESSING, QueueEventType.COMPLETED);
    }

    @Test
    void shouldWriteCriticalBeforeNormalBeforeLow() throws Exception {
        CountDownLatch done = latchOn(QueueEventType.COMPLETED, 3);
        queue.enqueue("low", "l", QueuePriority.LOW);
        queue.enqueue("normal", "n", QueuePriority.NORMAL);
        queue.enqueue("critical", "c", QueuePriority.CRITICAL);

        queue.start();

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(storage.writes()).containsExactly("critical", "normal", "low");
    }

    @Test
    void shouldKeepEnqueueOrderWithinTier() throws Exception {
        CountDownLatch done = latchOn(QueueEventType.COMPLETED, 5);
        for (int i = 0; i < 5; i++) {
            queue.enqueue("item-" + i, i, QueuePriority.NORMAL);
        }
        queue.start();

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(storage.writes()).containsExactly("item-0", "item-1", "item-2", "item-3", "item-4");
    }

    @Test
    void shouldDoubleRetryDelay() {
        WriteQueue slow = new WriteQueue(storage, FAST.withRetryBaseDelay(Duration.ofMillis(100)));

        assertThat(slow.retryDelay(0)).isEqualTo(Duration.ofMillis(100));
        assertThat(slow.retryDelay(1)).isEqualTo(Duration.ofMillis(200));
        assertThat(slow.retryDelay(2)).isEqualTo(Duration.ofMillis(400));
        assertThat(slow.retryDelay(4)).isEqualTo(Duration.ofMillis(1600));
    }

    @Test
    void shouldWaitLongerBeforeEachRetry() throws Exception {
        queue = newQueue(FAST.withRetryBaseDelay(Duration.ofMillis(100)));
        storage.failNext(2);
        CountDownLatch done = latchOn(QueueEventType.COMPLETED, 1);
        queue.start();

        queue.enqueue("flaky", "value", QueuePriority.LOW);

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        List<Long> attempts = storage.attemptNanos();
        assertThat(attempts).hasSize(3);
        long firstGap = TimeUnit.NANOSECONDS.toMillis(attempts.get(1) - attempts.get(0));
        long secondGap = TimeUnit.NANOSECONDS.toMillis(attempts.get(2) - attempts.get(1));
        assertThat(firstGap).isGreaterThanOrEqualTo(100);
        assertThat(secondGap).isGreaterThanOrEqualTo(200);
    }

    @Test
    void shouldFailNonRetryableErrorWithoutRetrying() throws Exception {
        storage.failAlwaysWith(new IllegalArgumentException("value cannot be serialised"));
        CountDownLatch failed = latchOn(QueueEventType.FAILED, 1);
        queue.start();

        queue.enqueue("broken", "value", QueuePriority.LOW);

        assertThat(failed.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(eventsOf(QueueEventType.RETRY)).isEmpty();
        assertThat(storage.attempts()).isEqualTo(1);
        QueueItem item = eventsOf(QueueEventType.FAILED).get(0).item();
        assertThat(item.lastError().retryable()).isFalse();
        assertThat(item.lastError().exceptionType()).isEqualTo(IllegalArgumentException.class.getName());
    }

    @Test
    void shouldRetryAndEventuallySucceed() throws Exception {
        storage.failNext(2);
        queue.start();

        queue.enqueue("flaky", "value", QueuePriority.NORMAL);
        queue.flush().await().atMost(Duration.ofSeconds(5));

        assertThat(eventsOf(QueueEventType.RETRY)).extracting(e -> e.item().retries())
                .containsExactly(1, 2);
        assertThat(eventsOf(QueueEventType.COMPLETED)).hasSize(1);
        assertThat(storage.exists("flaky").await().indefinitely()).isTrue();
    }

    @Test
    void shouldFailCriticalItemAfterItsRetryCeiling() throws Exception {
        storage.failAlways();
        CountDownLatch failed = latchOn(QueueEventType.FAILED, 1);
        queue.start();

        queue.enqueue("doomed", "value", QueuePriority.CRITICAL);

        assertThat(failed.await(5, TimeUnit.SECONDS)).isTrue();
        QueueItem item = eventsOf(QueueEventType.FAILED).get(0).item();
        assertThat(item.retries()).isEqualTo(QueuePriority.CRITICAL.maxRetries());
        assertThat(item.lastError().message()).contains("injected failure");
        assertThat(item.lastError().exceptionType()).endsWith("StorageException");
        assertThat(storage.attempts()).isEqualTo(QueuePriority.CRITICAL.maxRetries() + 1);
        assertThat(queue.stats().failed()).isEqualTo(1);
        assertThat(queue.pendingWrite("doomed")).isEmpty();
    }

    @Test
    void shouldAllowMoreRetriesForLowPriority() throws Exception {
        storage.failAlways();
        CountDownLatch failed = latchOn(QueueEventType.FAILED, 1);
        queue.start();

        queue.enqueue("patient", "value", QueuePriority.LOW);

        assertThat(failed.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(eventsOf(QueueEventType.RETRY)).hasSize(QueuePriority.LOW.maxRetries());
    }

    @Test
    void shouldDropOldestLowItemWhenFull() {
        queue = newQueue(FAST.withMaxSize(5));
        String first = null;
        for (int i = 0; i < 6; i++) {
            String id = queue.enqueue("low-" + i, i, QueuePriority.LOW);
            if (i == 0) {
                first = id;
            }
        }

        List<QueueEvent> dropped = eventsOf(QueueEventType.DROPPED);
        assertThat(dropped).hasSize(1);
        assertThat(dropped.get(0).item().id()).isEqualTo(first);
        assertThat(queue.stats().pending()).isEqualTo(5);
        assertThat(queue.stats().dropped()).isEqualTo(1);
    }

    @Test
    void shouldNeverDropCriticalOrNormalItems() {
        queue = newQueue(FAST.withMaxSize(2));
        queue.enqueue("low", 0, QueuePriority.LOW);
        queue.enqueue("c1", 1, QueuePriority.CRITICAL);
        queue.enqueue("n1", 2, QueuePriority.NORMAL);
        queue.enqueue("c2", 3, QueuePriority.CRITICAL);

        assertThat(eventsOf(QueueEventType.DROPPED)).extracting(e -> e.item().key()).containsExactly("low");
        assertThat(queue.stats().pending()).isEqualTo(3);
    }

    @Test
    void shouldKeepSupersedingWriteInReplacedTierWhenFull() throws Exception {
        queue = newQueue(new WriteQueueConfig(2, Duration.ofSeconds(10), Duration.ofSeconds(10), 10,
                Duration.ofMillis(5), Duration.ofSeconds(5)));
        queue.enqueue("k", "normal value", QueuePriority.NORMAL);
        queue.enqueue("k", "newer low value", QueuePriority.LOW);
        queue.enqueue("a", "a", QueuePriority.LOW);
        queue.enqueue("b", "b", QueuePriority.LOW);

        assertThat(queue.pendingWrite("k")).map(QueueItem::priority).contains(QueuePriority.NORMAL);
        assertThat(eventsOf(QueueEventType.DROPPED)).extracting(e -> e.item().key()).containsExactly("a");

        queue.start();
        queue.flush().await().atMost(Duration.ofSeconds(5));

        assertThat(storage.load("k", String.class).await().indefinitely()).contains("newer low value");
        assertThat(storage.exists("b").await().indefinitely()).isTrue();
    }

    @Test
    void shouldReportStatsByPriorityAndType() {
        queue.enqueue("a", 1, QueuePriority.CRITICAL);
        queue.enqueue("b", 2, QueuePriority.NORMAL, QueueItemType.CHUNK, "r1");
        queue.enqueue("c", 3, QueuePriority.LOW);

        QueueStats stats = queue.stats();
        assertThat(stats.pending()).isEqualTo(3);
        assertThat(stats.processing()).isZero();
        assertThat(stats.byPriority()).containsEntry(QueuePriority.CRITICAL, 1)
                .containsEntry(QueuePriority.NORMAL, 1)
                .containsEntry(QueuePriority.LOW, 1);
        assertThat(stats.byType()).containsEntry(QueueItemType.CHUNK, 1L)
                .containsEntry(QueueItemType.SIMPLE, 2L);
    }

    @Test
    void shouldBatchChunkWritesOfOneRecord() throws Exception {
        CountDownLatch done = latchOn(QueueEventType.COMPLETED, 4);
        queue.enqueue("records/r1/screenshots/chunk-000", 0, QueuePriority.NORMAL, QueueItemType.CHUNK, "r1");
        queue.enqueue("records/r1/screenshots/chunk-001", 1, QueuePriority.NORMAL, QueueItemType.CHUNK, "r1");
        queue.enqueue("records/r1/screenshots/chunk-002", 2, QueuePriority.NORMAL, QueueItemType.CHUNK, "r1");
        queue.enqueue("records/r2/screenshots/chunk-000", 3, QueuePriority.NORMAL, QueueItemType.CHUNK, "r2");

        queue.start();

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(storage.batches()).containsExactly(List.of(
                "records/r1/screenshots/chunk-000",
                "records/r1/screenshots/chunk-001",
                "records/r1/screenshots/chunk-002"));
        assertThat(queue.stats().batched()).isEqualTo(2);
        assertThat(storage.writes()).hasSize(4);
    }

    @Test
    void shouldExposePendingWriteUntilDurable() throws Exception {
        queue.enqueue("k", "first");
        queue.enqueue("k", "second");

        assertThat(queue.pendingWrite("k")).map(QueueItem::value).contains("second");

        queue.start();
        queue.flush().await().atMost(Duration.ofSeconds(5));

        assertThat(queue.pendingWrite("k")).isEmpty();
        assertThat(storage.load("k", String.class).await().indefinitely()).contains("second");
    }

    @Test
    void shouldSupersedeOlderWriteOfSameKeyAcrossTiers() throws Exception {
        String older = queue.enqueue("records/r1/metadata", "active", QueuePriority.NORMAL);
        queue.enqueue("records/r1/metadata", "completed", QueuePriority.CRITICAL);

        queue.start();
        queue.flush().await().atMost(Duration.ofSeconds(5));

        assertThat(eventsOf(QueueEventType.SUPERSEDED)).extracting(e -> e.item().id()).containsExactly(older);
        assertThat(storage.writes()).containsExactly("records/r1/metadata");
        assertThat(storage.load("records/r1/metadata", String.class).await().indefinitely()).contains("completed");
        assertThat(queue.stats().superseded()).isEqualTo(1);
    }

    @Test
    void shouldExposePendingDelete() {
        queue.enqueueDelete("gone", QueuePriority.CRITICAL);

        assertThat(queue.pendingWrite("gone")).map(QueueItem::operation).contains(QueueOperation.DELETE);
    }

    @Test
    void shouldClearQueuedItems() throws Exception {
        queue.enqueue("a", 1, QueuePriority.NORMAL);
        queue.enqueue("b", 2, QueuePriority.LOW);
        queue.enqueue("c", 3, QueuePriority.CRITICAL);

        assertThat(queue.clear()).isEqualTo(3);
        assertThat(queue.stats().pending()).isZero();
        assertThat(queue.pendingWrite("a")).isEmpty();

        queue.start();
        queue.flush().await().atMost(Duration.ofSeconds(5));
        assertThat(storage.writes()).isEmpty();
    }

    @Test
    void shouldRejectFlushWhenNotRunning() {
        assertThatThrownBy(() -> queue.flush().await().indefinitely())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldCompleteFlushImmediatelyWhenEmpty() throws Exception {
        queue.start();

        queue.flush().await().atMost(Duration.ofSeconds(1));

        assertThat(queue.stats().completed()).isZero();
    }

    @Test
    void shouldDrainOnShutdown() throws Exception {
        queue.start();
        for (int i = 0; i < 10; i++) {
            queue.enqueue("low-" + i, i, QueuePriority.LOW);
            queue.enqueue("normal-" + i, i, QueuePriority.NORMAL);
        }

        queue.shutdown();

        assertThat(queue.state()).isEqualTo(ManagedService.State.STOPPED);
        assertThat(storage.writes()).hasSize(20);
        assertThat(queue.stats().pending()).isZero();
    }

    @Test
    void shouldDeleteThroughQueue() throws Exception {
        storage.save("obsolete", "x").await().indefinitely();
        queue.start();

        queue.enqueueDelete("obsolete", QueuePriority.NORMAL);
        queue.flush().await().atMost(Duration.ofSeconds(5));

        assertThat(storage.exists("obsolete").await().indefinitely()).isFalse();
    }

    @Test
    void shouldSurviveFailingListener() throws Exception {
        queue.addListener(event -> {
            throw new IllegalStateException("listener bug");
        });
        queue.start();

        queue.enqueue("k", "v");
        queue.flush().await().atMost(Duration.ofSeconds(5));

        assertThat(queue.stats().completed()).isEqualTo(1);
    }

    @Test
    void shouldRejectPutWithoutValue() {
        assertThatThrownBy(() -> queue.enqueue("k", null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
