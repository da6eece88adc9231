package com.chunkvault.core.queue;

import com.chunkvault.core.service.AbstractManagedService;
import com.chunkvault.core.storage.StorageAdapter;
import io.quarkus.runtime.Startup;
import io.smallrye.mutiny.TimeoutException;
import io.smallrye.mutiny.Uni;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Asynchronous, priority-tiered, retrying persistence queue.
 *
 * <p>{@code enqueue} never performs I/O and never blocks. Three loops write items to the
 * {@link StorageAdapter}, one worker thread each:
 * <ul>
 *   <li>{@link QueuePriority#CRITICAL}: dispatched immediately, one item at a time</li>
 *   <li>{@link QueuePriority#NORMAL}: collected and written as a batch after
 *       {@code normalBatchInterval}</li>
 *   <li>{@link QueuePriority#LOW}: written {@code lowBatchSize} at a time once the normal tier
 *       has been idle for {@code lowIdleDelay}</li>
 * </ul>
 * Normal and low writes wait while critical work is queued or running; a write already in
 * progress is never interrupted. Within a tier items are written in enqueue order.
 *
 * <p>A failed write is retried after {@code retryBaseDelay * 2^retries} until its tier's
 * retry ceiling is reached, then reported as {@link QueueEventType#FAILED} and logged.
 * Errors that {@link WriteError#retryable()} rejects fail on the first attempt.
 * Failed writes are not persisted for a later run.
 *
 * <p>A new write of a key supersedes any older write of the same key that has not started,
 * whatever its tier, so a later critical write is never overwritten by an earlier normal one.
 * The newer write is queued in the most urgent tier of the writes it replaced.
 *
 * <p>When more than {@code maxSize} items are queued the oldest low-priority items are
 * dropped; critical and normal items are never shed.
 */
@Singleton
@Startup
public class WriteQueue extends AbstractManagedService {

    private final StorageAdapter storage;
    private final WriteQueueConfig config;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition criticalIdle = lock.newCondition();
    private final Map<QueuePriority, Deque<QueueItem>> queues = new EnumMap<>(QueuePriority.class);
    private int criticalInFlight;
    private int normalInFlight;
    private ScheduledFuture<?> normalTick;
    private ScheduledFuture<?> lowTick;

    private final Map<String, CompletableFuture<QueueItem>> outstanding = new ConcurrentHashMap<>();
    private final Map<String, QueueItem> awaitingRetry = new ConcurrentHashMap<>();
    private final Map<String, QueueItem> latestByKey = new ConcurrentHashMap<>();
    private final List<WriteQueueListener> listeners = new CopyOnWriteArrayList<>();

    private final AtomicInteger processing = new AtomicInteger();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong batched = new AtomicLong();
    private final AtomicLong superseded = new AtomicLong();
    private final Map<QueueItemType, AtomicLong> enqueuedByType = new EnumMap<>(QueueItemType.class);

    private final AtomicInteger activeFlushes = new AtomicInteger();
    private volatile boolean stopping;

    private volatile ExecutorService criticalWorker;
    private volatile ExecutorService normalWorker;
    private volatile ExecutorService lowWorker;
    private volatile ScheduledExecutorService timer;

    @Inject
    public WriteQueue(StorageAdapter storage, WriteQueueConfig config) {
        this.storage = storage;
        this.config = config;
        for (QueuePriority priority : QueuePriority.values()) {
            queues.put(priority, new ArrayDeque<>());
        }
        for (QueueItemType type : QueueItemType.values()) {
            enqueuedByType.put(type, new AtomicLong());
        }
    }

    @Override
    public String serviceId() {
        return "write-queue";
    }

    public WriteQueueConfig config() {
        return config;
    }

    @Override
    protected void doStart() {
        stopping = false;
        criticalWorker = Executors.newSingleThreadExecutor(named("write-queue-critical"));
        normalWorker = Executors.newSingleThreadExecutor(named("write-queue-normal"));
        lowWorker = Executors.newSingleThreadExecutor(named("write-queue-low"));
        timer = Executors.newSingleThreadScheduledExecutor(named("write-queue-timer"));

        // items enqueued while stopped
        for (QueuePriority priority : QueuePriority.values()) {
            if (queuedCount(priority) > 0) {
                schedule(priority);
            }
        }
        log.infof("WriteQueue started (max size %d, normal batch every %d ms, low batches of %d)",
                config.maxSize(), config.normalBatchInterval().toMillis(), config.lowBatchSize());
    }

    @Override
    protected void doStop() throws InterruptedException {
        stopping = true;
        lock.lock();
        try {
            cancel(normalTick);
            cancel(lowTick);
            normalTick = null;
            lowTick = null;
        } finally {
            lock.unlock();
        }

        try {
            flush().await().atMost(config.shutdownTimeout());
        } catch (TimeoutException e) {
            log.warnf("WriteQueue shutdown timed out after %d ms with %d writes outstanding",
                    config.shutdownTimeout().toMillis(), outstanding.size());
        } finally {
            timer.shutdownNow();
            for (ExecutorService worker : List.of(criticalWorker, normalWorker, lowWorker)) {
                worker.shutdown();
                if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                    worker.shutdownNow();
                }
            }
            timer = null;
            criticalWorker = null;
            normalWorker = null;
            lowWorker = null;
            stopping = false;
        }
        log.info("WriteQueue stopped");
    }

    @PostConstruct
    void init() {
        try {
            start();
        } catch (Exception e) {
            throw new RuntimeException("WriteQueue failed to start", e);
        }
    }

    /**
     * Stops scheduling new batches, then drains what is still queued (bounded by
     * {@code shutdownTimeout}).
     */
    @PreDestroy
    public void shutdown() {
        try {
            stop();
        } catch (Exception e) {
            log.warn("Error stopping WriteQueue", e);
        }
    }

    // -- producers --

    public String enqueue(String key, Object value) {
        return enqueue(key, value, QueuePriority.NORMAL);
    }

    /**
     * Queues a write of {@code value} under {@code key}.
     *
     * @return the item id, as carried by the item's events
     */
    public String enqueue(String key, Object value, QueuePriority priority) {
        return submit(priority, QueueItemType.SIMPLE, QueueOperation.PUT, key, value, null);
    }

    public String enqueue(String key, Object value, QueuePriority priority, QueueItemType type, String group) {
        return submit(priority, type, QueueOperation.PUT, key, value, group);
    }

    public String enqueueDelete(String key, QueuePriority priority) {
        return submit(priority, QueueItemType.SIMPLE, QueueOperation.DELETE, key, null, null);
    }

    public void addListener(WriteQueueListener listener) {
        listeners.add(listener);
    }

    public void removeListener(WriteQueueListener listener) {
        listeners.remove(listener);
    }

    /**
     * Newest write for {@code key} that has not reached a terminal state. Readers use it
     * to avoid reading a stale value from storage while the write is still queued.
     */
    public Optional<QueueItem> pendingWrite(String key) {
        return Optional.ofNullable(latestByKey.get(key));
    }

    /**
     * Completes once every item outstanding at the time of the call has completed,
     * failed, been dropped or been cleared. Pending batch and idle delays are skipped
     * while a flush is in progress.
     */
    public Uni<Void> flush() {
        State current = state();
        if (current != State.RUNNING && current != State.STOPPING) {
            return Uni.createFrom().failure(new IllegalStateException("WriteQueue is " + current));
        }
        List<CompletableFuture<QueueItem>> pending = new ArrayList<>(outstanding.values());
        if (pending.isEmpty()) {
            return Uni.createFrom().voidItem();
        }

        activeFlushes.incrementAndGet();
        CompletableFuture<Void> all = CompletableFuture.allOf(pending.toArray(CompletableFuture[]::new));
        all.whenComplete((ignored, error) -> activeFlushes.decrementAndGet());
        Uni<Void> drained = Uni.createFrom().completionStage(all);
        execute(criticalWorker, this::drainCritical);
        execute(normalWorker, this::processNormalBatch);
        execute(lowWorker, this::processLowBatch);
        return drained;
    }

    /**
     * Discards every item that has not started, including items waiting to be retried.
     * Writes already in progress finish.
     *
     * @return number of items discarded
     */
    public int clear() {
        List<QueueItem> cancelled = new ArrayList<>();
        lock.lock();
        try {
            for (Deque<QueueItem> queue : queues.values()) {
                cancelled.addAll(queue);
                queue.clear();
            }
        } finally {
            lock.unlock();
        }
        for (QueueItem item : new ArrayList<>(awaitingRetry.values())) {
            if (awaitingRetry.remove(item.id()) != null) {
                cancelled.add(item);
            }
        }
        for (QueueItem item : cancelled) {
            forgetLatest(item);
            CompletableFuture<QueueItem> done = outstanding.remove(item.id());
            if (done != null) {
                done.complete(item);
            }
        }
        log.infof("Cleared %d pending writes", cancelled.size());
        return cancelled.size();
    }

    public QueueStats stats() {
        Map<QueuePriority, Integer> byPriority = new EnumMap<>(QueuePriority.class);
        lock.lock();
        try {
            queues.forEach((priority, queue) -> byPriority.put(priority, queue.size()));
        } finally {
            lock.unlock();
        }
        Map<QueueItemType, Long> byType = new EnumMap<>(QueueItemType.class);
        enqueuedByType.forEach((type, count) -> byType.put(type, count.get()));

        int inFlight = processing.get();
        return new QueueStats(
                Math.max(0, outstanding.size() - inFlight),
                inFlight,
                completed.get(),
                failed.get(),
                dropped.get(),
                byPriority,
                byType,
                batched.get(),
                superseded.get());
    }

    /** Delay before the retry that follows {@code retries} earlier retries. */
    public Duration retryDelay(int retries) {
        return config.retryBaseDelay().multipliedBy(1L << Math.min(retries, 30));
    }

    // -- enqueue path --

    private String submit(QueuePriority priority, QueueItemType type, QueueOperation operation,
                          String key, Object value, String group) {
        QueueItem item = new QueueItem(UUID.randomUUID().toString(), priority, type, operation,
                key, value, group, 0, Instant.now(), null);

        outstanding.put(item.id(), new CompletableFuture<>());
        latestByKey.put(key, item);
        enqueuedByType.get(type).incrementAndGet();
        emit(QueueEventType.ENQUEUED, item);

        append(item, true);
        log.debugf("Enqueued %s %s (%s, %s)", operation, key, priority, type);
        return item.id();
    }

    /**
     * Adds {@code item} to its tier. With {@code supersede}, older unstarted writes of the same
     * key are removed and the item takes the most urgent tier among them, so a newer low-priority
     * write never turns a replaced critical or normal write into a sheddable one.
     */
    private void append(QueueItem item, boolean supersede) {
        List<QueueItem> replaced = new ArrayList<>();
        List<QueueItem> shed;
        QueueItem queued = item;
        lock.lock();
        try {
            if (supersede) {
                for (Deque<QueueItem> queue : queues.values()) {
                    queue.removeIf(older -> older.key().equals(item.key()) && replaced.add(older));
                }
                for (QueueItem waiting : awaitingRetry.values()) {
                    if (waiting.key().equals(item.key()) && awaitingRetry.remove(waiting.id()) != null) {
                        replaced.add(waiting);
                    }
                }
                queued = promote(item, replaced);
            }
            queues.get(queued.priority()).addLast(queued);
            shed = shedOverflow();
        } finally {
            lock.unlock();
        }
        replaced.forEach(this::supersede);
        shed.forEach(this::drop);
        schedule(queued.priority());
    }

    private QueueItem promote(QueueItem item, List<QueueItem> replaced) {
        QueuePriority target = item.priority();
        for (QueueItem older : replaced) {
            if (older.priority().ordinal() < target.ordinal()) {
                target = older.priority();
            }
        }
        if (target == item.priority()) {
            return item;
        }
        QueueItem promoted = item.withPriority(target);
        latestByKey.computeIfPresent(item.key(), (k, latest) -> latest.id().equals(item.id()) ? promoted : latest);
        log.debugf("Write of %s promoted from %s to %s", item.key(), item.priority(), target);
        return promoted;
    }

    private void supersede(QueueItem item) {
        superseded.incrementAndGet();
        log.debugf("Write %s of %s superseded by a newer write", item.id(), item.key());
        emit(QueueEventType.SUPERSEDED, item);
        CompletableFuture<QueueItem> done = outstanding.remove(item.id());
        if (done != null) {
            done.complete(item);
        }
    }

    /** Caller holds {@link #lock}. */
    private List<QueueItem> shedOverflow() {
        int total = 0;
        for (Deque<QueueItem> queue : queues.values()) {
            total += queue.size();
        }
        Deque<QueueItem> low = queues.get(QueuePriority.LOW);
        List<QueueItem> shed = new ArrayList<>();
        while (total > config.maxSize() && !low.isEmpty()) {
            shed.add(low.pollFirst());
            total--;
        }
        return shed;
    }

    private void drop(QueueItem item) {
        dropped.incrementAndGet();
        forgetLatest(item);
        log.warnf("Queue full (%d items), dropped low-priority write of %s", config.maxSize(), item.key());
        emit(QueueEventType.DROPPED, item);
        CompletableFuture<QueueItem> done = outstanding.remove(item.id());
        if (done != null) {
            done.complete(item);
        }
    }

    // -- scheduling --

    private void schedule(QueuePriority priority) {
        if (timer == null) {
            return; // not started; doStart picks queued items up
        }
        switch (priority) {
            case CRITICAL -> execute(criticalWorker, this::drainCritical);
            case NORMAL -> scheduleNormal();
            case LOW -> scheduleLow();
        }
    }

    private void scheduleNormal() {
        if (draining()) {
            execute(normalWorker, this::processNormalBatch);
            return;
        }
        lock.lock();
        try {
            if (normalTick == null || normalTick.isDone()) {
                normalTick = delay(() -> execute(normalWorker, this::processNormalBatch),
                        config.normalBatchInterval());
            }
        } finally {
            lock.unlock();
        }
    }

    private void scheduleLow() {
        if (draining()) {
            execute(lowWorker, this::processLowBatch);
            return;
        }
        lock.lock();
        try {
            if (lowTick == null || lowTick.isDone()) {
                lowTick = delay(() -> execute(lowWorker, this::processLowBatch), config.lowIdleDelay());
            }
        } finally {
            lock.unlock();
        }
    }

    private boolean draining() {
        return stopping || activeFlushes.get() > 0;
    }

    // -- tier loops --

    private void drainCritical() {
        while (true) {
            QueueItem item;
            lock.lock();
            try {
                item = queues.get(QueuePriority.CRITICAL).pollFirst();
                if (item == null) {
                    return;
                }
                criticalInFlight++;
            } finally {
                lock.unlock();
            }
            try {
                writeOne(item);
            } finally {
                lock.lock();
                try {
                    criticalInFlight--;
                    criticalIdle.signalAll();
                } finally {
                    lock.unlock();
                }
            }
        }
    }

    private void processNormalBatch() {
        List<QueueItem> batch;
        lock.lock();
        try {
            Deque<QueueItem> normal = queues.get(QueuePriority.NORMAL);
            batch = new ArrayList<>(normal);
            normal.clear();
            normalInFlight += batch.size();
        } finally {
            lock.unlock();
        }
        if (batch.isEmpty()) {
            return;
        }
        try {
            log.debugf("Writing normal batch of %d", batch.size());
            writeInOrder(batch);
        } finally {
            lock.lock();
            try {
                normalInFlight -= batch.size();
            } finally {
                lock.unlock();
            }
        }
        if (queuedCount(QueuePriority.LOW) > 0) {
            scheduleLow();
        }
    }

    private void processLowBatch() {
        List<QueueItem> batch = new ArrayList<>();
        lock.lock();
        try {
            if (!draining() && higherTiersBusy()) {
                batch = null;
            } else {
                Deque<QueueItem> low = queues.get(QueuePriority.LOW);
                while (batch.size() < config.lowBatchSize() && !low.isEmpty()) {
                    batch.add(low.pollFirst());
                }
            }
        } finally {
            lock.unlock();
        }
        if (batch == null) {
            scheduleLow(); // not idle yet
            return;
        }
        if (!batch.isEmpty()) {
            log.debugf("Writing low batch of %d", batch.size());
            writeInOrder(batch);
        }
        if (queuedCount(QueuePriority.LOW) > 0) {
            scheduleLow();
        }
    }

    /** Caller holds {@link #lock}. */
    private boolean higherTiersBusy() {
        return criticalInFlight > 0 || normalInFlight > 0
                || !queues.get(QueuePriority.CRITICAL).isEmpty()
                || !queues.get(QueuePriority.NORMAL).isEmpty();
    }

    private int queuedCount(QueuePriority priority) {
        lock.lock();
        try {
            return queues.get(priority).size();
        } finally {
            lock.unlock();
        }
    }

    private void awaitCriticalIdle() {
        lock.lock();
        try {
            while (criticalInFlight > 0 || !queues.get(QueuePriority.CRITICAL).isEmpty()) {
                criticalIdle.await(50, TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            lock.unlock();
        }
    }

    // -- writing --

    /** Writes items in order, merging runs of batchable items of one type and group. */
    private void writeInOrder(List<QueueItem> items) {
        int i = 0;
        while (i < items.size()) {
            QueueItem first = items.get(i);
            int end = i + 1;
            while (end < items.size() && first.batchesWith(items.get(end))) {
                end++;
            }
            awaitCriticalIdle();
            List<QueueItem> run = new ArrayList<>();
            for (QueueItem item : items.subList(i, end)) {
                if (isStale(item)) {
                    supersede(item);
                } else {
                    run.add(item);
                }
            }
            if (run.size() == 1) {
                writeOne(run.get(0));
            } else if (!run.isEmpty()) {
                writeBatch(run);
            }
            i = end;
        }
    }

    /** A newer write of the item's key was enqueued after it left its tier queue. */
    private boolean isStale(QueueItem item) {
        QueueItem latest = latestByKey.get(item.key());
        return latest == null || !latest.id().equals(item.id());
    }

    private void writeOne(QueueItem item) {
        if (isStale(item)) {
            supersede(item);
            return;
        }
        markProcessing(item);
        try {
            switch (item.operation()) {
                case PUT -> storage.save(item.key(), item.value()).await().indefinitely();
                case DELETE -> storage.delete(item.key()).await().indefinitely();
            }
            complete(item);
        } catch (RuntimeException e) {
            handleFailure(item, e);
        } finally {
            processing.decrementAndGet();
        }
    }

    private void writeBatch(List<QueueItem> run) {
        run.forEach(this::markProcessing);
        Map<String, Object> entries = new LinkedHashMap<>();
        for (QueueItem item : run) {
            entries.put(item.key(), item.value());
        }
        try {
            storage.saveAll(entries).await().indefinitely();
            batched.addAndGet(run.size() - 1L);
            log.debugf("Wrote %d %s items of %s in one batch", run.size(), run.get(0).type(), run.get(0).group());
            run.forEach(this::complete);
        } catch (RuntimeException e) {
            run.forEach(item -> handleFailure(item, e));
        } finally {
            processing.addAndGet(-run.size());
        }
    }

    private void markProcessing(QueueItem item) {
        processing.incrementAndGet();
        emit(QueueEventType.PROCESSING, item);
    }

    private void complete(QueueItem item) {
        completed.incrementAndGet();
        forgetLatest(item);
        emit(QueueEventType.COMPLETED, item);
        CompletableFuture<QueueItem> done = outstanding.remove(item.id());
        if (done != null) {
            done.complete(item);
        }
    }

    private void handleFailure(QueueItem item, RuntimeException error) {
        WriteError writeError = WriteError.from(error);
        if (!writeError.retryable()) {
            log.warnf("Write of %s failed with non-retryable %s", item.key(), writeError.exceptionType());
            giveUp(item.failed(writeError));
            return;
        }
        if (item.retries() >= item.priority().maxRetries()) {
            giveUp(item.failed(writeError));
            return;
        }

        QueueItem retry = item.retried(writeError);
        Duration wait = retryDelay(item.retries());
        awaitingRetry.put(retry.id(), retry);
        latestByKey.computeIfPresent(retry.key(), (k, latest) -> latest.id().equals(retry.id()) ? retry : latest);
        log.warnf("Write of %s failed (retry %d of %d in %d ms): %s",
                item.key(), retry.retries(), item.priority().maxRetries(), wait.toMillis(), writeError.message());
        emit(QueueEventType.RETRY, retry);

        ScheduledExecutorService scheduler = timer;
        try {
            if (scheduler == null) {
                throw new RejectedExecutionException("WriteQueue is stopped");
            }
            scheduler.schedule(() -> requeue(retry), wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            awaitingRetry.remove(retry.id());
            giveUp(retry);
        }
    }

    private void requeue(QueueItem retry) {
        if (awaitingRetry.remove(retry.id()) == null) {
            return; // cleared or superseded while waiting
        }
        append(retry, false);
    }

    private void giveUp(QueueItem item) {
        failed.incrementAndGet();
        forgetLatest(item);
        WriteError error = item.lastError();
        log.errorf("Write of %s failed permanently after %d retries (%s): %s",
                item.key(), item.retries(), error.exceptionType(), error.message());
        emit(QueueEventType.FAILED, item);
        CompletableFuture<QueueItem> done = outstanding.remove(item.id());
        if (done != null) {
            done.complete(item);
        }
    }

    private void forgetLatest(QueueItem item) {
        latestByKey.computeIfPresent(item.key(), (k, latest) -> latest.id().equals(item.id()) ? null : latest);
    }

    // -- plumbing --

    private void emit(QueueEventType type, QueueItem item) {
        QueueEvent event = new QueueEvent(type, item);
        for (WriteQueueListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warnf("Queue listener failed on %s of %s: %s", type, item.key(), e.getMessage());
            }
        }
    }

    private ScheduledFuture<?> delay(Runnable task, Duration wait) {
        return timer.schedule(task, wait.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void execute(ExecutorService worker, Runnable task) {
        if (worker == null) {
            return;
        }
        try {
            worker.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Unexpected error in write queue loop", e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debugf("Write queue worker rejected task: %s", e.getMessage());
        }
    }

    private static void cancel(ScheduledFuture<?> tick) {
        if (tick != null) {
            tick.cancel(false);
        }
    }

    private static ThreadFactory named(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }
}
