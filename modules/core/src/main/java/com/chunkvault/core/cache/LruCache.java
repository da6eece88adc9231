package com.chunkvault.core.cache;

import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Byte-bounded least-recently-used cache with optional TTL.
 *
 * <p>A hash map indexes the nodes of a doubly-linked list ordered by recency (head is
 * the most recently used). {@code get} and {@code set} splice the touched node to the
 * head; eviction removes from the tail until both the byte bound and the optional item
 * bound hold. A single lock guards every operation, all of which are O(1) apart from
 * pattern invalidation, pruning and statistics.
 *
 * <p>Null keys and values are rejected.
 */
public class LruCache<K, V> {

    private static final Logger log = Logger.getLogger(LruCache.class);

    /** Size charged for a value whose estimate fails. */
    public static final long FALLBACK_ENTRY_SIZE = 1024;

    private static final class Node<K, V> {
        final K key;
        V value;
        long sizeBytes;
        long timestamp;
        Node<K, V> prev;
        Node<K, V> next;

        Node(K key) {
            this.key = key;
        }
    }

    private volatile CacheConfig config;
    private final SizeEstimator<? super V> estimator;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<K, Node<K, V>> index = new HashMap<>();
    private Node<K, V> head;
    private Node<K, V> tail;
    private long totalSizeBytes;

    private long hits;
    private long misses;
    private long evictions;

    public LruCache(CacheConfig config, SizeEstimator<? super V> estimator) {
        this(config, estimator, Clock.systemUTC());
    }

    public LruCache(CacheConfig config, SizeEstimator<? super V> estimator, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.estimator = Objects.requireNonNull(estimator, "estimator");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public CacheConfig config() {
        return config;
    }

    /**
     * Applies new bounds to the live cache. Entries are kept; when the new bounds are
     * tighter the least recently used ones are evicted until they hold.
     *
     * @return number of entries evicted
     */
    public int reconfigure(CacheConfig newConfig) {
        Objects.requireNonNull(newConfig, "newConfig");
        lock.lock();
        try {
            CacheConfig previous = config;
            config = newConfig;
            long before = evictions;
            evictOverflow();
            int evicted = (int) (evictions - before);
            log.debugf("Cache bounds changed from %d to %d bytes (%d entries evicted)",
                    previous.maxSizeBytes(), newConfig.maxSizeBytes(), evicted);
            return evicted;
        } finally {
            lock.unlock();
        }
    }

    /** Changes only the byte bound. */
    public int resize(long maxSizeBytes) {
        return reconfigure(config.withMaxSizeBytes(maxSizeBytes));
    }

    public Optional<V> get(K key) {
        Objects.requireNonNull(key, "key");
        lock.lock();
        try {
            Node<K, V> node = index.get(key);
            if (node == null) {
                misses++;
                return Optional.empty();
            }
            if (isExpired(node, clock.millis())) {
                remove(node);
                misses++;
                return Optional.empty();
            }
            moveToHead(node);
            hits++;
            return Optional.of(node.value);
        } finally {
            lock.unlock();
        }
    }

    public void set(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        long size = estimate(value);
        lock.lock();
        try {
            Node<K, V> node = index.get(key);
            if (node == null) {
                node = new Node<>(key);
                index.put(key, node);
                linkAtHead(node);
            } else {
                totalSizeBytes -= node.sizeBytes;
                moveToHead(node);
            }
            node.value = value;
            node.sizeBytes = size;
            node.timestamp = clock.millis();
            totalSizeBytes += size;
            evictOverflow();
        } finally {
            lock.unlock();
        }
    }

    /** Like {@link #get} but without touching recency or hit counters. */
    public boolean contains(K key) {
        lock.lock();
        try {
            Node<K, V> node = index.get(key);
            if (node == null) {
                return false;
            }
            if (isExpired(node, clock.millis())) {
                remove(node);
                return false;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean delete(K key) {
        lock.lock();
        try {
            Node<K, V> node = index.get(key);
            if (node == null) {
                return false;
            }
            remove(node);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every entry whose key (as a string) starts with {@code prefix}.
     *
     * @return number of entries removed
     */
    public int invalidatePattern(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        return removeMatching(key -> String.valueOf(key).startsWith(prefix));
    }

    /**
     * Removes every entry whose key (as a string) contains a match of {@code pattern}.
     *
     * @return number of entries removed
     */
    public int invalidatePattern(Pattern pattern) {
        Objects.requireNonNull(pattern, "pattern");
        return removeMatching(key -> pattern.matcher(String.valueOf(key)).find());
    }

    public void clear() {
        lock.lock();
        try {
            index.clear();
            head = null;
            tail = null;
            totalSizeBytes = 0;
        } finally {
            lock.unlock();
        }
    }

    /** Returns the hits among {@code keys}, in iteration order. */
    public Map<K, V> getMany(Collection<? extends K> keys) {
        Map<K, V> found = new LinkedHashMap<>();
        for (K key : keys) {
            get(key).ifPresent(value -> found.put(key, value));
        }
        return found;
    }

    public void setMany(Map<? extends K, ? extends V> entries) {
        entries.forEach(this::set);
    }

    /** @return number of keys that were present */
    public int deleteMany(Collection<? extends K> keys) {
        int deleted = 0;
        for (K key : keys) {
            if (delete(key)) {
                deleted++;
            }
        }
        return deleted;
    }

    /**
     * Removes all expired entries.
     *
     * @return number of entries removed
     */
    public int prune() {
        if (!config.expires()) {
            return 0;
        }
        lock.lock();
        try {
            long now = clock.millis();
            int pruned = 0;
            Node<K, V> node = tail;
            while (node != null) {
                Node<K, V> prev = node.prev;
                if (isExpired(node, now)) {
                    remove(node);
                    pruned++;
                }
                node = prev;
            }
            if (pruned > 0) {
                log.debugf("Pruned %d expired cache entries", pruned);
            }
            return pruned;
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            long oldest = Long.MAX_VALUE;
            long newest = Long.MIN_VALUE;
            for (Node<K, V> node = head; node != null; node = node.next) {
                oldest = Math.min(oldest, node.timestamp);
                newest = Math.max(newest, node.timestamp);
            }
            long lookups = hits + misses;
            return new CacheStats(
                    hits,
                    misses,
                    lookups == 0 ? 0.0 : (double) hits / lookups,
                    totalSizeBytes,
                    config.maxSizeBytes(),
                    index.size(),
                    evictions,
                    index.isEmpty() ? null : Instant.ofEpochMilli(oldest),
                    index.isEmpty() ? null : Instant.ofEpochMilli(newest));
        } finally {
            lock.unlock();
        }
    }

    public void resetStats() {
        lock.lock();
        try {
            hits = 0;
            misses = 0;
            evictions = 0;
        } finally {
            lock.unlock();
        }
    }

    public long totalSizeBytes() {
        lock.lock();
        try {
            return totalSizeBytes;
        } finally {
            lock.unlock();
        }
    }

    public int items() {
        lock.lock();
        try {
            return index.size();
        } finally {
            lock.unlock();
        }
    }

    // -- internals --

    private long estimate(V value) {
        try {
            long size = estimator.estimateSize(value);
            return size >= 0 ? size : FALLBACK_ENTRY_SIZE;
        } catch (Exception | StackOverflowError e) {
            log.debugf("Size estimate failed for %s, using %d bytes: %s",
                    value.getClass().getSimpleName(), FALLBACK_ENTRY_SIZE, e.getMessage());
            return FALLBACK_ENTRY_SIZE;
        }
    }

    private boolean isExpired(Node<K, V> node, long now) {
        return config.expires() && now - node.timestamp > config.ttl().toMillis();
    }

    private boolean overBounds() {
        return totalSizeBytes > config.maxSizeBytes()
                || (config.hasItemLimit() && index.size() > config.maxItems());
    }

    private void evictOverflow() {
        while (tail != null && overBounds()) {
            Node<K, V> victim = tail;
            remove(victim);
            evictions++;
            log.debugf("Evicted cache entry %s (%d bytes)", victim.key, victim.sizeBytes);
        }
    }

    private int removeMatching(Predicate<K> matcher) {
        lock.lock();
        try {
            int removed = 0;
            Iterator<Map.Entry<K, Node<K, V>>> it = index.entrySet().iterator();
            while (it.hasNext()) {
                Node<K, V> node = it.next().getValue();
                if (matcher.test(node.key)) {
                    it.remove();
                    unlink(node);
                    totalSizeBytes -= node.sizeBytes;
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    private void remove(Node<K, V> node) {
        index.remove(node.key);
        unlink(node);
        totalSizeBytes -= node.sizeBytes;
    }

    private void moveToHead(Node<K, V> node) {
        if (node == head) {
            return;
        }
        unlink(node);
        linkAtHead(node);
    }

    private void linkAtHead(Node<K, V> node) {
        node.prev = null;
        node.next = head;
        if (head != null) {
            head.prev = node;
        }
        head = node;
        if (tail == null) {
            tail = node;
        }
    }

    private void unlink(Node<K, V> node) {
        if (node.prev != null) {
            node.prev.next = node.next;
        } else {
            head = node.next;
        }
        if (node.next != null) {
            node.next.prev = node.prev;
        } else {
            tail = node.prev;
        }
        node.prev = null;
        node.next = null;
    }
}
