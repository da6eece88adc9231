package com.chunkvault.core.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounds for an {@link LruCache}.
 *
 * @param maxSizeBytes upper bound on the summed estimated size of all entries
 * @param maxItems     upper bound on the entry count, {@code 0} for none
 * @param ttl          entry lifetime measured from the last {@code set}, {@link Duration#ZERO} for none
 */
public record CacheConfig(long maxSizeBytes, int maxItems, Duration ttl) {

    public static final long DEFAULT_MAX_SIZE_BYTES = 100L * 1024 * 1024;
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    public CacheConfig {
        if (maxSizeBytes <= 0) {
            throw new IllegalArgumentException("maxSizeBytes must be positive: " + maxSizeBytes);
        }
        if (maxItems < 0) {
            throw new IllegalArgumentException("maxItems cannot be negative: " + maxItems);
        }
        Objects.requireNonNull(ttl, "ttl cannot be null");
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("ttl cannot be negative: " + ttl);
        }
    }

    /** 100 MB, no item limit, 5 minute TTL. */
    public static CacheConfig defaults() {
        return new CacheConfig(DEFAULT_MAX_SIZE_BYTES, 0, DEFAULT_TTL);
    }

    public CacheConfig withMaxSizeBytes(long bytes) {
        return new CacheConfig(bytes, maxItems, ttl);
    }

    public CacheConfig withMaxItems(int items) {
        return new CacheConfig(maxSizeBytes, items, ttl);
    }

    public CacheConfig withTtl(Duration newTtl) {
        return new CacheConfig(maxSizeBytes, maxItems, newTtl);
    }

    public boolean hasItemLimit() {
        return maxItems > 0;
    }

    public boolean expires() {
        return !ttl.isZero();
    }
}
