package com.chunkvault.core.cache;

import java.time.Instant;

/**
 * Point-in-time cache statistics. Entry timestamps are {@code null} when the cache is empty.
 */
public record CacheStats(
        long hits,
        long misses,
        double hitRate,
        long size,
        long maxSize,
        int items,
        long evictions,
        Instant oldestEntryTimestamp,
        Instant newestEntryTimestamp
) {}
