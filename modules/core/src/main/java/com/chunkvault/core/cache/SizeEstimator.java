package com.chunkvault.core.cache;

/**
 * Estimates the in-memory footprint of a cached value in bytes.
 * Order-of-magnitude accuracy is enough; a thrown exception makes the cache
 * fall back to {@link LruCache#FALLBACK_ENTRY_SIZE}.
 */
@FunctionalInterface
public interface SizeEstimator<V> {

    long estimateSize(V value) throws Exception;
}
