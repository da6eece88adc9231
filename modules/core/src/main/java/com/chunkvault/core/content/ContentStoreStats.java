package com.chunkvault.core.content;

/**
 * @param dedupSavingsBytes bytes not stored thanks to deduplication: the sum of
 *                          {@code size * (refCount - 1)} over referenced blobs
 */
public record ContentStoreStats(
        long totalBlobs,
        long totalBytes,
        long dedupSavingsBytes,
        double averageReferencesPerBlob,
        long totalReferences
) {}
