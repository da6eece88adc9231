package com.chunkvault.core.content;

/**
 * @param metadataCacheEntries how many BlobRecords the metadata cache holds
 * @param verifyOnDedup        compare stored bytes on every dedup hit, not just sizes
 * @param gcProgressInterval   report GC progress every this many blobs
 */
public record ContentStoreConfig(int metadataCacheEntries, boolean verifyOnDedup, int gcProgressInterval) {

    public ContentStoreConfig {
        if (metadataCacheEntries <= 0) {
            throw new IllegalArgumentException("metadataCacheEntries must be positive: " + metadataCacheEntries);
        }
        if (gcProgressInterval <= 0) {
            throw new IllegalArgumentException("gcProgressInterval must be positive: " + gcProgressInterval);
        }
    }

    public static ContentStoreConfig defaults() {
        return new ContentStoreConfig(1000, false, 25);
    }
}
