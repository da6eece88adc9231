package com.chunkvault.core.content;

import com.chunkvault.core.cache.CacheConfig;
import com.chunkvault.core.cache.CacheStats;
import com.chunkvault.core.cache.LruCache;
import com.chunkvault.core.concurrent.StripedLocks;
import com.chunkvault.core.storage.StorageAdapter;
import com.chunkvault.util.ContentHash;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Content-addressed, deduplicating, reference-counted blob store.
 *
 * <p>Layout: {@code content/{hex[0:2]}/{hex}/data} holds the bytes and
 * {@code content/{hex[0:2]}/{hex}/metadata} the {@link BlobRecord}. Data is written before
 * metadata and deleted after it, so a metadata entry always has its data.
 *
 * <p>Saves and reference mutations of one hash are serialised by a striped lock;
 * different hashes proceed in parallel. Blobs are never deleted implicitly when their
 * last reference goes away: {@link #delete} or {@link #collectGarbage} reclaim them.
 *
 * <p>BLAKE3-256 collisions are assumed not to happen. Each dedup hit still compares the
 * stored size with the incoming size (and, with {@code verifyOnDedup}, the bytes) and
 * raises {@link ContentHashCollisionException} on a mismatch instead of silently aliasing.
 */
@Singleton
public class ContentStore {

    private static final Logger log = Logger.getLogger(ContentStore.class);

    static final String ROOT = "content/";
    private static final String DATA = "/data";
    private static final String METADATA = "/metadata";

    private final StorageAdapter storage;
    private final ContentStoreConfig config;
    private final Clock clock;
    private final StripedLocks locks = new StripedLocks(256);
    private final LruCache<ContentHash, BlobRecord> metadataCache;

    @Inject
    public ContentStore(StorageAdapter storage, ContentStoreConfig config) {
        this(storage, config, Clock.systemUTC());
    }

    public ContentStore(StorageAdapter storage, ContentStoreConfig config, Clock clock) {
        this.storage = storage;
        this.config = config;
        this.clock = clock;
        this.metadataCache = new LruCache<>(
                new CacheConfig(Long.MAX_VALUE, config.metadataCacheEntries(), Duration.ZERO),
                record -> 256L + 128L * record.refCount(),
                clock);
    }

    static String dataKey(ContentHash hash) {
        return ROOT + hash.prefix() + "/" + hash.toHex() + DATA;
    }

    static String metadataKey(ContentHash hash) {
        return ROOT + hash.prefix() + "/" + hash.toHex() + METADATA;
    }

    /**
     * Stores a blob unless identical content is already stored.
     *
     * @return the content hash, identical for identical bytes
     * @throws ContentHashCollisionException if stored content under the same hash differs
     */
    public ContentHash save(Blob blob) {
        Objects.requireNonNull(blob, "blob cannot be null");
        ContentHash hash = ContentHash.of(blob.data());
        return locks.withLock(hash, () -> {
            Optional<BlobRecord> existing = readRecord(hash);
            if (existing.isPresent()) {
                verifyDuplicate(hash, existing.get(), blob);
                log.debugf("Dedup hit: %s (%d bytes)", hash, blob.size());
                return hash;
            }

            storage.save(dataKey(hash), blob.data()).await().indefinitely();
            BlobRecord record = BlobRecord.created(hash, blob.size(), blob.mimeType(), clock.instant());
            writeRecord(hash, record);
            log.debugf("Stored blob %s (%d bytes, %s)", hash, blob.size(), blob.mimeType());
            return hash;
        });
    }

    /**
     * Saves a blob and references it while holding the hash lock throughout, so garbage
     * collection cannot reclaim a fresh or orphaned blob between the two steps.
     */
    public ContentHash saveAndReference(Blob blob, String ownerId, String attachmentId) {
        Objects.requireNonNull(blob, "blob cannot be null");
        Objects.requireNonNull(ownerId, "ownerId cannot be null");
        ContentHash hash = ContentHash.of(blob.data());
        return locks.withLock(hash, () -> {
            save(blob);
            addReference(hash, ownerId, attachmentId);
            return hash;
        });
    }

    /** Imports an attachment from an older layout; see {@link #saveAndReference}. */
    public ContentHash migrateLegacy(Blob blob, String ownerId, String attachmentId) {
        return saveAndReference(blob, ownerId, attachmentId);
    }

    public Optional<Blob> load(ContentHash hash) {
        Optional<byte[]> data = storage.load(dataKey(hash), byte[].class).await().indefinitely();
        if (data.isEmpty()) {
            return Optional.empty();
        }
        String mimeType = readRecord(hash).map(BlobRecord::mimeType).orElse(Blob.DEFAULT_MIME_TYPE);
        return Optional.of(new Blob(data.get(), mimeType));
    }

    /**
     * Deletes an unreferenced blob.
     *
     * @return {@code false} if the blob is unknown or still referenced
     */
    public boolean delete(ContentHash hash) {
        return locks.withLock(hash, () -> {
            Optional<BlobRecord> record = readRecord(hash);
            if (record.isEmpty()) {
                return false;
            }
            if (!record.get().orphaned()) {
                log.debugf("Refusing to delete %s: %d references", hash, record.get().refCount());
                return false;
            }
            deleteStored(hash);
            return true;
        });
    }

    public boolean exists(ContentHash hash) {
        return metadataCache.contains(hash)
                || storage.exists(metadataKey(hash)).await().indefinitely();
    }

    public Optional<BlobRecord> record(ContentHash hash) {
        return readRecord(hash);
    }

    public boolean addReference(ContentHash hash, String ownerId) {
        return addReference(hash, ownerId, null);
    }

    /**
     * Records that {@code ownerId} uses the blob as {@code attachmentId}.
     * A null attachment id stands for the hash itself.
     *
     * @return {@code false} if that exact reference already existed
     * @throws BlobNotFoundException if the blob was never saved
     */
    public boolean addReference(ContentHash hash, String ownerId, String attachmentId) {
        Objects.requireNonNull(ownerId, "ownerId cannot be null");
        String attachment = attachmentId != null ? attachmentId : hash.toHex();
        return locks.withLock(hash, () -> {
            BlobRecord record = readRecord(hash).orElseThrow(() -> new BlobNotFoundException(hash));
            if (record.hasReference(ownerId, attachment)) {
                log.debugf("Reference %s/%s already on %s", ownerId, attachment, hash);
                return false;
            }
            Instant now = clock.instant();
            writeRecord(hash, record.withReference(new Reference(ownerId, attachment, now), now));
            return true;
        });
    }

    /**
     * Removes every reference held by {@code ownerId}. The blob stays stored even when
     * no reference is left.
     *
     * @return number of references removed
     */
    public int removeReference(ContentHash hash, String ownerId) {
        Objects.requireNonNull(ownerId, "ownerId cannot be null");
        return removeMatching(hash, r -> r.ownerId().equals(ownerId), ownerId);
    }

    /**
     * Removes the single reference {@code (ownerId, attachmentId)}, leaving the owner's
     * other references on the same blob in place.
     */
    public int removeReference(ContentHash hash, String ownerId, String attachmentId) {
        Objects.requireNonNull(ownerId, "ownerId cannot be null");
        String attachment = attachmentId != null ? attachmentId : hash.toHex();
        return removeMatching(hash, r -> r.matches(ownerId, attachment), ownerId + "/" + attachment);
    }

    public int referenceCount(ContentHash hash) {
        return readRecord(hash).map(BlobRecord::refCount).orElse(0);
    }

    /** Owner id of every reference; the size always equals {@link #referenceCount}. */
    public List<String> references(ContentHash hash) {
        return readRecord(hash).map(BlobRecord::ownerIds).orElse(List.of());
    }

    public GarbageCollectionResult collectGarbage() {
        return collectGarbage(progress -> { });
    }

    /**
     * Deletes every blob without references. A blob that fails is reported in the
     * result's errors and the scan moves on.
     */
    public GarbageCollectionResult collectGarbage(Consumer<GcProgress> onProgress) {
        long startNanos = System.nanoTime();
        List<ContentHash> hashes = allHashes();
        int total = hashes.size();
        int deleted = 0;
        long freedBytes = 0;
        List<String> errors = new ArrayList<>();

        report(onProgress, GcProgress.of(0, total, "scanning"));
        for (int i = 0; i < total; i++) {
            ContentHash hash = hashes.get(i);
            try {
                long freed = locks.withLock(hash, () -> {
                    Optional<BlobRecord> record = readRecord(hash);
                    if (record.isEmpty() || !record.get().orphaned()) {
                        return -1L;
                    }
                    deleteStored(hash);
                    return record.get().size();
                });
                if (freed >= 0) {
                    deleted++;
                    freedBytes += freed;
                }
            } catch (RuntimeException e) {
                String message = "Failed to collect " + hash + ": " + e.getMessage();
                errors.add(message);
                log.errorf(e, "Garbage collection: %s", message);
            }
            int current = i + 1;
            if (current % config.gcProgressInterval() == 0 || current == total) {
                report(onProgress, GcProgress.of(current, total, "collecting"));
            }
        }
        report(onProgress, GcProgress.of(total, total, "complete"));

        long durationMs = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
        log.infof("Garbage collection removed %d of %d blobs, freed %d bytes in %d ms (%d errors)",
                deleted, total, freedBytes, durationMs, errors.size());
        return new GarbageCollectionResult(deleted, freedBytes, errors, durationMs);
    }

    public ContentStoreStats stats() {
        long blobs = 0;
        long bytes = 0;
        long savings = 0;
        long refs = 0;
        for (ContentHash hash : allHashes()) {
            Optional<BlobRecord> record;
            try {
                record = readRecord(hash);
            } catch (RuntimeException e) {
                log.warnf("Skipping unreadable blob metadata %s: %s", hash, e.getMessage());
                continue;
            }
            if (record.isEmpty()) {
                continue;
            }
            BlobRecord r = record.get();
            blobs++;
            bytes += r.size();
            refs += r.refCount();
            savings += r.size() * Math.max(0, r.refCount() - 1);
        }
        double average = blobs == 0 ? 0.0 : (double) refs / blobs;
        return new ContentStoreStats(blobs, bytes, savings, average, refs);
    }

    /** Every hash with stored metadata, in lexical order. */
    public List<ContentHash> allHashes() {
        List<String> keys = storage.listKeys(ROOT).collect().asList().await().indefinitely();
        List<ContentHash> hashes = new ArrayList<>();
        for (String key : keys) {
            if (!key.endsWith(METADATA)) {
                continue;
            }
            String hex = key.substring(key.lastIndexOf('/', key.length() - METADATA.length() - 1) + 1,
                    key.length() - METADATA.length());
            try {
                hashes.add(ContentHash.fromHex(hex));
            } catch (IllegalArgumentException e) {
                log.warnf("Ignoring malformed content key %s", key);
            }
        }
        return hashes;
    }

    public CacheStats metadataCacheStats() {
        return metadataCache.stats();
    }

    public void clearMetadataCache() {
        metadataCache.clear();
    }

    // -- internals --

    private int removeMatching(ContentHash hash, Predicate<Reference> matcher, String who) {
        return locks.withLock(hash, () -> {
            Optional<BlobRecord> record = readRecord(hash);
            if (record.isEmpty()) {
                log.warnf("Cannot remove reference %s: blob %s not found", who, hash);
                return 0;
            }
            BlobRecord updated = record.get().withoutReferences(matcher, clock.instant());
            int removed = record.get().refCount() - updated.refCount();
            if (removed > 0) {
                writeRecord(hash, updated);
                log.debugf("Removed %d reference(s) %s from %s, %d left",
                        removed, who, hash, updated.refCount());
            }
            return removed;
        });
    }

    private void verifyDuplicate(ContentHash hash, BlobRecord existing, Blob blob) {
        if (existing.size() != blob.size()) {
            log.errorf("Hash collision on %s: stored %d bytes, incoming %d bytes",
                    hash, existing.size(), blob.size());
            throw new ContentHashCollisionException(hash,
                    "stored size " + existing.size() + " != incoming size " + blob.size());
        }
        if (config.verifyOnDedup()) {
            Optional<byte[]> stored = storage.load(dataKey(hash), byte[].class).await().indefinitely();
            if (stored.isPresent() && !Arrays.equals(stored.get(), blob.data())) {
                log.errorf("Hash collision on %s: stored bytes differ", hash);
                throw new ContentHashCollisionException(hash, "stored bytes differ");
            }
        }
    }

    private Optional<BlobRecord> readRecord(ContentHash hash) {
        Optional<BlobRecord> cached = metadataCache.get(hash);
        if (cached.isPresent()) {
            return cached;
        }
        Optional<BlobRecord> loaded = storage.load(metadataKey(hash), BlobRecord.class).await().indefinitely();
        loaded.ifPresent(record -> metadataCache.set(hash, record));
        return loaded;
    }

    private void writeRecord(ContentHash hash, BlobRecord record) {
        storage.save(metadataKey(hash), record).await().indefinitely();
        metadataCache.set(hash, record);
    }

    private void deleteStored(ContentHash hash) {
        metadataCache.delete(hash);
        storage.delete(metadataKey(hash)).await().indefinitely();
        storage.delete(dataKey(hash)).await().indefinitely();
        log.debugf("Deleted blob %s", hash);
    }

    private static void report(Consumer<GcProgress> onProgress, GcProgress progress) {
        try {
            onProgress.accept(progress);
        } catch (RuntimeException e) {
            log.warnf("GC progress listener failed: %s", e.getMessage());
        }
    }
}
