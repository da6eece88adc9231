package com.chunkvault.core.record;

import com.chunkvault.core.cache.CacheConfig;
import com.chunkvault.core.cache.CacheStats;
import com.chunkvault.core.cache.JsonSizeEstimator;
import com.chunkvault.core.cache.LruCache;
import com.chunkvault.core.concurrent.StripedLocks;
import com.chunkvault.core.content.Blob;
import com.chunkvault.core.content.BlobNotFoundException;
import com.chunkvault.core.content.ContentStore;
import com.chunkvault.core.queue.QueueItem;
import com.chunkvault.core.queue.QueueItemType;
import com.chunkvault.core.queue.QueueOperation;
import com.chunkvault.core.queue.QueuePriority;
import com.chunkvault.core.queue.WriteQueue;
import com.chunkvault.core.service.AbstractManagedService;
import com.chunkvault.core.service.ManagedService;
import com.chunkvault.core.storage.StorageAdapter;
import com.chunkvault.util.ContentHash;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Coordinates chunked records on top of the cache, the write queue and the content store.
 *
 * <p>A record is one {@link RecordMetadata}, fixed-size chunks per {@link ChunkType} and
 * optional {@link LargeObjectKind large objects}, each cached and stored under its own key:
 * <pre>
 *   records/{id}/metadata                 metadata:{id}
 *   records/{id}/{type}/chunk-{NNN}        chunk:{id}:{type}:{index}
 *   records/{id}/{object}                 {object}:{id}
 *   records/index                          (all record ids)
 * </pre>
 *
 * <p>Every mutation invalidates the cache entry, applies the change, repopulates the entry
 * and then enqueues the durable write, so reads are consistent immediately while the write
 * lands in the background. A cache miss checks the queue for a pending write of the key
 * before reading storage. Mutations of one record are serialised.
 */
@Singleton
public class RecordStore extends AbstractManagedService {

    static final String ROOT = "records/";
    static final String INDEX_KEY = ROOT + "index";
    private static final String INDEX_GROUP = "record-index";

    private final StorageAdapter storage;
    private final WriteQueue writeQueue;
    private final ContentStore contentStore;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final LruCache<String, Object> cache;
    private final StripedLocks locks = new StripedLocks(64);

    private final ReentrantLock indexLock = new ReentrantLock();
    private final Set<String> recordIds = new LinkedHashSet<>();
    private boolean indexLoaded;

    @Inject
    public RecordStore(StorageAdapter storage, WriteQueue writeQueue, ContentStore contentStore,
                       CacheConfig cacheConfig, ObjectMapper mapper) {
        this(storage, writeQueue, contentStore, cacheConfig, mapper, Clock.systemUTC());
    }

    public RecordStore(StorageAdapter storage, WriteQueue writeQueue, ContentStore contentStore,
                       CacheConfig cacheConfig, ObjectMapper mapper, Clock clock) {
        this.storage = storage;
        this.writeQueue = writeQueue;
        this.contentStore = contentStore;
        this.mapper = mapper;
        this.clock = clock;
        this.cache = new LruCache<>(cacheConfig, new JsonSizeEstimator(mapper), clock);
    }

    @Override
    public String serviceId() {
        return "record-store";
    }

    @Override
    public List<ManagedService> dependencies() {
        return List.of(writeQueue);
    }

    @Override
    protected void doStart() {
        int records = listRecordIds().size();
        log.infof("RecordStore started with %d records", records);
    }

    @Override
    protected void doStop() {
        log.infof("RecordStore stopped (cache: %s)", cache.stats());
    }

    @PostConstruct
    void init() {
        try {
            start();
        } catch (Exception e) {
            throw new RuntimeException("RecordStore failed to start", e);
        }
    }

    @PreDestroy
    void shutdown() {
        try {
            stop();
        } catch (Exception e) {
            log.warn("Error stopping RecordStore", e);
        }
    }

    // -- keys --

    static String metadataKey(String recordId) {
        return ROOT + recordId + "/metadata";
    }

    static String chunkKey(String recordId, ChunkType type, int index) {
        return ROOT + recordId + "/" + type.path() + "/chunk-" + String.format("%03d", index);
    }

    static String largeObjectKey(String recordId, LargeObjectKind kind) {
        return ROOT + recordId + "/" + kind.path();
    }

    static String metadataCacheKey(String recordId) {
        return "metadata:" + recordId;
    }

    static String chunkCacheKey(String recordId, ChunkType type, int index) {
        return "chunk:" + recordId + ":" + type.path() + ":" + index;
    }

    static String largeObjectCacheKey(String recordId, LargeObjectKind kind) {
        return kind.path() + ":" + recordId;
    }

    /**
     * Record ids become key segments, so they cannot contain separators
     * ({@code /}, {@code :}, {@code \}) or be {@code .}, {@code ..} or {@code index}.
     */
    static String requireRecordId(String recordId) {
        Objects.requireNonNull(recordId, "recordId cannot be null");
        if (recordId.isEmpty() || recordId.equals(".") || recordId.equals("..") || recordId.equals("index")
                || recordId.indexOf('/') >= 0 || recordId.indexOf(':') >= 0 || recordId.indexOf('\\') >= 0) {
            throw new IllegalArgumentException("Invalid record id: " + recordId);
        }
        return recordId;
    }

    // -- metadata --

    /**
     * Stores metadata. The write is queued {@link QueuePriority#CRITICAL} when the record
     * is new or its status changes, {@link QueuePriority#NORMAL} otherwise.
     *
     * @return the metadata as stored, with timestamps assigned
     */
    public RecordMetadata saveMetadata(RecordMetadata metadata) {
        String recordId = requireRecordId(metadata.id());
        return locks.withLock(recordId, () -> {
            Optional<RecordMetadata> previous = loadMetadata(recordId);
            boolean lifecycleChange = previous.isEmpty() || previous.get().status() != metadata.status();
            return putMetadata(metadata, previous,
                    lifecycleChange ? QueuePriority.CRITICAL : QueuePriority.NORMAL);
        });
    }

    public Optional<RecordMetadata> loadMetadata(String recordId) {
        requireRecordId(recordId);
        if (!indexContains(recordId)) {
            return Optional.empty();
        }
        return readThrough(metadataCacheKey(recordId), metadataKey(recordId), RecordMetadata.class);
    }

    /** Whether the record exists and is stored in the current chunked layout. */
    public boolean isChunked(String recordId) {
        return loadMetadata(recordId)
                .map(metadata -> metadata.storageVersion() == RecordMetadata.STORAGE_VERSION)
                .orElse(false);
    }

    public List<String> listRecordIds() {
        indexLock.lock();
        try {
            ensureIndexLoaded();
            return List.copyOf(recordIds);
        } finally {
            indexLock.unlock();
        }
    }

    public List<RecordMetadata> listAllMetadata() {
        List<RecordMetadata> all = new ArrayList<>();
        for (String recordId : listRecordIds()) {
            loadMetadata(recordId).ifPresent(all::add);
        }
        return all;
    }

    // -- chunks --

    /**
     * Replaces one chunk.
     *
     * @throws RecordNotFoundException if the record has no metadata
     * @throws IllegalArgumentException if {@code entries} exceeds the chunk size
     */
    public void saveChunk(String recordId, ChunkType type, int index, List<ChunkEntry> entries) {
        requireRecordId(recordId);
        if (index < 0) {
            throw new IllegalArgumentException("chunk index cannot be negative: " + index);
        }
        locks.runWithLock(recordId, () -> {
            RecordMetadata metadata = requireMetadata(recordId);
            ChunkManifest manifest = metadata.manifest(type);
            if (entries.size() > manifest.chunkSize()) {
                throw new IllegalArgumentException("Chunk of " + entries.size() + " entries exceeds "
                        + type + " chunk size " + manifest.chunkSize());
            }
            List<ChunkEntry> replaced = index < manifest.chunkCount()
                    ? loadChunk(recordId, type, index)
                    : List.of();
            putChunk(recordId, type, index, entries);
            syncReferences(recordId, replaced, entries);

            int count = manifest.count() - replaced.size() + entries.size();
            int chunkCount = Math.max(manifest.chunkCount(), index + 1);
            ChunkManifest updated = new ChunkManifest(count, chunkCount, manifest.chunkSize());
            if (!updated.equals(manifest)) {
                putMetadata(metadata.withManifest(type, updated), Optional.of(metadata), QueuePriority.NORMAL);
            }
        });
    }

    /** Entries of one chunk, empty if the chunk was never written. */
    public List<ChunkEntry> loadChunk(String recordId, ChunkType type, int index) {
        requireRecordId(recordId);
        if (!indexContains(recordId)) {
            return List.of();
        }
        return readThrough(chunkCacheKey(recordId, type, index), chunkKey(recordId, type, index), RecordChunk.class)
                .map(RecordChunk::entries)
                .orElse(List.of());
    }

    /**
     * Replaces a whole collection, splitting it into chunks. Chunks beyond the new end
     * are deleted.
     */
    public void saveEntries(String recordId, ChunkType type, List<ChunkEntry> entries) {
        requireRecordId(recordId);
        locks.runWithLock(recordId, () -> {
            RecordMetadata metadata = requireMetadata(recordId);
            ChunkManifest previous = metadata.manifest(type);
            int chunkSize = previous.chunkSize();
            ChunkManifest manifest = ChunkManifest.forCount(entries.size(), chunkSize);
            List<ChunkEntry> replaced = new ArrayList<>();
            for (int i = 0; i < previous.chunkCount(); i++) {
                replaced.addAll(loadChunk(recordId, type, i));
            }

            for (int i = 0; i < manifest.chunkCount(); i++) {
                int from = i * chunkSize;
                putChunk(recordId, type, i, entries.subList(from, Math.min(from + chunkSize, entries.size())));
            }
            for (int i = manifest.chunkCount(); i < previous.chunkCount(); i++) {
                cache.delete(chunkCacheKey(recordId, type, i));
                writeQueue.enqueueDelete(chunkKey(recordId, type, i), QueuePriority.NORMAL);
            }
            syncReferences(recordId, replaced, entries);
            putMetadata(metadata.withManifest(type, manifest), Optional.of(metadata), QueuePriority.NORMAL);
            log.debugf("Saved %d %s entries of %s in %d chunks",
                    entries.size(), type, recordId, manifest.chunkCount());
        });
    }

    /** Every entry of a collection, in order. */
    public List<ChunkEntry> loadAllEntries(String recordId, ChunkType type) {
        Optional<RecordMetadata> metadata = loadMetadata(recordId);
        if (metadata.isEmpty()) {
            return List.of();
        }
        List<ChunkEntry> all = new ArrayList<>();
        for (int i = 0; i < metadata.get().manifest(type).chunkCount(); i++) {
            all.addAll(loadChunk(recordId, type, i));
        }
        return all;
    }

    /**
     * Appends one entry to the last chunk, or to a new chunk when the last one is full.
     *
     * @return index of the chunk the entry landed in
     */
    public int appendEntry(String recordId, ChunkType type, ChunkEntry entry) {
        requireRecordId(recordId);
        return locks.withLock(recordId, () -> {
            RecordMetadata metadata = requireMetadata(recordId);
            ChunkManifest manifest = metadata.manifest(type);
            int chunkIndex = Math.max(0, manifest.chunkCount() - 1);
            List<ChunkEntry> chunk = new ArrayList<>(manifest.chunkCount() > 0
                    ? loadChunk(recordId, type, chunkIndex)
                    : List.of());
            if (chunk.size() >= manifest.chunkSize()) {
                chunkIndex++;
                chunk = new ArrayList<>();
            }
            chunk.add(entry);
            putChunk(recordId, type, chunkIndex, chunk);

            ChunkManifest updated = new ChunkManifest(manifest.count() + 1,
                    Math.max(manifest.chunkCount(), chunkIndex + 1), manifest.chunkSize());
            putMetadata(metadata.withManifest(type, updated), Optional.of(metadata), QueuePriority.NORMAL);
            return chunkIndex;
        });
    }

    // -- attachments --

    /** Stores a screenshot attachment under a generated attachment id. */
    public ContentHash saveAttachment(String recordId, int chunkIndex, Blob blob) {
        return saveAttachment(recordId, ChunkType.SCREENSHOTS, chunkIndex, UUID.randomUUID().toString(), blob);
    }

    /**
     * Deduplicates {@code blob} through the content store, references it for this record and
     * points the chunk entry {@code attachmentId} at the hash. The entry is looked up in chunk
     * {@code chunkIndex}; when it does not exist yet a new entry is appended.
     */
    public ContentHash saveAttachment(String recordId, ChunkType type, int chunkIndex,
                                      String attachmentId, Blob blob) {
        requireRecordId(recordId);
        Objects.requireNonNull(attachmentId, "attachmentId cannot be null");
        return locks.withLock(recordId, () -> {
            requireMetadata(recordId);
            ContentHash hash = contentStore.saveAndReference(blob, recordId, attachmentId);

            if (!repoint(recordId, type, chunkIndex, attachmentId, hash)) {
                appendEntry(recordId, type, new ChunkEntry(attachmentId, hash.toHex(), Map.of()));
            }
            log.debugf("Attachment %s of %s -> %s (%d bytes)", attachmentId, recordId, hash, blob.size());
            return hash;
        });
    }

    public Optional<Blob> loadAttachment(ContentHash hash) {
        return contentStore.load(hash);
    }

    /**
     * Points an existing entry at different content, for transforms such as compression that
     * derive a new blob. The new blob must already be saved; the record's reference moves from
     * the old hash to the new one and the old blob is left for garbage collection.
     *
     * @return {@code false} if the entry does not exist
     */
    public boolean replaceAttachment(String recordId, ChunkType type, int chunkIndex,
                                     String attachmentId, ContentHash newHash) {
        requireRecordId(recordId);
        return locks.withLock(recordId, () -> {
            if (loadMetadata(recordId).isEmpty()) {
                return false;
            }
            boolean exists = loadChunk(recordId, type, chunkIndex).stream()
                    .anyMatch(e -> e.id().equals(attachmentId));
            if (!exists) {
                return false;
            }
            contentStore.addReference(newHash, recordId, attachmentId);
            return repoint(recordId, type, chunkIndex, attachmentId, newHash);
        });
    }

    // -- large objects --

    public void saveLargeObject(String recordId, LargeObjectKind kind, Object value) {
        requireRecordId(recordId);
        Objects.requireNonNull(value, "value cannot be null");
        locks.runWithLock(recordId, () -> {
            RecordMetadata metadata = requireMetadata(recordId);
            String cacheKey = largeObjectCacheKey(recordId, kind);
            cache.delete(cacheKey);
            cache.set(cacheKey, value);
            writeQueue.enqueue(largeObjectKey(recordId, kind), value, kind.priority());
            if (!metadata.largeObjects().contains(kind)) {
                putMetadata(metadata.withLargeObject(kind), Optional.of(metadata), QueuePriority.NORMAL);
            }
        });
    }

    public <T> Optional<T> loadLargeObject(String recordId, LargeObjectKind kind, Class<T> type) {
        requireRecordId(recordId);
        if (!indexContains(recordId)) {
            return Optional.empty();
        }
        return readThrough(largeObjectCacheKey(recordId, kind), largeObjectKey(recordId, kind), type);
    }

    // -- whole records --

    public void saveRecord(RecordSnapshot snapshot) {
        String recordId = requireRecordId(snapshot.metadata().id());
        locks.runWithLock(recordId, () -> {
            saveMetadata(snapshot.metadata());
            snapshot.entries().forEach((type, entries) -> saveEntries(recordId, type, entries));
            snapshot.largeObjects().forEach((kind, value) -> saveLargeObject(recordId, kind, value));
        });
    }

    /**
     * Rewrites a record read from an older layout in the current chunked layout. Attachment
     * hashes in the snapshot's entries are referenced when their blobs are stored.
     */
    public void migrateFromLegacy(RecordSnapshot legacy) {
        String recordId = requireRecordId(legacy.metadata().id());
        log.infof("Migrating record %s from storage version %d to %d",
                recordId, legacy.metadata().storageVersion(), RecordMetadata.STORAGE_VERSION);
        saveRecord(new RecordSnapshot(legacy.metadata().withStorageVersion(RecordMetadata.STORAGE_VERSION),
                legacy.entries(), legacy.largeObjects()));
        log.infof("Migrated record %s", recordId);
    }

    public Optional<RecordSnapshot> loadRecord(String recordId) {
        Optional<RecordMetadata> metadata = loadMetadata(recordId);
        if (metadata.isEmpty()) {
            return Optional.empty();
        }
        Map<ChunkType, List<ChunkEntry>> entries = new EnumMap<>(ChunkType.class);
        for (ChunkType type : metadata.get().chunks().keySet()) {
            entries.put(type, loadAllEntries(recordId, type));
        }
        Map<LargeObjectKind, Object> largeObjects = new EnumMap<>(LargeObjectKind.class);
        for (LargeObjectKind kind : metadata.get().largeObjects()) {
            loadLargeObject(recordId, kind, Object.class).ifPresent(value -> largeObjects.put(kind, value));
        }
        return Optional.of(new RecordSnapshot(metadata.get(), entries, largeObjects));
    }

    /**
     * Deletes a record: releases its attachment references, clears its cache entries and
     * queues critical deletes of every stored piece.
     *
     * @return {@code false} if the record does not exist
     */
    public boolean deleteRecord(String recordId) {
        requireRecordId(recordId);
        return locks.withLock(recordId, () -> {
            Optional<RecordMetadata> found = loadMetadata(recordId);
            if (found.isEmpty()) {
                clearRecordCache(recordId);
                return false;
            }
            RecordMetadata metadata = found.get();

            Set<String> hashes = new LinkedHashSet<>();
            List<String> chunkKeys = new ArrayList<>();
            for (Map.Entry<ChunkType, ChunkManifest> collection : metadata.chunks().entrySet()) {
                for (int i = 0; i < collection.getValue().chunkCount(); i++) {
                    for (ChunkEntry entry : loadChunk(recordId, collection.getKey(), i)) {
                        if (entry.attachmentHash() != null) {
                            hashes.add(entry.attachmentHash());
                        }
                    }
                    chunkKeys.add(chunkKey(recordId, collection.getKey(), i));
                }
            }
            for (String hex : hashes) {
                try {
                    contentStore.removeReference(ContentHash.fromHex(hex), recordId);
                } catch (RuntimeException e) {
                    log.errorf(e, "Failed to release attachment %s of record %s", hex, recordId);
                }
            }

            clearRecordCache(recordId);
            removeFromIndex(recordId);
            for (String key : chunkKeys) {
                writeQueue.enqueueDelete(key, QueuePriority.CRITICAL);
            }
            for (LargeObjectKind kind : metadata.largeObjects()) {
                writeQueue.enqueueDelete(largeObjectKey(recordId, kind), QueuePriority.CRITICAL);
            }
            writeQueue.enqueueDelete(metadataKey(recordId), QueuePriority.CRITICAL);

            log.infof("Deleted record %s (%d chunks, %d attachments released)",
                    recordId, chunkKeys.size(), hashes.size());
            return true;
        });
    }

    /**
     * Drops every cache entry of a record.
     *
     * @return number of entries removed
     */
    public int clearRecordCache(String recordId) {
        requireRecordId(recordId);
        int removed = cache.delete(metadataCacheKey(recordId)) ? 1 : 0;
        for (LargeObjectKind kind : LargeObjectKind.values()) {
            if (cache.delete(largeObjectCacheKey(recordId, kind))) {
                removed++;
            }
        }
        removed += cache.invalidatePattern("chunk:" + recordId + ":");
        return removed;
    }

    // -- cache management --

    public CacheStats cacheStats() {
        return cache.stats();
    }

    /**
     * Changes the record cache's byte bound at runtime, keeping current entries that fit.
     *
     * @return number of entries evicted
     */
    public int setCacheSize(long maxSizeBytes) {
        CacheStats before = cache.stats();
        int evicted = cache.resize(maxSizeBytes);
        log.infof("Record cache resized from %d to %d bytes (%d entries evicted)",
                before.maxSize(), maxSizeBytes, evicted);
        return evicted;
    }

    public int pruneCache() {
        return cache.prune();
    }

    public void clearCache() {
        cache.clear();
    }

    // -- internals --

    private RecordMetadata requireMetadata(String recordId) {
        return loadMetadata(recordId).orElseThrow(() -> new RecordNotFoundException(recordId));
    }

    private RecordMetadata putMetadata(RecordMetadata metadata, Optional<RecordMetadata> previous,
                                       QueuePriority priority) {
        String recordId = metadata.id();
        String cacheKey = metadataCacheKey(recordId);
        cache.delete(cacheKey);

        Instant now = clock.instant();
        Instant created = previous.map(RecordMetadata::createdAt)
                .orElse(metadata.createdAt() != null ? metadata.createdAt() : now);
        RecordMetadata stamped = metadata.stamped(created, now);
        boolean added = addToIndex(recordId);

        cache.set(cacheKey, stamped);
        writeQueue.enqueue(metadataKey(recordId), stamped, priority);
        if (added) {
            enqueueIndex(QueuePriority.CRITICAL);
        }
        return stamped;
    }

    private void putChunk(String recordId, ChunkType type, int index, List<ChunkEntry> entries) {
        String cacheKey = chunkCacheKey(recordId, type, index);
        cache.delete(cacheKey);
        RecordChunk chunk = new RecordChunk(recordId, type, index, entries);
        cache.set(cacheKey, chunk);
        writeQueue.enqueue(chunkKey(recordId, type, index), chunk, QueuePriority.NORMAL,
                QueueItemType.CHUNK, recordId);
    }

    /**
     * Aligns content references with replaced chunk entries: references of attachments that
     * disappeared are released, attachments that newly point at a stored blob are referenced.
     */
    private void syncReferences(String recordId, List<ChunkEntry> before, List<ChunkEntry> after) {
        Set<AttachmentRef> kept = attachmentRefs(after);
        Set<AttachmentRef> previous = attachmentRefs(before);
        for (AttachmentRef ref : kept) {
            if (previous.contains(ref)) {
                continue;
            }
            try {
                contentStore.addReference(ContentHash.fromHex(ref.hash()), recordId, ref.attachmentId());
            } catch (BlobNotFoundException e) {
                log.warnf("Entry %s of %s points at unknown blob %s", ref.attachmentId(), recordId, ref.hash());
            }
        }
        for (AttachmentRef ref : previous) {
            if (!kept.contains(ref)) {
                contentStore.removeReference(ContentHash.fromHex(ref.hash()), recordId, ref.attachmentId());
            }
        }
    }

    private static Set<AttachmentRef> attachmentRefs(List<ChunkEntry> entries) {
        Set<AttachmentRef> refs = new HashSet<>();
        for (ChunkEntry entry : entries) {
            if (entry.attachmentHash() != null) {
                refs.add(new AttachmentRef(entry.id(), entry.attachmentHash()));
            }
        }
        return refs;
    }

    private record AttachmentRef(String attachmentId, String hash) {
    }

    /** Points entry {@code attachmentId} at {@code hash}, releasing the previous hash. */
    private boolean repoint(String recordId, ChunkType type, int chunkIndex, String attachmentId, ContentHash hash) {
        List<ChunkEntry> entries = new ArrayList<>(loadChunk(recordId, type, chunkIndex));
        for (int i = 0; i < entries.size(); i++) {
            ChunkEntry entry = entries.get(i);
            if (!entry.id().equals(attachmentId)) {
                continue;
            }
            String previous = entry.attachmentHash();
            if (hash.toHex().equals(previous)) {
                return true;
            }
            entries.set(i, entry.withAttachment(hash.toHex()));
            putChunk(recordId, type, chunkIndex, entries);
            if (previous != null) {
                contentStore.removeReference(ContentHash.fromHex(previous), recordId, attachmentId);
            }
            return true;
        }
        return false;
    }

    private <T> Optional<T> readThrough(String cacheKey, String storageKey, Class<T> type) {
        Optional<Object> cached = cache.get(cacheKey);
        if (cached.isPresent()) {
            return Optional.of(convert(cached.get(), type));
        }

        Optional<QueueItem> pending = writeQueue.pendingWrite(storageKey);
        if (pending.isPresent()) {
            QueueItem item = pending.get();
            if (item.operation() == QueueOperation.DELETE) {
                return Optional.empty();
            }
            T value = convert(item.value(), type);
            cache.set(cacheKey, value);
            return Optional.of(value);
        }

        Optional<T> loaded = storage.load(storageKey, type).await().indefinitely();
        loaded.ifPresent(value -> cache.set(cacheKey, value));
        return loaded;
    }

    private <T> T convert(Object value, Class<T> type) {
        return type.isInstance(value) ? type.cast(value) : mapper.convertValue(value, type);
    }

    // -- index --

    private void ensureIndexLoaded() {
        if (indexLoaded) {
            return;
        }
        storage.load(INDEX_KEY, RecordIndex.class).await().indefinitely()
                .ifPresent(index -> recordIds.addAll(index.recordIds()));
        indexLoaded = true;
    }

    private boolean indexContains(String recordId) {
        indexLock.lock();
        try {
            ensureIndexLoaded();
            return recordIds.contains(recordId);
        } finally {
            indexLock.unlock();
        }
    }

    private boolean addToIndex(String recordId) {
        indexLock.lock();
        try {
            ensureIndexLoaded();
            return recordIds.add(recordId);
        } finally {
            indexLock.unlock();
        }
    }

    private void removeFromIndex(String recordId) {
        indexLock.lock();
        try {
            ensureIndexLoaded();
            if (recordIds.remove(recordId)) {
                enqueueIndex(QueuePriority.CRITICAL);
            }
        } finally {
            indexLock.unlock();
        }
    }

    private void enqueueIndex(QueuePriority priority) {
        indexLock.lock();
        try {
            writeQueue.enqueue(INDEX_KEY, new RecordIndex(List.copyOf(recordIds)), priority,
                    QueueItemType.INDEX, INDEX_GROUP);
        } finally {
            indexLock.unlock();
        }
    }
}
