package com.chunkvault.test;

import com.chunkvault.core.content.Blob;
import com.chunkvault.core.content.ContentStore;
import com.chunkvault.core.gc.GarbageCollectionScheduler;
import com.chunkvault.core.queue.WriteQueue;
import com.chunkvault.core.record.ChunkEntry;
import com.chunkvault.core.record.ChunkType;
import com.chunkvault.core.record.LargeObjectKind;
import com.chunkvault.core.record.RecordMetadata;
import com.chunkvault.core.record.RecordSnapshot;
import com.chunkvault.core.record.RecordStore;
import com.chunkvault.core.storage.InMemoryStorageAdapter;
import com.chunkvault.util.ContentHash;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@QuarkusTest
class StorageEngineIntegrationTest {

    @Inject
    RecordStore recordStore;

    @Inject
    ContentStore contentStore;

    @Inject
    WriteQueue writeQueue;

    @Inject
    InMemoryStorageAdapter storage;

    @Inject
    GarbageCollectionScheduler gcScheduler;

    private void flush() {
        writeQueue.flush().await().atMost(Duration.ofSeconds(5));
    }

    private boolean stored(String key) {
        return storage.exists(key).await().indefinitely();
    }

    @Test
    void recordLifecycleReachesStorage() {
        String id = "rec-" + UUID.randomUUID();
        recordStore.saveMetadata(RecordMetadata.create(id, "Integration"));
        recordStore.appendEntry(id, ChunkType.AUDIO_SEGMENTS, ChunkEntry.of("seg-1", Map.of("ms", 1200)));
        recordStore.saveLargeObject(id, LargeObjectKind.SUMMARY, Map.of("text", "short summary"));
        ContentHash hash = recordStore.saveAttachment(id, 0,
                new Blob(("shot of " + id).getBytes(StandardCharsets.UTF_8), "image/png"));

        flush();

        assertThat(stored("records/" + id + "/metadata")).isTrue();
        assertThat(stored("records/" + id + "/audio-segments/chunk-000")).isTrue();
        assertThat(stored("records/" + id + "/summary")).isTrue();
        assertThat(recordStore.listRecordIds()).contains(id);
        assertThat(contentStore.referenceCount(hash)).isEqualTo(1);

        recordStore.clearCache();
        RecordSnapshot snapshot = recordStore.loadRecord(id).orElseThrow();
        assertThat(snapshot.metadata().name()).isEqualTo("Integration");
        assertThat(snapshot.entries().get(ChunkType.AUDIO_SEGMENTS)).extracting(ChunkEntry::id)
                .containsExactly("seg-1");
        assertThat(snapshot.entries().get(ChunkType.SCREENSHOTS)).extracting(ChunkEntry::attachmentHash)
                .containsExactly(hash.toHex());
        assertThat(snapshot.largeObjects()).containsKey(LargeObjectKind.SUMMARY);
    }

    @Test
    void deletedRecordReleasesAttachmentsForGarbageCollection() {
        String id = "rec-" + UUID.randomUUID();
        recordStore.saveMetadata(RecordMetadata.create(id, "Doomed"));
        ContentHash hash = recordStore.saveAttachment(id, 0,
                new Blob(("doomed " + id).getBytes(StandardCharsets.UTF_8), "image/png"));
        flush();

        assertThat(recordStore.deleteRecord(id)).isTrue();
        assertThat(recordStore.loadMetadata(id)).isEmpty();
        flush();

        assertThat(stored("records/" + id + "/metadata")).isFalse();
        assertThat(recordStore.listRecordIds()).doesNotContain(id);
        assertThat(contentStore.referenceCount(hash)).isZero();

        gcScheduler.sweep();

        assertThat(gcScheduler.lastResult().deleted()).isGreaterThanOrEqualTo(1);
        assertThat(contentStore.exists(hash)).isFalse();
    }

    @Test
    void sharedAttachmentIsStoredOnce() {
        byte[] bytes = ("shared " + UUID.randomUUID()).getBytes(StandardCharsets.UTF_8);
        String first = "rec-" + UUID.randomUUID();
        String second = "rec-" + UUID.randomUUID();
        recordStore.saveMetadata(RecordMetadata.create(first, "First"));
        recordStore.saveMetadata(RecordMetadata.create(second, "Second"));

        ContentHash a = recordStore.saveAttachment(first, 0, new Blob(bytes, "image/png"));
        ContentHash b = recordStore.saveAttachment(second, 0, new Blob(bytes, "image/png"));

        assertThat(a).isEqualTo(b);
        assertThat(contentStore.referenceCount(a)).isEqualTo(2);
        assertThat(contentStore.references(a)).containsExactlyInAnyOrder(first, second);

        recordStore.deleteRecord(first);
        assertThat(contentStore.referenceCount(a)).isEqualTo(1);
        assertThat(recordStore.loadAttachment(a)).isPresent();
        recordStore.deleteRecord(second);
        flush();
    }
}
