package com.chunkvault.core.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Behaviour every {@link StorageAdapter} shares. Subclasses supply the adapter.
 */
abstract class StorageAdapterContract {

    protected final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    protected abstract StorageAdapter adapter();

    record Sample(String name, int count, Instant at) {}

    @Test
    void shouldRoundTripObject() {
        Sample sample = new Sample("alpha", 3, Instant.parse("2024-05-01T10:15:30.123Z"));
        adapter().save("samples/alpha", sample).await().indefinitely();

        assertThat(adapter().load("samples/alpha", Sample.class).await().indefinitely()).contains(sample);
    }

    @Test
    void shouldRoundTripBytes() {
        byte[] data = "binary\u0000payload".getBytes(StandardCharsets.UTF_8);
        adapter().save("content/ab/abcdef/data", data).await().indefinitely();

        assertThat(adapter().load("content/ab/abcdef/data", byte[].class).await().indefinitely())
                .hasValueSatisfying(loaded -> assertThat(loaded).isEqualTo(data));
    }

    @Test
    void shouldReturnEmptyForMissingKey() {
        assertThat(adapter().load("nope", String.class).await().indefinitely()).isEmpty();
        assertThat(adapter().exists("nope").await().indefinitely()).isFalse();
    }

    @Test
    void shouldOverwriteExistingKey() {
        adapter().save("k", "one").await().indefinitely();
        adapter().save("k", "two").await().indefinitely();

        assertThat(adapter().load("k", String.class).await().indefinitely()).contains("two");
    }

    @Test
    void shouldDeleteKey() {
        adapter().save("records/r1/metadata", "m").await().indefinitely();

        assertThat(adapter().delete("records/r1/metadata").await().indefinitely()).isTrue();
        assertThat(adapter().delete("records/r1/metadata").await().indefinitely()).isFalse();
        assertThat(adapter().exists("records/r1/metadata").await().indefinitely()).isFalse();
    }

    @Test
    void shouldListKeysByPrefixInOrder() {
        adapter().save("records/r2/metadata", 1).await().indefinitely();
        adapter().save("records/r1/screenshots/chunk-001", 2).await().indefinitely();
        adapter().save("records/r1/metadata", 3).await().indefinitely();
        adapter().save("content/aa/x/data", 4).await().indefinitely();

        List<String> keys = adapter().listKeys("records/r1/").collect().asList().await().indefinitely();

        assertThat(keys).containsExactly("records/r1/metadata", "records/r1/screenshots/chunk-001");
        assertThat(adapter().listKeys("").collect().asList().await().indefinitely()).hasSize(4);
    }

    @Test
    void shouldSaveAll() {
        Map<String, Object> entries = new LinkedHashMap<>();
        entries.put("batch/a", "A");
        entries.put("batch/b", Map.of("x", 1));
        adapter().saveAll(entries).await().indefinitely();

        assertThat(adapter().load("batch/a", String.class).await().indefinitely()).contains("A");
        assertThat(adapter().exists("batch/b").await().indefinitely()).isTrue();
    }

    @Test
    void shouldRejectUnsafeKeys() {
        for (String key : List.of("", "../escape", "a//b", "a/./b", "back\\slash", "trailing/")) {
            assertThatThrownBy(() -> adapter().save(key, "x").await().indefinitely())
                    .as(key)
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
