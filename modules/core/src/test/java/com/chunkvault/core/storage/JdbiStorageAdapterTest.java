package com.chunkvault.core.storage;

import io.agroal.api.AgroalDataSource;
import io.agroal.api.configuration.supplier.AgroalDataSourceConfigurationSupplier;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class JdbiStorageAdapterTest extends StorageAdapterContract {

    private AgroalDataSource dataSource;
    private Jdbi jdbi;
    private JdbiStorageAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        String url = "jdbc:h2:mem:storage-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        dataSource = AgroalDataSource.from(new AgroalDataSourceConfigurationSupplier()
                .connectionPoolConfiguration(pool -> pool
                        .maxSize(8)
                        .connectionFactoryConfiguration(factory -> factory.jdbcUrl(url))));
        jdbi = new JdbiProducer().jdbi(dataSource);
        adapter = new JdbiStorageAdapter(jdbi, mapper);
    }

    @AfterEach
    void tearDown() {
        jdbi.useHandle(h -> h.execute("SHUTDOWN"));
        dataSource.close();
    }

    @Override
    protected StorageAdapter adapter() {
        return adapter;
    }

    @Test
    void shouldCreateTableIdempotently() {
        new JdbiStorageAdapter(jdbi, mapper);
        adapter.save("k", "v").await().indefinitely();

        int rows = jdbi.withHandle(h -> h.createQuery("SELECT COUNT(*) FROM storage_entry")
                .mapTo(int.class).one());
        assertThat(rows).isEqualTo(1);
    }

    @Test
    void shouldRollBackFailedBatch() {
        Map<String, Object> entries = new LinkedHashMap<>();
        entries.put("batch/ok", "fine");
        entries.put("batch/" + "x".repeat(2000), "key too long for the column");

        assertThatThrownBy(() -> adapter.saveAll(entries).await().indefinitely())
                .isInstanceOf(StorageException.class);
        assertThat(adapter.exists("batch/ok").await().indefinitely()).isFalse();
    }

    @Test
    void shouldNotMatchLikeWildcardsInPrefix() {
        adapter.save("records/a_b/metadata", 1).await().indefinitely();
        adapter.save("records/axb/metadata", 2).await().indefinitely();

        assertThat(adapter.listKeys("records/a_b/").collect().asList().await().indefinitely())
                .containsExactly("records/a_b/metadata");
    }

    @Test
    void shouldUpsertSameKeyFromConcurrentSaveAndSaveAll() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < 50; i++) {
                String key = "race/" + i;
                CountDownLatch go = new CountDownLatch(1);
                List<Future<?>> writers = new ArrayList<>();
                writers.add(pool.submit(() -> {
                    go.await();
                    return adapter.save(key, "single").await().indefinitely();
                }));
                writers.add(pool.submit(() -> {
                    go.await();
                    return adapter.saveAll(Map.of(key, "batched", key + "-sibling", "x")).await().indefinitely();
                }));
                go.countDown();
                for (Future<?> writer : writers) {
                    writer.get(5, TimeUnit.SECONDS);
                }
                assertThat(adapter.load(key, String.class).await().indefinitely())
                        .hasValueSatisfying(v -> assertThat(v).isIn("single", "batched"));
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
