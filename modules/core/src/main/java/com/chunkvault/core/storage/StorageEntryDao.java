package com.chunkvault.core.storage;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface StorageEntryDao {

    @SqlUpdate("""
            CREATE TABLE IF NOT EXISTS storage_entry (
                entry_key   VARCHAR(1024) PRIMARY KEY,
                entry_value TEXT NOT NULL,
                updated_at  TIMESTAMP NOT NULL
            )""")
    void createTable();

    @SqlQuery("SELECT entry_key, entry_value, updated_at FROM storage_entry WHERE entry_key = :key")
    @RegisterConstructorMapper(StorageEntryRecord.class)
    Optional<StorageEntryRecord> findByKey(@Bind("key") String key);

    @SqlQuery("SELECT COUNT(*) FROM storage_entry WHERE entry_key = :key")
    int countByKey(@Bind("key") String key);

    @SqlUpdate("UPDATE storage_entry SET entry_value = :value, updated_at = :updatedAt WHERE entry_key = :key")
    int update(@Bind("key") String key, @Bind("value") String value, @Bind("updatedAt") Instant updatedAt);

    @SqlUpdate("INSERT INTO storage_entry (entry_key, entry_value, updated_at) VALUES (:key, :value, :updatedAt)")
    void insert(@Bind("key") String key, @Bind("value") String value, @Bind("updatedAt") Instant updatedAt);

    @SqlUpdate("DELETE FROM storage_entry WHERE entry_key = :key")
    int delete(@Bind("key") String key);

    @SqlQuery("SELECT entry_key FROM storage_entry ORDER BY entry_key")
    List<String> listAllKeys();

    @SqlQuery("""
            SELECT entry_key FROM storage_entry
            WHERE SUBSTRING(entry_key, 1, :prefixLength) = :prefix
            ORDER BY entry_key""")
    List<String> listKeys(@Bind("prefix") String prefix, @Bind("prefixLength") int prefixLength);
}
