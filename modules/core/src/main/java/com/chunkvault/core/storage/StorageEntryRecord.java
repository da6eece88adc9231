package com.chunkvault.core.storage;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record StorageEntryRecord(
        @ColumnName("entry_key") String key,
        @ColumnName("entry_value") String value,
        @ColumnName("updated_at") Instant updatedAt
) {}
