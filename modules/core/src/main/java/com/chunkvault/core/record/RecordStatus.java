package com.chunkvault.core.record;

public enum RecordStatus {
    ACTIVE,
    PAUSED,
    COMPLETED,
    ARCHIVED
}
