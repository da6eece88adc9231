package com.chunkvault.core.record;

import java.util.List;

/**
 * Stored list of all record ids.
 */
public record RecordIndex(List<String> recordIds) {

    public RecordIndex {
        recordIds = recordIds == null ? List.of() : List.copyOf(recordIds);
    }
}
