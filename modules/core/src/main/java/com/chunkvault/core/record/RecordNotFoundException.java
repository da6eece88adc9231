package com.chunkvault.core.record;

/**
 * Thrown when a chunk, attachment or large object is written for a record that has no metadata.
 */
public class RecordNotFoundException extends RuntimeException {

    private final String recordId;

    public RecordNotFoundException(String recordId) {
        super("Record not found: " + recordId);
        this.recordId = recordId;
    }

    public String recordId() {
        return recordId;
    }
}
