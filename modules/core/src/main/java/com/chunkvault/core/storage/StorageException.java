package com.chunkvault.core.storage;

/**
 * Wraps checked I/O, SQL and serialization failures from storage operations.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageException(String message) {
        super(message);
    }
}
