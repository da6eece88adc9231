package com.chunkvault.core.storage;

import java.util.Objects;

/**
 * Key validation shared by all {@link StorageAdapter} implementations.
 */
public final class StorageKeys {

    public static final char SEPARATOR = '/';

    private StorageKeys() {
    }

    /**
     * Rejects keys that could escape a storage root or collide once mapped to a path:
     * empty keys, empty segments, {@code .} / {@code ..} segments and backslashes.
     */
    public static String requireValid(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        if (key.isEmpty()) {
            throw new IllegalArgumentException("key cannot be empty");
        }
        if (key.indexOf('\\') >= 0) {
            throw new IllegalArgumentException("key cannot contain '\\': " + key);
        }
        for (String segment : key.split(String.valueOf(SEPARATOR), -1)) {
            if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
                throw new IllegalArgumentException("Invalid key: " + key);
            }
        }
        return key;
    }
}
