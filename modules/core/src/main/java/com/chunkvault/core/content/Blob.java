package com.chunkvault.core.content;

import java.util.Arrays;
import java.util.Objects;

/**
 * Raw binary payload with its MIME type. Immutable: the bytes are copied on the way in
 * and on the way out.
 */
public record Blob(byte[] data, String mimeType) {

    public static final String DEFAULT_MIME_TYPE = "application/octet-stream";

    public Blob {
        Objects.requireNonNull(data, "data cannot be null");
        data = Arrays.copyOf(data, data.length);
        if (mimeType == null || mimeType.isBlank()) {
            mimeType = DEFAULT_MIME_TYPE;
        }
    }

    public static Blob of(byte[] data) {
        return new Blob(data, DEFAULT_MIME_TYPE);
    }

    @Override
    public byte[] data() {
        return Arrays.copyOf(data, data.length);
    }

    public long size() {
        return data.length;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Blob other)) return false;
        return Arrays.equals(data, other.data) && mimeType.equals(other.mimeType);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(data) + mimeType.hashCode();
    }

    @Override
    public String toString() {
        return "Blob[" + mimeType + ", " + data.length + " bytes]";
    }
}
