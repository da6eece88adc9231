package com.chunkvault.core.content;

import com.chunkvault.util.ContentHash;

/**
 * Thrown when a reference is added to a blob that was never saved.
 */
public class BlobNotFoundException extends RuntimeException {

    private final ContentHash hash;

    public BlobNotFoundException(ContentHash hash) {
        super("Blob not found: " + hash);
        this.hash = hash;
    }

    public ContentHash hash() {
        return hash;
    }
}
