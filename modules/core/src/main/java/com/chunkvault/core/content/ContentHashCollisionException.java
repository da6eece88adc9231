package com.chunkvault.core.content;

import com.chunkvault.util.ContentHash;

/**
 * Thrown when content being saved hashes to an existing blob whose stored content differs.
 */
public class ContentHashCollisionException extends RuntimeException {

    private final ContentHash hash;

    public ContentHashCollisionException(ContentHash hash, String detail) {
        super("Content hash collision on " + hash + ": " + detail);
        this.hash = hash;
    }

    public ContentHash hash() {
        return hash;
    }
}
