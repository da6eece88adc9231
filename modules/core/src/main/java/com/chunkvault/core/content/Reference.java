package com.chunkvault.core.content;

import java.time.Instant;
import java.util.Objects;

/**
 * One (owner, attachment) pair using a stored blob.
 */
public record Reference(String ownerId, String attachmentId, Instant addedAt) {

    public Reference {
        Objects.requireNonNull(ownerId, "ownerId cannot be null");
        Objects.requireNonNull(attachmentId, "attachmentId cannot be null");
    }

    public boolean matches(String owner, String attachment) {
        return ownerId.equals(owner) && attachmentId.equals(attachment);
    }
}
