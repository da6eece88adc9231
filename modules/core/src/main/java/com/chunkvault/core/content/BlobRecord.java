package com.chunkvault.core.content;

import com.chunkvault.util.ContentHash;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Persisted metadata of one unique blob.
 *
 * <p>{@code refCount} always equals {@code references.size()}; the canonical constructor
 * rejects anything else, which also catches corrupted metadata on load. Reference
 * changes go through {@link ContentStore} only.
 */
public record BlobRecord(
        String hash,
        long size,
        String mimeType,
        List<Reference> references,
        int refCount,
        Instant createdAt,
        Instant lastAccessedAt
) {

    public BlobRecord {
        Objects.requireNonNull(hash, "hash cannot be null");
        references = references == null ? List.of() : List.copyOf(references);
        if (refCount != references.size()) {
            throw new IllegalArgumentException("refCount " + refCount + " does not match "
                    + references.size() + " references for blob " + hash);
        }
    }

    static BlobRecord created(ContentHash hash, long size, String mimeType, Instant now) {
        return new BlobRecord(hash.toHex(), size, mimeType, List.of(), 0, now, now);
    }

    public ContentHash contentHash() {
        return ContentHash.fromHex(hash);
    }

    public boolean hasReference(String ownerId, String attachmentId) {
        return references.stream().anyMatch(r -> r.matches(ownerId, attachmentId));
    }

    /** Owner id of every reference, one element per reference. */
    public List<String> ownerIds() {
        return references.stream().map(Reference::ownerId).toList();
    }

    public boolean orphaned() {
        return refCount == 0;
    }

    BlobRecord withReference(Reference reference, Instant now) {
        List<Reference> updated = new ArrayList<>(references);
        updated.add(reference);
        return new BlobRecord(hash, size, mimeType, updated, updated.size(), createdAt, now);
    }

    BlobRecord withoutReferences(Predicate<Reference> matcher, Instant now) {
        List<Reference> updated = references.stream().filter(matcher.negate()).toList();
        return new BlobRecord(hash, size, mimeType, updated, updated.size(), createdAt, now);
    }
}
