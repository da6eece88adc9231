package com.chunkvault.util;

import org.apache.commons.codec.digest.Blake3;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Represents a BLAKE3-256 content hash (32 bytes).
 * Immutable value object that can be used as a map key.
 *
 * <p>Identical bytes always produce the identical hash, which is what makes
 * content-addressed storage deduplicate structurally.
 */
public record ContentHash(byte[] bytes) {
    public static final int HASH_LENGTH = 32; // 256 bits
    public static final int HEX_LENGTH = HASH_LENGTH * 2;
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    public ContentHash {
        Objects.requireNonNull(bytes, "Content hash bytes cannot be null");
        if (bytes.length != HASH_LENGTH) {
            throw new IllegalArgumentException(
                "Content hash must be 32 bytes (BLAKE3-256), got: " + bytes.length
            );
        }
        // Defensive copy to ensure immutability
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Hashes the given content.
     */
    public static ContentHash of(byte[] content) {
        Objects.requireNonNull(content, "content cannot be null");
        byte[] digest = new byte[HASH_LENGTH];
        Blake3.initHash().update(content).doFinalize(digest);
        return new ContentHash(digest);
    }

    /**
     * Creates ContentHash from hex string (64 characters).
     */
    public static ContentHash fromHex(String hex) {
        Objects.requireNonNull(hex, "hex string cannot be null");
        if (hex.length() != HEX_LENGTH) {
            throw new IllegalArgumentException(
                "BLAKE3-256 hex string must be 64 characters, got: " + hex.length()
            );
        }
        try {
            return new ContentHash(HEX_FORMAT.parseHex(hex));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid hex string: " + hex, e);
        }
    }

    /**
     * Returns lowercase hex representation (64 characters).
     */
    public String toHex() {
        return HEX_FORMAT.formatHex(bytes);
    }

    /**
     * First two hex characters, used to shard storage paths.
     */
    public String prefix() {
        return toHex().substring(0, 2);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ContentHash other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
