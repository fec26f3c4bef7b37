package com.libragraph.finder.util;

import org.apache.commons.codec.digest.Blake3;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Represents a BLAKE3-128 content hash (16 bytes).
 * Immutable value object that can be used as a map key.
 *
 * Used by the finder to recognise a container it is already inside of
 * when descending into nested archives.
 */
public record ContentHash(byte[] bytes) {
    private static final int HASH_LENGTH = 16; // 128 bits
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    public ContentHash {
        Objects.requireNonNull(bytes, "Content hash bytes cannot be null");
        if (bytes.length != HASH_LENGTH) {
            throw new IllegalArgumentException(
                "Content hash must be 16 bytes (BLAKE3-128), got: " + bytes.length
            );
        }
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Hashes an in-memory byte array.
     */
    public static ContentHash of(byte[] data) {
        Objects.requireNonNull(data, "data cannot be null");
        Blake3 hasher = Blake3.initHash();
        hasher.update(data);
        return new ContentHash(hasher.doFinalize(HASH_LENGTH));
    }

    /**
     * Returns lowercase hex representation (32 characters).
     */
    public String toHex() {
        return HEX_FORMAT.formatHex(bytes);
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
