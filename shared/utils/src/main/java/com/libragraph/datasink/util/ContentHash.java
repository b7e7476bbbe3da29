package com.libragraph.datasink.util;

import org.apache.commons.codec.digest.Blake3;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * BLAKE3-128 digest of a dataset's binary content (16 bytes).
 * Immutable value object that can be used as a map key.
 *
 * <p>Always computed from the stored bytes via {@link #of(byte[])}; never taken
 * from a client.
 */
public record ContentHash(byte[] bytes) {
    private static final int HASH_LENGTH = 16;
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
     * Hashes the given content.
     */
    public static ContentHash of(byte[] content) {
        Objects.requireNonNull(content, "content cannot be null");
        byte[] digest = Blake3.initHash().update(content).doFinalize(HASH_LENGTH);
        return new ContentHash(digest);
    }

    /**
     * Parses a 32-character hex string, as stored in listings and the jdbc backend.
     */
    public static ContentHash fromHex(String hex) {
        Objects.requireNonNull(hex, "hex string cannot be null");
        if (hex.length() != 32) {
            throw new IllegalArgumentException(
                "BLAKE3-128 hex string must be 32 characters, got: " + hex.length()
            );
        }
        try {
            return new ContentHash(HEX_FORMAT.parseHex(hex));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid hex string: " + hex, e);
        }
    }

    public boolean matches(byte[] content) {
        return equals(of(content));
    }

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
