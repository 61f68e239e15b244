package com.libragraph.sift.util;

import org.apache.commons.codec.digest.Blake3;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * BLAKE3 digest truncated to 128 bits, used with the size in {@link ContentRef}
 * to spot byte-identical regions within a scan session.
 */
public record ContentHash(byte[] bytes) {

    public static final int LENGTH = 16;

    public ContentHash {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("ContentHash needs exactly 16 bytes, got "
                    + (bytes == null ? "null" : bytes.length));
        }
        bytes = bytes.clone();
    }

    public static ContentHash of(byte[] data) {
        return finish(Blake3.initHash().update(data));
    }

    /**
     * Completes {@code hasher}, which must not be used afterwards.
     */
    public static ContentHash finish(Blake3 hasher) {
        return new ContentHash(hasher.doFinalize(LENGTH));
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    /** 32 lowercase hex digits. */
    public String toHex() {
        return HexFormat.of().formatHex(bytes);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ContentHash other && Arrays.equals(bytes, other.bytes);
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
