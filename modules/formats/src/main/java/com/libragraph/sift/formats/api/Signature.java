package com.libragraph.sift.formats.api;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Magic bytes expected {@code offset} bytes after the start of a format instance.
 *
 * @param offset  position of the pattern relative to the artifact start (257 for TAR)
 * @param pattern bytes to match
 */
public record Signature(int offset, byte[] pattern) {

    public Signature {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        pattern = Arrays.copyOf(pattern, pattern.length);
    }

    public static Signature of(int offset, byte... pattern) {
        return new Signature(offset, pattern);
    }

    public static Signature ascii(int offset, String text) {
        return new Signature(offset, text.getBytes(StandardCharsets.US_ASCII));
    }

    @Override
    public byte[] pattern() {
        return Arrays.copyOf(pattern, pattern.length);
    }

    public int length() {
        return pattern.length;
    }

    /**
     * Bytes from the artifact start through the end of the pattern.
     */
    public int span() {
        return offset + pattern.length;
    }

    public int firstByte() {
        return pattern[0] & 0xFF;
    }

    /**
     * Checks the pattern against {@code window}, assuming the artifact starts at {@code start}.
     */
    public boolean matchesAt(byte[] window, int start) {
        int at = start + offset;
        if (at < 0 || at + pattern.length > window.length) {
            return false;
        }
        for (int i = 0; i < pattern.length; i++) {
            if (window[at + i] != pattern[i]) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Signature other)) return false;
        return offset == other.offset && Arrays.equals(pattern, other.pattern);
    }

    @Override
    public int hashCode() {
        return 31 * offset + Arrays.hashCode(pattern);
    }

    @Override
    public String toString() {
        return HexFormat.of().formatHex(pattern) + "@" + offset;
    }
}
