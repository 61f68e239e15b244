package com.libragraph.sift.util;

import java.util.Objects;

/**
 * Identity of a byte sequence independent of where it lives: hash plus size.
 * Two regions with equal refs are treated as byte-identical within a session.
 * Renders as {@code {hash}-{size}}.
 */
public record ContentRef(ContentHash hash, long size) {

    public ContentRef {
        Objects.requireNonNull(hash, "hash cannot be null");
        if (size <= 0) {
            throw new IllegalArgumentException("size must be > 0, got: " + size);
        }
    }

    @Override
    public String toString() {
        return hash.toHex() + "-" + size;
    }
}
