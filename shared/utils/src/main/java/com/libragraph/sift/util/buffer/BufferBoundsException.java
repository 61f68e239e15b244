package com.libragraph.sift.util.buffer;

/**
 * Thrown when a read would leave the backing data or the region it goes through.
 * Parsers never catch it; the dispatch engine treats it as a structural mismatch.
 */
public class BufferBoundsException extends RuntimeException {

    private final long offset;
    private final long length;
    private final long limit;

    public BufferBoundsException(long offset, long length, long limit) {
        super("Read of " + length + " bytes at " + offset + " exceeds limit " + limit);
        this.offset = offset;
        this.length = length;
        this.limit = limit;
    }

    public long offset() {
        return offset;
    }

    public long length() {
        return length;
    }

    public long limit() {
        return limit;
    }
}
