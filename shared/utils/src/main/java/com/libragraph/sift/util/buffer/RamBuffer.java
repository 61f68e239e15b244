package com.libragraph.sift.util.buffer;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Buffer implementation using in-memory byte array.
 * Suitable for small data (< 4MB) and for test fixtures.
 */
public class RamBuffer extends Buffer {
    private byte[] data;
    private int size;  // Logical size (may be less than data.length)
    private boolean open = true;

    /**
     * Creates empty buffer with initial capacity.
     */
    public RamBuffer(int initialCapacity) {
        this.data = new byte[Math.max(initialCapacity, 16)];
        this.size = 0;
    }

    /**
     * Creates buffer over existing data without copying it.
     * The caller must not modify the array afterwards.
     */
    public RamBuffer(byte[] data) {
        this.data = data;
        this.size = data.length;
    }

    @Override
    public long size() {
        return size;
    }

    @Override
    public int read(long position, ByteBuffer dst) {
        if (position >= size) {
            return -1;  // EOF
        }
        int toRead = (int) Math.min(size - position, dst.remaining());
        dst.put(data, (int) position, toRead);
        return toRead;
    }

    @Override
    protected int doAppend(ByteBuffer src) {
        int toWrite = src.remaining();
        long endPosition = (long) size + toWrite;

        if (endPosition > data.length) {
            grow(endPosition);
        }

        src.get(data, size, toWrite);
        size += toWrite;
        return toWrite;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
    }

    /**
     * Grows the internal array to accommodate the requested size.
     * Doubles capacity each time to amortize growth cost.
     */
    private void grow(long minCapacity) {
        if (minCapacity > Integer.MAX_VALUE - 8) {
            throw new IllegalStateException("RamBuffer cannot hold " + minCapacity + " bytes");
        }
        long newCapacity = Math.min(Math.max(data.length * 2L, minCapacity), Integer.MAX_VALUE - 8);
        data = Arrays.copyOf(data, (int) newCapacity);
    }
}
