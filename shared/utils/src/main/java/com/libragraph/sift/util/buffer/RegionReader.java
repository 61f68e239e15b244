package com.libragraph.sift.util.buffer;

import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Sequential, bounds-checked reader over a {@link ByteRegion}.
 *
 * <p>Every read checks the region limit first and raises {@link BufferBoundsException}
 * instead of reading past it, so a parser can follow declared sizes without guarding
 * each one by hand.
 */
public final class RegionReader {

    private final ByteRegion region;
    private final ByteOrder order;
    private long position;

    private RegionReader(ByteRegion region, ByteOrder order) {
        this.region = region;
        this.order = order;
    }

    public static RegionReader littleEndian(ByteRegion region) {
        return new RegionReader(region, ByteOrder.LITTLE_ENDIAN);
    }

    public static RegionReader bigEndian(ByteRegion region) {
        return new RegionReader(region, ByteOrder.BIG_ENDIAN);
    }

    public ByteRegion region() {
        return region;
    }

    public long position() {
        return position;
    }

    public long remaining() {
        return region.length() - position;
    }

    public RegionReader seek(long newPosition) {
        if (newPosition < 0 || newPosition > region.length()) {
            throw new BufferBoundsException(newPosition, 0, region.length());
        }
        position = newPosition;
        return this;
    }

    public RegionReader skip(long count) {
        return seek(position + count);
    }

    public int u8() {
        return (int) readUnsigned(1);
    }

    public int u16() {
        return (int) readUnsigned(2);
    }

    public long u32() {
        return readUnsigned(4);
    }

    public int s32() {
        return (int) readUnsigned(4);
    }

    /**
     * Reads 8 bytes; values above {@link Long#MAX_VALUE} come back negative.
     */
    public long u64() {
        return readUnsigned(8);
    }

    public byte[] bytes(int count) {
        byte[] out = region.readBytes(position, count);
        position += count;
        return out;
    }

    /**
     * True (and consumed) if the next bytes equal {@code expected}; position unchanged otherwise.
     */
    public boolean expect(byte[] expected) {
        if (remaining() < expected.length) {
            return false;
        }
        byte[] actual = region.readBytes(position, expected.length);
        for (int i = 0; i < expected.length; i++) {
            if (actual[i] != expected[i]) {
                return false;
            }
        }
        position += expected.length;
        return true;
    }

    /**
     * Reads a fixed-size, NUL-padded ASCII field.
     */
    public String asciiz(int fieldSize) {
        byte[] raw = bytes(fieldSize);
        int len = 0;
        while (len < raw.length && raw[len] != 0) {
            len++;
        }
        return new String(raw, 0, len, StandardCharsets.ISO_8859_1);
    }

    private long readUnsigned(int width) {
        byte[] raw = region.readBytes(position, width);
        position += width;
        long value = 0;
        if (order == ByteOrder.LITTLE_ENDIAN) {
            for (int i = width - 1; i >= 0; i--) {
                value = (value << 8) | (raw[i] & 0xFF);
            }
        } else {
            for (int i = 0; i < width; i++) {
                value = (value << 8) | (raw[i] & 0xFF);
            }
        }
        return value;
    }
}
