package com.libragraph.sift.util.buffer;

import com.libragraph.sift.util.ContentHash;
import com.libragraph.sift.util.ContentRef;

import java.io.InputStream;
import java.nio.channels.SeekableByteChannel;
import java.util.Objects;

/**
 * Immutable view {@code [offset, offset + length)} over a {@link BinaryData}.
 *
 * <p>The universal unit of the scanner: parsers receive regions, children are regions,
 * claims are made over regions. Regions are values; many may reference the same data
 * and none of them owns it. Two regions are equal when they cover the same span of the
 * same data instance.
 *
 * <p>All relative accessors are bounds-checked against the region, not the data,
 * and raise {@link BufferBoundsException}.
 */
public record ByteRegion(BinaryData data, long offset, long length) {

    public ByteRegion {
        Objects.requireNonNull(data, "data cannot be null");
        if (offset < 0 || length < 0 || offset > data.size() - length) {
            throw new BufferBoundsException(offset, length, data.size());
        }
    }

    /**
     * Region covering all of {@code data}.
     */
    public static ByteRegion of(BinaryData data) {
        return new ByteRegion(data, 0, data.size());
    }

    /**
     * Absolute end offset (exclusive) within the data.
     */
    public long end() {
        return offset + length;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    /**
     * Sub-region starting {@code relativeOffset} bytes into this region.
     */
    public ByteRegion slice(long relativeOffset, long sliceLength) {
        checkRelative(relativeOffset, sliceLength);
        return new ByteRegion(data, offset + relativeOffset, sliceLength);
    }

    /**
     * Everything from {@code relativeOffset} to the end of this region.
     */
    public ByteRegion tail(long relativeOffset) {
        checkRelative(relativeOffset, 0);
        return new ByteRegion(data, offset + relativeOffset, length - relativeOffset);
    }

    /**
     * True when {@code other} lies over the same data and inside this region.
     */
    public boolean contains(ByteRegion other) {
        return other.data == data && other.offset >= offset && other.end() <= end();
    }

    /**
     * Offset of this region relative to {@code parent}; both must share the same data.
     */
    public long relativeTo(ByteRegion parent) {
        if (parent.data != data) {
            throw new IllegalArgumentException("Regions are over different data");
        }
        return offset - parent.offset;
    }

    /**
     * Unsigned byte at {@code relativeOffset}.
     */
    public int byteAt(long relativeOffset) {
        byte[] one = new byte[1];
        checkRelative(relativeOffset, 1);
        data.readFully(offset + relativeOffset, one, 0, 1);
        return one[0] & 0xFF;
    }

    /**
     * Copies {@code count} bytes starting at {@code relativeOffset}.
     */
    public byte[] readBytes(long relativeOffset, int count) {
        checkRelative(relativeOffset, count);
        byte[] out = new byte[count];
        data.readFully(offset + relativeOffset, out, 0, count);
        return out;
    }

    /**
     * Copies up to {@code count} bytes starting at {@code relativeOffset}; shorter near the end.
     */
    public byte[] readAvailable(long relativeOffset, int count) {
        checkRelative(relativeOffset, 0);
        int n = (int) Math.min(count, length - relativeOffset);
        return readBytes(relativeOffset, n);
    }

    public InputStream inputStream() {
        return data.inputStream(offset, length);
    }

    /**
     * Read-only channel whose position 0 is this region's first byte.
     */
    public SeekableByteChannel channel() {
        return new RegionChannel(this);
    }

    public ContentHash hash() {
        if (offset == 0 && length == data.size()) {
            return data.hash();
        }
        return data.hashRange(offset, length);
    }

    /**
     * Content identity of a non-empty region.
     */
    public ContentRef contentRef() {
        return new ContentRef(hash(), length);
    }

    /**
     * Same data instance, same span.
     */
    public boolean sameSpan(ByteRegion other) {
        return other.data == data && other.offset == offset && other.length == length;
    }

    @Override
    public String toString() {
        return "ByteRegion[" + offset + "+" + length + "]";
    }

    private void checkRelative(long relativeOffset, long count) {
        if (relativeOffset < 0 || count < 0 || relativeOffset > length - count) {
            throw new BufferBoundsException(relativeOffset, count, length);
        }
    }
}
