package com.libragraph.sift.util.buffer;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.NonWritableChannelException;
import java.nio.channels.SeekableByteChannel;

/**
 * Read-only SeekableByteChannel over a ByteRegion, for libraries that want a channel
 * (random-access archive readers). Closing it does not close the underlying data.
 */
class RegionChannel implements SeekableByteChannel {

    private final ByteRegion region;
    private long position;
    private boolean open = true;

    RegionChannel(ByteRegion region) {
        this.region = region;
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
        ensureOpen();
        if (position >= region.length()) {
            return -1;
        }
        int want = (int) Math.min(dst.remaining(), region.length() - position);
        ByteBuffer window = dst.duplicate();
        window.limit(window.position() + want);
        int n = region.data().read(region.offset() + position, window);
        if (n > 0) {
            dst.position(dst.position() + n);
            position += n;
        }
        return n;
    }

    @Override
    public int write(ByteBuffer src) {
        throw new NonWritableChannelException();
    }

    @Override
    public long position() throws IOException {
        ensureOpen();
        return position;
    }

    @Override
    public SeekableByteChannel position(long newPosition) throws IOException {
        ensureOpen();
        if (newPosition < 0) {
            throw new IllegalArgumentException("Negative position: " + newPosition);
        }
        position = newPosition;
        return this;
    }

    @Override
    public long size() throws IOException {
        ensureOpen();
        return region.length();
    }

    @Override
    public SeekableByteChannel truncate(long size) {
        throw new NonWritableChannelException();
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
    }

    private void ensureOpen() throws ClosedChannelException {
        if (!open) {
            throw new ClosedChannelException();
        }
    }
}
