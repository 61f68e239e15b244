package com.libragraph.sift.util.buffer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;

/**
 * InputStream over a fixed range of BinaryData using positional reads only.
 */
class RegionInputStream extends InputStream {

    private final BinaryData data;
    private final long end;
    private long position;
    private long mark;

    RegionInputStream(BinaryData data, long position, long length) {
        this.data = data;
        this.position = position;
        this.end = position + length;
        this.mark = position;
    }

    @Override
    public int read() throws IOException {
        byte[] one = new byte[1];
        int n = read(one, 0, 1);
        return n < 0 ? -1 : one[0] & 0xFF;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        if (len == 0) {
            return 0;
        }
        if (position >= end) {
            return -1;
        }
        int toRead = (int) Math.min(len, end - position);
        int n = data.read(position, ByteBuffer.wrap(b, off, toRead));
        if (n > 0) {
            position += n;
        }
        return n;
    }

    @Override
    public long skip(long n) {
        long skipped = Math.max(0, Math.min(n, end - position));
        position += skipped;
        return skipped;
    }

    @Override
    public int available() {
        return (int) Math.min(Integer.MAX_VALUE, end - position);
    }

    @Override
    public boolean markSupported() {
        return true;
    }

    @Override
    public synchronized void mark(int readlimit) {
        mark = position;
    }

    @Override
    public synchronized void reset() {
        position = mark;
    }
}
