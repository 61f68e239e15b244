package com.libragraph.sift.util.buffer;

import com.libragraph.sift.util.ContentHash;
import org.apache.commons.codec.digest.Blake3;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.file.Path;

/**
 * Read-only binary data backed by RAM, a temp file or an existing file.
 *
 * Design principles:
 * - Hash and size are always available
 * - All reads are positional and safe to issue from several threads at once;
 *   there is no shared cursor
 * - Reads outside {@code [0, size)} raise {@link BufferBoundsException}
 */
public abstract class BinaryData implements Closeable {

    private static final int HASH_CHUNK = 64 * 1024;

    /**
     * Opens an existing file read-only.
     */
    public static BinaryData open(Path path) throws IOException {
        return new FileData(path);
    }

    /**
     * Content hash (BLAKE3-128) of this binary data.
     * May be computed lazily on first call.
     */
    public abstract ContentHash hash();

    /**
     * Total size in bytes.
     */
    public abstract long size();

    /**
     * Reads bytes starting at {@code position} into {@code dst} without any shared cursor.
     *
     * @return number of bytes read, or -1 if {@code position} is at or past the end
     */
    public abstract int read(long position, ByteBuffer dst) throws IOException;

    /**
     * Reads exactly {@code length} bytes at {@code position}.
     *
     * @throws BufferBoundsException if the range is not inside this data
     */
    public void readFully(long position, byte[] dst, int off, int length) {
        checkRange(position, length);
        ByteBuffer target = ByteBuffer.wrap(dst, off, length);
        long pos = position;
        try {
            while (target.hasRemaining()) {
                int n = read(pos, target);
                if (n < 0) {
                    throw new BufferBoundsException(position, length, size());
                }
                pos += n;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + length + " bytes at " + position, e);
        }
    }

    /**
     * Opens an InputStream over {@code [position, position + length)}.
     * Multiple streams can be open concurrently.
     */
    public InputStream inputStream(long position, long length) {
        checkRange(position, length);
        return new RegionInputStream(this, position, length);
    }

    /**
     * Hashes {@code [position, position + length)} without materializing it.
     */
    public ContentHash hashRange(long position, long length) {
        checkRange(position, length);
        Blake3 hasher = Blake3.initHash();
        byte[] chunk = new byte[(int) Math.min(HASH_CHUNK, Math.max(length, 1))];
        long pos = position;
        long end = position + length;
        while (pos < end) {
            int n = (int) Math.min(chunk.length, end - pos);
            readFully(pos, chunk, 0, n);
            hasher.update(chunk, 0, n);
            pos += n;
        }
        return ContentHash.finish(hasher);
    }

    @Override
    public void close() throws IOException {
        // nothing to release by default
    }

    void checkRange(long position, long length) {
        if (position < 0 || length < 0 || position > size() - length) {
            throw new BufferBoundsException(position, length, size());
        }
    }
}
