package com.libragraph.sift.util.buffer;

import com.libragraph.sift.util.ContentHash;
import org.apache.commons.codec.digest.Blake3;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.WritableByteChannel;

/**
 * Append-only buffer for data a parser derives while scanning (decompressed members and the like).
 *
 * Every write is a tailing write, so the hash is maintained incrementally and is
 * available without a second pass once writing is done. Buffers are filled by a
 * single thread and only read after they are handed to the scheduler.
 *
 * Factory method allocates the backend (RAM or temp file) based on size.
 */
public abstract class Buffer extends BinaryData implements WritableByteChannel {

    private Blake3 incrementalHash = Blake3.initHash();
    private long hashedUpTo = 0;
    private ContentHash cachedHash = null;

    /** Threshold above which allocate() uses a temp file instead of RAM. */
    private static final long FILE_THRESHOLD = 4L * 1024 * 1024; // 4 MB

    /**
     * Allocates a buffer expected to hold about {@code size} bytes.
     * <ul>
     *   <li>below 4 MB: {@link RamBuffer} (heap byte array)</li>
     *   <li>4 MB and above: {@link FileBuffer} (temp-file backed)</li>
     * </ul>
     */
    public static Buffer allocate(long size) {
        if (size < FILE_THRESHOLD) {
            return new RamBuffer((int) size);
        }
        try {
            return new FileBuffer();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to allocate file-backed buffer", e);
        }
    }

    /**
     * Returns this buffer if it can hold {@code expectedSize} bytes where it lives, otherwise a
     * temp-file buffer holding a copy of the data written so far. In the second case this
     * buffer is closed and must no longer be used.
     */
    public Buffer spillIfNeeded(long expectedSize) throws IOException {
        if (expectedSize < FILE_THRESHOLD || this instanceof FileBuffer) {
            return this;
        }
        FileBuffer file = new FileBuffer();
        try {
            ByteBuffer chunk = ByteBuffer.allocate(64 * 1024);
            long position = 0;
            int n;
            while ((n = read(position, chunk.clear())) > 0) {
                file.write(chunk.flip());
                position += n;
            }
        } catch (IOException | RuntimeException e) {
            file.close();
            throw e;
        }
        close();
        return file;
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        cachedHash = null;
        if (hashedUpTo == size()) {
            ByteBuffer copy = src.duplicate();
            byte[] bytes = new byte[copy.remaining()];
            copy.get(bytes);
            incrementalHash.update(bytes);
            hashedUpTo += bytes.length;
        }
        return doAppend(src);
    }

    @Override
    public ContentHash hash() {
        if (cachedHash != null) {
            return cachedHash;
        }

        if (hashedUpTo == size() && hashedUpTo > 0) {
            cachedHash = ContentHash.finish(incrementalHash);
            return cachedHash;
        }

        // Wrapped or empty - compute full hash
        cachedHash = hashRange(0, size());
        return cachedHash;
    }

    /**
     * Subclasses append the bytes to the end of the data.
     */
    protected abstract int doAppend(ByteBuffer src) throws IOException;
}
