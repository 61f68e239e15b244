package com.libragraph.sift.util.buffer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Derived data kept in a temp file once it outgrows RAM, see {@link Buffer#spillIfNeeded(long)}.
 * The file lives until {@link #close()}.
 */
public class FileBuffer extends Buffer {

    private final Path file;
    private final FileChannel channel;
    private volatile long written;
    private volatile boolean open = true;

    public FileBuffer() throws IOException {
        this.file = Files.createTempFile("sift-derived-", ".bin");
        this.channel = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE,
                StandardOpenOption.DELETE_ON_CLOSE);
    }

    @Override
    public long size() {
        if (!open) {
            throw new UncheckedIOException(new IOException("FileBuffer closed: " + file));
        }
        return written;
    }

    // FileChannel positional reads do not touch the channel position.
    @Override
    public int read(long position, ByteBuffer dst) throws IOException {
        return channel.read(dst, position);
    }

    @Override
    protected int doAppend(ByteBuffer src) throws IOException {
        int total = 0;
        while (src.hasRemaining()) {
            int n = channel.write(src, written);
            written += n;
            total += n;
        }
        return total;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() throws IOException {
        if (!open) {
            return;
        }
        open = false;
        try {
            channel.close();
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Override
    public String toString() {
        return "FileBuffer[" + file + ", " + written + " bytes]";
    }
}
