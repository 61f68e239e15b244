package com.libragraph.sift.util.buffer;

import com.libragraph.sift.util.ContentHash;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Read-only view of an existing file, the usual root buffer of a scan session.
 * The file is never modified; its size is captured when it is opened.
 */
class FileData extends BinaryData {

    private final Path path;
    private final FileChannel channel;
    private final long size;
    private volatile ContentHash cachedHash;

    FileData(Path path) throws IOException {
        this.path = path;
        this.channel = FileChannel.open(path, StandardOpenOption.READ);
        this.size = channel.size();
    }

    @Override
    public ContentHash hash() {
        ContentHash hash = cachedHash;
        if (hash == null) {
            hash = hashRange(0, size);
            cachedHash = hash;
        }
        return hash;
    }

    @Override
    public long size() {
        return size;
    }

    @Override
    public int read(long position, ByteBuffer dst) throws IOException {
        if (position >= size) {
            return -1;
        }
        return channel.read(dst, position);
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }

    @Override
    public String toString() {
        return "FileData[" + path + "]";
    }
}
