package com.libragraph.sift.util.buffer;

import com.libragraph.sift.util.ContentHash;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static org.assertj.core.api.Assertions.*;

class FileBufferTest {

    @Test
    void shouldAppendAndRead() throws Exception {
        try (FileBuffer buf = new FileBuffer()) {
            buf.write(ByteBuffer.wrap("Hello".getBytes()));
            assertThat(buf.size()).isEqualTo(5);

            ByteBuffer dst = ByteBuffer.allocate(5);
            buf.read(0, dst);
            assertThat(new String(dst.array())).isEqualTo("Hello");
        }
    }

    @Test
    void shouldProduceSameHashAsRamBuffer() throws Exception {
        byte[] data = "Identical content for both backends".getBytes();

        ContentHash ramHash;
        try (RamBuffer ram = new RamBuffer(data.length)) {
            ram.write(ByteBuffer.wrap(data));
            ramHash = ram.hash();
        }

        ContentHash fileHash;
        try (FileBuffer file = new FileBuffer()) {
            file.write(ByteBuffer.wrap(data));
            fileHash = file.hash();
        }

        assertThat(fileHash).isEqualTo(ramHash);
    }

    @Test
    void shouldHandleLargeWrite() throws Exception {
        byte[] chunk = "A".repeat(1024).getBytes();
        int chunks = 5 * 1024; // 5 MB total

        try (FileBuffer buf = new FileBuffer()) {
            for (int i = 0; i < chunks; i++) {
                buf.write(ByteBuffer.wrap(chunk));
            }

            assertThat(buf.size()).isEqualTo((long) chunk.length * chunks);
            assertThat(buf.hash()).isEqualTo(buf.hashRange(0, buf.size()));

            byte[] tail = new byte[chunk.length];
            buf.readFully(buf.size() - chunk.length, tail, 0, tail.length);
            assertThat(tail).isEqualTo(chunk);
        }
    }

    @Test
    void smallBufferStaysInRam() throws Exception {
        Buffer ram = Buffer.allocate(16);
        ram.write(ByteBuffer.wrap("small".getBytes()));

        assertThat(ram.spillIfNeeded(1024)).isSameAs(ram);
    }

    @Test
    void spillMovesContentToTempFile() throws Exception {
        byte[] data = "spilled content".getBytes();
        Buffer ram = Buffer.allocate(data.length);
        ram.write(ByteBuffer.wrap(data));
        ContentHash before = ram.hash();

        try (Buffer spilled = ram.spillIfNeeded(8L * 1024 * 1024)) {
            assertThat(spilled).isInstanceOf(FileBuffer.class);
            assertThat(ram.isOpen()).isFalse();
            assertThat(spilled.size()).isEqualTo(data.length);
            assertThat(spilled.hash()).isEqualTo(before);

            spilled.write(ByteBuffer.wrap("!".getBytes()));
            byte[] all = new byte[data.length + 1];
            spilled.readFully(0, all, 0, all.length);
            assertThat(new String(all)).isEqualTo("spilled content!");
            assertThat(spilled.spillIfNeeded(16L * 1024 * 1024)).isSameAs(spilled);
        }
    }

    @Test
    void allocateShouldPickFileBufferForLargeSize() {
        assertThat(Buffer.allocate(1024)).isInstanceOf(RamBuffer.class);
        assertThat(Buffer.allocate(4 * 1024 * 1024)).isInstanceOf(FileBuffer.class);
    }
}
