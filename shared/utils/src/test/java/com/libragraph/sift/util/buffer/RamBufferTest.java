package com.libragraph.sift.util.buffer;

import com.libragraph.sift.util.ContentHash;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static org.assertj.core.api.Assertions.*;

class RamBufferTest {

    @Test
    void shouldAppendAndReadPositionally() throws Exception {
        Buffer buf = Buffer.allocate(64);
        buf.write(ByteBuffer.wrap("Hello".getBytes()));
        buf.write(ByteBuffer.wrap(", World".getBytes()));

        assertThat(buf.size()).isEqualTo(12);

        ByteBuffer dst = ByteBuffer.allocate(5);
        buf.read(7, dst);
        assertThat(new String(dst.array())).isEqualTo("World");
    }

    @Test
    void shouldMatchIncrementalAndFullHash() throws Exception {
        byte[] data = "Hello, World!".getBytes();
        Buffer appended = Buffer.allocate(4);
        appended.write(ByteBuffer.wrap(data, 0, 5));
        appended.write(ByteBuffer.wrap(data, 5, data.length - 5));

        ContentHash incremental = appended.hash();
        ContentHash full = new RamBuffer(data).hash();

        assertThat(incremental).isEqualTo(full);
        assertThat(appended.hash()).isSameAs(incremental);
    }

    @Test
    void shouldRecomputeHashAfterFurtherWrites() throws Exception {
        Buffer buf = Buffer.allocate(8);
        buf.write(ByteBuffer.wrap("AB".getBytes()));
        ContentHash first = buf.hash();

        buf.write(ByteBuffer.wrap("CD".getBytes()));

        assertThat(buf.hash()).isNotEqualTo(first);
        assertThat(buf.hash()).isEqualTo(new RamBuffer("ABCD".getBytes()).hash());
    }

    @Test
    void shouldReturnEofPastEnd() {
        RamBuffer buf = new RamBuffer("AB".getBytes());

        assertThat(buf.read(2, ByteBuffer.allocate(2))).isEqualTo(-1);
    }

    @Test
    void readFullyRejectsRangesPastEnd() {
        RamBuffer buf = new RamBuffer(new byte[10]);

        assertThatThrownBy(() -> buf.readFully(8, new byte[4], 0, 4))
                .isInstanceOf(BufferBoundsException.class)
                .hasMessageContaining("limit 10");
    }

    @Test
    void shouldStreamRange() throws Exception {
        RamBuffer buf = new RamBuffer("0123456789".getBytes());

        try (var in = buf.inputStream(3, 4)) {
            assertThat(new String(in.readAllBytes())).isEqualTo("3456");
        }
    }
}
