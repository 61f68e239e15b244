package com.libragraph.sift.util.buffer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class RegionReaderTest {

    private static final byte[] BYTES = {
            0x01, 0x02, 0x03, 0x04, 'n', 'a', 'm', 'e', 0x00, 0x00, (byte) 0xFF, (byte) 0xFF
    };

    @Test
    void readsLittleEndian() {
        RegionReader reader = RegionReader.littleEndian(ByteRegion.of(new RamBuffer(BYTES)));

        assertThat(reader.u16()).isEqualTo(0x0201);
        assertThat(reader.u16()).isEqualTo(0x0403);
        assertThat(reader.position()).isEqualTo(4);
    }

    @Test
    void readsBigEndian() {
        RegionReader reader = RegionReader.bigEndian(ByteRegion.of(new RamBuffer(BYTES)));

        assertThat(reader.u32()).isEqualTo(0x01020304L);
    }

    @Test
    void readsUnsignedThirtyTwoBitValues() {
        RegionReader reader = RegionReader.littleEndian(ByteRegion.of(new RamBuffer(BYTES)));

        reader.seek(8);
        assertThat(reader.u32()).isEqualTo(0xFFFF0000L);
    }

    @Test
    void readsNulPaddedStrings() {
        RegionReader reader = RegionReader.littleEndian(ByteRegion.of(new RamBuffer(BYTES)));

        reader.skip(4);
        assertThat(reader.asciiz(6)).isEqualTo("name");
        assertThat(reader.remaining()).isEqualTo(2);
    }

    @Test
    void expectConsumesOnlyOnMatch() {
        RegionReader reader = RegionReader.littleEndian(ByteRegion.of(new RamBuffer(BYTES)));

        assertThat(reader.expect(new byte[]{0x01, 0x03})).isFalse();
        assertThat(reader.position()).isZero();
        assertThat(reader.expect(new byte[]{0x01, 0x02})).isTrue();
        assertThat(reader.position()).isEqualTo(2);
    }

    @Test
    void refusesToReadPastRegion() {
        ByteRegion region = new ByteRegion(new RamBuffer(BYTES), 0, 6);
        RegionReader reader = RegionReader.littleEndian(region);

        reader.skip(4);
        assertThatThrownBy(reader::u32).isInstanceOf(BufferBoundsException.class);
        assertThatThrownBy(() -> reader.seek(7)).isInstanceOf(BufferBoundsException.class);
    }
}
