package com.libragraph.sift;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPOutputStream;

/**
 * Sample payloads for end-to-end tests.
 */
final class Samples {

    private Samples() {
    }

    static byte[] bmp(int width, int height) {
        int rowSize = (width * 3 + 3) & ~3;
        int fileLength = 54 + rowSize * height;
        ByteBuffer buf = ByteBuffer.allocate(fileLength).order(ByteOrder.LITTLE_ENDIAN);
        buf.put((byte) 'B').put((byte) 'M').putInt(fileLength).putInt(0).putInt(54);
        buf.putInt(40).putInt(width).putInt(height);
        buf.putShort((short) 1).putShort((short) 24);
        buf.putInt(0).putInt(rowSize * height).putInt(2835).putInt(2835).putInt(0).putInt(0);
        return buf.array();
    }

    static byte[] gzip(byte[] content, String originalName) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gz = new GZIPOutputStream(out)) {
            gz.write(content);
        }
        byte[] plain = out.toByteArray();
        byte[] name = (originalName + "\0").getBytes(StandardCharsets.ISO_8859_1);
        byte[] named = new byte[plain.length + name.length];
        System.arraycopy(plain, 0, named, 0, 10);
        named[3] = 0x08;
        System.arraycopy(name, 0, named, 10, name.length);
        System.arraycopy(plain, 10, named, 10 + name.length, plain.length - 10);
        return named;
    }
}
