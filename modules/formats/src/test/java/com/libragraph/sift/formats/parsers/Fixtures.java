package com.libragraph.sift.formats.parsers;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.GZIPOutputStream;

/**
 * Builds small, valid sample files for parser tests.
 */
public final class Fixtures {

    private Fixtures() {
    }

    /** 24-bit BITMAPINFOHEADER image with zeroed pixels. */
    public static byte[] bmp(int width, int height) {
        int rowSize = (width * 3 + 3) & ~3;
        int pixelOffset = 14 + 40;
        int fileLength = pixelOffset + rowSize * height;
        ByteBuffer buf = ByteBuffer.allocate(fileLength).order(ByteOrder.LITTLE_ENDIAN);
        buf.put((byte) 'B').put((byte) 'M');
        buf.putInt(fileLength);
        buf.putInt(0);
        buf.putInt(pixelOffset);
        buf.putInt(40);
        buf.putInt(width);
        buf.putInt(height);
        buf.putShort((short) 1);
        buf.putShort((short) 24);
        buf.putInt(0);
        buf.putInt(rowSize * height);
        buf.putInt(2835);
        buf.putInt(2835);
        buf.putInt(0);
        buf.putInt(0);
        return buf.array();
    }

    /** Huawei boot image; partitions are laid out after the table, in map order. */
    public static byte[] huaweiBoot(String product, Map<String, byte[]> partitions) {
        int tableEnd = 76 + partitions.size() * 40;
        int total = tableEnd;
        for (byte[] data : partitions.values()) {
            total += data.length;
        }
        ByteBuffer buf = ByteBuffer.allocate(total).order(ByteOrder.LITTLE_ENDIAN);
        buf.put(new byte[]{0x3C, (byte) 0xD6, 0x1A, (byte) 0xCE});
        buf.putInt(76);
        buf.putInt(1);
        buf.putInt(partitions.size());
        buf.put(padded(product, 60));

        int offset = tableEnd;
        for (Map.Entry<String, byte[]> entry : partitions.entrySet()) {
            buf.put(padded(entry.getKey(), 32));
            buf.putInt(offset);
            buf.putInt(entry.getValue().length);
            offset += entry.getValue().length;
        }
        for (byte[] data : partitions.values()) {
            buf.put(data);
        }
        return buf.array();
    }

    public record TableEntry(String name, int offset, int size) {}

    /**
     * Huawei boot image with a hand-written partition table. Entry offsets are relative
     * to {@code data}, which follows the table.
     */
    public static byte[] huaweiBootTable(String product, byte[] data, TableEntry... entries) {
        int tableEnd = 76 + entries.length * 40;
        ByteBuffer buf = ByteBuffer.allocate(tableEnd + data.length).order(ByteOrder.LITTLE_ENDIAN);
        buf.put(new byte[]{0x3C, (byte) 0xD6, 0x1A, (byte) 0xCE});
        buf.putInt(76).putInt(1).putInt(entries.length);
        buf.put(padded(product, 60));
        for (TableEntry entry : entries) {
            buf.put(padded(entry.name(), 32));
            buf.putInt(tableEnd + entry.offset()).putInt(entry.size());
        }
        buf.put(data);
        return buf.array();
    }

    public static byte[] gzip(byte[] content, String originalName) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gz = new GZIPOutputStream(out)) {
            gz.write(content);
        }
        byte[] plain = out.toByteArray();
        if (originalName == null) {
            return plain;
        }
        // Rebuild the header with FNAME set; GZIPOutputStream never writes one.
        byte[] name = (originalName + "\0").getBytes(StandardCharsets.ISO_8859_1);
        byte[] named = new byte[plain.length + name.length];
        System.arraycopy(plain, 0, named, 0, 10);
        named[3] = 0x08;
        System.arraycopy(name, 0, named, 10, name.length);
        System.arraycopy(plain, 10, named, 10 + name.length, plain.length - 10);
        return named;
    }

    /** Tar archive of regular files, in map order. */
    public static byte[] tar(Map<String, byte[]> files) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (TarArchiveOutputStream tar = new TarArchiveOutputStream(out)) {
            tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
            for (Map.Entry<String, byte[]> file : files.entrySet()) {
                TarArchiveEntry entry = new TarArchiveEntry(file.getKey());
                entry.setSize(file.getValue().length);
                entry.setMode(0644);
                entry.setModTime(1_700_000_000_000L);
                tar.putArchiveEntry(entry);
                tar.write(file.getValue());
                tar.closeArchiveEntry();
            }
            tar.finish();
        }
        return out.toByteArray();
    }

    public static Map<String, byte[]> files(Object... nameThenBytes) {
        Map<String, byte[]> files = new LinkedHashMap<>();
        for (int i = 0; i < nameThenBytes.length; i += 2) {
            files.put((String) nameThenBytes[i], (byte[]) nameThenBytes[i + 1]);
        }
        return files;
    }

    public static byte[] concat(byte[]... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            out.writeBytes(part);
        }
        return out.toByteArray();
    }

    public static byte[] filler(int length, int value) {
        byte[] bytes = new byte[length];
        java.util.Arrays.fill(bytes, (byte) value);
        return bytes;
    }

    private static byte[] padded(String text, int size) {
        byte[] out = new byte[size];
        byte[] raw = text.getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(raw, 0, out, 0, Math.min(raw.length, size));
        return out;
    }
}
