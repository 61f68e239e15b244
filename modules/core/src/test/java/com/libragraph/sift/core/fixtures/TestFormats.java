package com.libragraph.sift.core.fixtures;

import com.libragraph.sift.formats.api.Description;
import com.libragraph.sift.formats.api.ExtractedChild;
import com.libragraph.sift.formats.api.FormatParser;
import com.libragraph.sift.formats.api.ParseResult;
import com.libragraph.sift.formats.api.Signature;
import com.libragraph.sift.util.buffer.ByteRegion;
import com.libragraph.sift.util.buffer.RegionReader;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Small synthetic formats for engine tests.
 *
 * <pre>
 *   container: "CNT1" u32 totalLength u32 count { u32 length, bytes }*
 *   leaf:      "LEAF" u32 totalLength, padding
 *   raw:       no signature; "RAW!" prefix, takes the whole region
 * </pre>
 */
public final class TestFormats {

    private TestFormats() {
    }

    // -- byte builders --

    public static byte[] container(byte[]... entries) {
        int total = 12;
        for (byte[] entry : entries) {
            total += 4 + entry.length;
        }
        ByteBuffer buf = ByteBuffer.allocate(total).order(ByteOrder.LITTLE_ENDIAN);
        buf.put(ascii("CNT1")).putInt(total).putInt(entries.length);
        for (byte[] entry : entries) {
            buf.putInt(entry.length).put(entry);
        }
        return buf.array();
    }

    public static byte[] leaf(int totalLength) {
        ByteBuffer buf = ByteBuffer.allocate(totalLength).order(ByteOrder.LITTLE_ENDIAN);
        buf.put(ascii("LEAF")).putInt(totalLength);
        return buf.array();
    }

    /** A container whose header claims {@code declared} bytes. */
    public static byte[] containerDeclaring(int declared, int actualLength) {
        ByteBuffer buf = ByteBuffer.allocate(actualLength).order(ByteOrder.LITTLE_ENDIAN);
        buf.put(ascii("CNT1")).putInt(declared).putInt(0);
        return buf.array();
    }

    /** Bytes with no signature of these formats in them. */
    public static byte[] noise(int length, long seed) {
        byte[] bytes = new byte[length];
        new Random(seed).nextBytes(bytes);
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == 'C' || bytes[i] == 'L' || bytes[i] == 'R' || bytes[i] == 'D' || bytes[i] == 'B') {
                bytes[i] = 0x20;
            }
        }
        return bytes;
    }

    public static byte[] concat(byte[]... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            out.writeBytes(part);
        }
        return out.toByteArray();
    }

    public static byte[] ascii(String text) {
        return text.getBytes(StandardCharsets.US_ASCII);
    }

    // -- parsers --

    public record Entries(long total, List<long[]> entries) {}

    /**
     * The CNT1 container; entries become children in table order. Trusts the declared
     * total length, so a header claiming more than the region is a contract violation.
     */
    public static class ContainerParser implements FormatParser<Entries> {

        @Override
        public String id() {
            return "cnt";
        }

        @Override
        public List<Signature> signatures() {
            return List.of(Signature.ascii(0, "CNT1"));
        }

        @Override
        public ParseResult<Entries> parse(ByteRegion region) {
            RegionReader in = RegionReader.littleEndian(region);
            in.skip(4);
            long total = in.u32();
            long count = in.u32();
            if (total < 12) {
                return ParseResult.mismatch("total %d too small", total);
            }
            List<long[]> entries = new ArrayList<>();
            for (long i = 0; i < count; i++) {
                long length = in.u32();
                entries.add(new long[]{in.position(), length});
                in.skip(length);
            }
            return ParseResult.ok(new Entries(total, entries));
        }

        @Override
        public long consumedLength(Entries state) {
            return state.total();
        }

        @Override
        public List<ExtractedChild> extractChildren(Entries state, ByteRegion region) {
            List<ExtractedChild> children = new ArrayList<>();
            int i = 0;
            for (long[] entry : state.entries()) {
                if (entry[1] > 0) {
                    children.add(new ExtractedChild("entry-" + i, region.slice(entry[0], entry[1]),
                            Map.of("index", i)));
                }
                i++;
            }
            return children;
        }

        @Override
        public Description describe(Entries state) {
            return Description.of(Set.of("container"), Map.of("entries", state.entries().size()));
        }
    }

    /** "LEAF" records; no children. */
    public static class LeafParser implements FormatParser<Long> {

        @Override
        public String id() {
            return "leaf";
        }

        @Override
        public List<Signature> signatures() {
            return List.of(Signature.ascii(0, "LEAF"));
        }

        @Override
        public ParseResult<Long> parse(ByteRegion region) {
            RegionReader in = RegionReader.littleEndian(region);
            in.skip(4);
            long total = in.u32();
            if (total < 8 || total > region.length()) {
                return ParseResult.mismatch("bad length %d", total);
            }
            return ParseResult.ok(total);
        }

        @Override
        public long consumedLength(Long state) {
            return state;
        }

        @Override
        public Description describe(Long state) {
            return Description.ofLabels("leaf");
        }
    }

    /** Fallback: a region starting with "RAW!" is one raw artifact. */
    public static class RawParser implements FormatParser<Long> {

        @Override
        public String id() {
            return "raw";
        }

        @Override
        public List<Signature> signatures() {
            return List.of();
        }

        @Override
        public ParseResult<Long> parse(ByteRegion region) {
            RegionReader in = RegionReader.littleEndian(region);
            if (!in.expect(ascii("RAW!"))) {
                return ParseResult.mismatch("no RAW! prefix");
            }
            return ParseResult.ok(region.length());
        }

        @Override
        public long consumedLength(Long state) {
            return state;
        }

        @Override
        public Description describe(Long state) {
            return Description.ofLabels("raw");
        }
    }

    /** Shares the "DUAL" signature; strict never validates, loose always does. */
    public static class DualParser implements FormatParser<Long> {

        private final String id;
        private final boolean validates;
        private final AtomicInteger parses = new AtomicInteger();

        public DualParser(String id, boolean validates) {
            this.id = id;
            this.validates = validates;
        }

        public int parses() {
            return parses.get();
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public List<Signature> signatures() {
            return List.of(Signature.ascii(0, "DUAL"));
        }

        @Override
        public ParseResult<Long> parse(ByteRegion region) {
            parses.incrementAndGet();
            return validates ? ParseResult.ok(8L) : ParseResult.mismatch("strict check failed");
        }

        @Override
        public long consumedLength(Long state) {
            return state;
        }

        @Override
        public Description describe(Long state) {
            return Description.ofLabels(id);
        }
    }

    /** Throws on every parse of a "BOOM" signature. */
    public static class FaultyParser implements FormatParser<Long> {

        private final AtomicInteger parses = new AtomicInteger();

        public int parses() {
            return parses.get();
        }

        @Override
        public String id() {
            return "boom";
        }

        @Override
        public List<Signature> signatures() {
            return List.of(Signature.ascii(0, "BOOM"));
        }

        @Override
        public ParseResult<Long> parse(ByteRegion region) {
            parses.incrementAndGet();
            throw new IllegalStateException("boom at " + region.offset());
        }

        @Override
        public long consumedLength(Long state) {
            return state;
        }

        @Override
        public Description describe(Long state) {
            return Description.ofLabels("boom");
        }
    }
}
