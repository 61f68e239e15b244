package com.libragraph.sift.formats.parsers;

import com.libragraph.sift.formats.api.Description;
import com.libragraph.sift.formats.api.FormatParser;
import com.libragraph.sift.formats.api.ParseResult;
import com.libragraph.sift.formats.api.Signature;
import com.libragraph.sift.util.buffer.ByteRegion;
import com.libragraph.sift.util.buffer.RegionReader;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Windows bitmap images. Leaf format: no children.
 */
@ApplicationScoped
public class BmpParser implements FormatParser<BmpParser.BmpHeader> {

    private static final int FILE_HEADER_SIZE = 14;
    private static final Set<Integer> DIB_SIZES = Set.of(12, 40, 52, 56, 64, 108, 124);
    private static final Set<Integer> BIT_DEPTHS = Set.of(1, 2, 4, 8, 16, 24, 32);

    record BmpHeader(long fileLength, long pixelOffset, int dibSize,
                     long width, long height, int bitsPerPixel, long compression) {}

    @Override
    public String id() {
        return "bmp";
    }

    @Override
    public List<Signature> signatures() {
        return List.of(Signature.ascii(0, "BM"));
    }

    @Override
    public ParseResult<BmpHeader> parse(ByteRegion region) {
        RegionReader in = RegionReader.littleEndian(region);
        if (!in.expect(new byte[]{'B', 'M'})) {
            return ParseResult.mismatch("missing BM magic");
        }
        long fileLength = in.u32();
        in.skip(4); // reserved
        long pixelOffset = in.u32();

        int dibSize = (int) in.u32();
        if (!DIB_SIZES.contains(dibSize)) {
            return ParseResult.mismatch("unknown DIB header size %d", dibSize);
        }

        long width;
        long height;
        int planes;
        int bpp;
        long compression = 0;
        if (dibSize == 12) {
            width = in.u16();
            height = in.u16();
            planes = in.u16();
            bpp = in.u16();
        } else {
            width = in.s32();
            height = in.s32();
            planes = in.u16();
            bpp = in.u16();
            compression = in.u32();
        }

        if (planes != 1) {
            return ParseResult.mismatch("invalid plane count %d", planes);
        }
        if (!BIT_DEPTHS.contains(bpp)) {
            return ParseResult.mismatch("invalid bit depth %d", bpp);
        }
        if (width <= 0 || height == 0) {
            return ParseResult.mismatch("invalid dimensions %dx%d", width, height);
        }

        long headerEnd = FILE_HEADER_SIZE + dibSize;
        if (fileLength < headerEnd || fileLength > region.length()) {
            return ParseResult.mismatch("declared file length %d out of range", fileLength);
        }
        if (pixelOffset < headerEnd || pixelOffset >= fileLength) {
            return ParseResult.mismatch("pixel data offset %d out of range", pixelOffset);
        }

        return ParseResult.ok(new BmpHeader(fileLength, pixelOffset, dibSize,
                width, height, bpp, compression));
    }

    @Override
    public long consumedLength(BmpHeader state) {
        return state.fileLength();
    }

    @Override
    public Description describe(BmpHeader state) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("width", state.width());
        metadata.put("height", Math.abs(state.height()));
        metadata.put("bitsPerPixel", state.bitsPerPixel());
        metadata.put("compression", state.compression());
        if (state.height() < 0) {
            metadata.put("topDown", true);
        }
        return Description.of(Set.of("bmp", "graphics"), metadata);
    }
}
