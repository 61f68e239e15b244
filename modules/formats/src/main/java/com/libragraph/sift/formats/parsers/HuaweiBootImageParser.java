package com.libragraph.sift.formats.parsers;

import com.libragraph.sift.formats.api.Description;
import com.libragraph.sift.formats.api.ExtractedChild;
import com.libragraph.sift.formats.api.FormatParser;
import com.libragraph.sift.formats.api.ParseResult;
import com.libragraph.sift.formats.api.Signature;
import com.libragraph.sift.util.buffer.ByteRegion;
import com.libragraph.sift.util.buffer.RegionReader;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Huawei Android boot images: a fixed header followed by a partition table whose
 * entries point into the rest of the image.
 *
 * <pre>
 *   0  magic            3C D6 1A CE
 *   4  metaHeaderSize   u32, always 76
 *   8  headerVersion    u32
 *  12  entryCount       u32
 *  16  productName      60 bytes, NUL padded
 *  76  entries          entryCount x { name[32], offset u32, size u32 }
 * </pre>
 */
@ApplicationScoped
public class HuaweiBootImageParser implements FormatParser<HuaweiBootImageParser.BootImage> {

    private static final byte[] MAGIC = {0x3C, (byte) 0xD6, 0x1A, (byte) 0xCE};
    private static final int META_HEADER_SIZE = 76;
    private static final int MAX_ENTRIES = 256;

    record Partition(String name, long offset, long size) {}

    record BootImage(long headerVersion, String productName, List<Partition> partitions, long unpackedSize) {}

    @Override
    public String id() {
        return "androidboothuawei";
    }

    @Override
    public List<Signature> signatures() {
        return List.of(Signature.of(0, MAGIC));
    }

    @Override
    public ParseResult<BootImage> parse(ByteRegion region) {
        RegionReader in = RegionReader.littleEndian(region);
        if (!in.expect(MAGIC)) {
            return ParseResult.mismatch("missing boot image magic");
        }
        long metaHeaderSize = in.u32();
        if (metaHeaderSize != META_HEADER_SIZE) {
            return ParseResult.mismatch("invalid header size %d", metaHeaderSize);
        }
        long headerVersion = in.u32();
        long entryCount = in.u32();
        if (entryCount == 0 || entryCount > MAX_ENTRIES) {
            return ParseResult.mismatch("implausible entry count %d", entryCount);
        }
        String productName = in.asciiz(60);

        List<Partition> partitions = new ArrayList<>((int) entryCount);
        long unpackedSize = in.position() + entryCount * 40;
        for (int i = 0; i < entryCount; i++) {
            String name = in.asciiz(32);
            long offset = in.u32();
            long size = in.u32();
            partitions.add(new Partition(name, offset, size));
            unpackedSize = Math.max(unpackedSize, offset + size);
        }

        if (unpackedSize > region.length()) {
            return ParseResult.mismatch("not enough data: need %d, have %d", unpackedSize, region.length());
        }
        return ParseResult.ok(new BootImage(headerVersion, productName, List.copyOf(partitions), unpackedSize));
    }

    @Override
    public long consumedLength(BootImage state) {
        return state.unpackedSize();
    }

    @Override
    public List<ExtractedChild> extractChildren(BootImage state, ByteRegion region) {
        List<ExtractedChild> children = new ArrayList<>();
        Map<String, Integer> repeats = new HashMap<>();
        for (Partition partition : state.partitions()) {
            if (partition.size() == 0 || partition.name().isEmpty()) {
                continue;
            }
            int seen = repeats.merge(partition.name(), 1, Integer::sum) - 1;
            String name = seen == 0 ? partition.name() : partition.name() + "." + seen;
            children.add(new ExtractedChild(name, region.slice(partition.offset(), partition.size())));
        }
        return children;
    }

    @Override
    public Description describe(BootImage state) {
        List<Map<String, Object>> partitions = new ArrayList<>();
        for (Partition partition : state.partitions()) {
            if (partition.size() == 0) {
                continue;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", partition.name());
            entry.put("offset", partition.offset());
            entry.put("size", partition.size());
            partitions.add(entry);
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("productName", state.productName());
        metadata.put("headerVersion", state.headerVersion());
        metadata.put("partitions", partitions);
        return Description.of(Set.of("android", "bootloader", "huawei"), metadata);
    }
}
