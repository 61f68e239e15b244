package com.libragraph.sift.formats.parsers;

import com.libragraph.sift.formats.api.Description;
import com.libragraph.sift.formats.api.ExtractedChild;
import com.libragraph.sift.formats.api.FormatParser;
import com.libragraph.sift.formats.api.ParseResult;
import com.libragraph.sift.formats.api.Signature;
import com.libragraph.sift.util.buffer.Buffer;
import com.libragraph.sift.util.buffer.ByteRegion;
import com.libragraph.sift.util.buffer.RegionReader;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.zip.CRC32;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * Single gzip members (RFC 1952). The member is inflated during parse so the CRC and
 * length trailer can be checked and the exact compressed length is known; the inflated
 * bytes become the only child, in a derived {@link Buffer}.
 */
@ApplicationScoped
public class GzipParser implements FormatParser<GzipParser.Member> {

    private static final Logger log = Logger.getLogger(GzipParser.class);

    private static final int FHCRC = 0x02;
    private static final int FEXTRA = 0x04;
    private static final int FNAME = 0x08;
    private static final int FCOMMENT = 0x10;
    private static final int RESERVED = 0xE0;

    private static final int CHUNK = 64 * 1024;
    private static final int MAX_HEADER_STRING = 64 * 1024;
    private static final long MAX_INFLATED = Integer.MAX_VALUE - CHUNK;
    private static final long INITIAL_CAPACITY = 1024 * 1024;
    private static final String DEFAULT_CHILD_NAME = "unpacked.gunzip";

    record Member(long consumed, String originalName, String comment, long mtime,
                  int os, Buffer content) {}

    @Override
    public String id() {
        return "gzip";
    }

    @Override
    public List<Signature> signatures() {
        return List.of(Signature.of(0, (byte) 0x1F, (byte) 0x8B, (byte) 0x08));
    }

    @Override
    public ParseResult<Member> parse(ByteRegion region) {
        RegionReader in = RegionReader.littleEndian(region);
        if (!in.expect(new byte[]{0x1F, (byte) 0x8B, 0x08})) {
            return ParseResult.mismatch("missing gzip magic");
        }
        int flags = in.u8();
        if ((flags & RESERVED) != 0) {
            return ParseResult.mismatch("reserved flag bits set: 0x%02x", flags);
        }
        long mtime = in.u32();
        in.skip(1); // extra flags
        int os = in.u8();

        if ((flags & FEXTRA) != 0) {
            in.skip(in.u16());
        }
        String name = null;
        if ((flags & FNAME) != 0) {
            name = zeroTerminated(in);
            if (name == null) {
                return ParseResult.mismatch("unterminated file name");
            }
        }
        String comment = null;
        if ((flags & FCOMMENT) != 0) {
            comment = zeroTerminated(in);
            if (comment == null) {
                return ParseResult.mismatch("unterminated comment");
            }
        }
        if ((flags & FHCRC) != 0) {
            in.skip(2);
        }
        return inflate(region, in.position(), name, comment, mtime, os);
    }

    private ParseResult<Member> inflate(ByteRegion region, long headerLength, String name,
                                        String comment, long mtime, int os) {
        Buffer output = Buffer.allocate(Math.min(region.length() * 3, INITIAL_CAPACITY));
        Inflater inflater = new Inflater(true);
        CRC32 crc = new CRC32();
        boolean keep = false;
        try {
            long fed = headerLength;
            byte[] out = new byte[CHUNK];
            while (!inflater.finished()) {
                if (inflater.needsInput()) {
                    if (fed >= region.length()) {
                        return ParseResult.mismatch("truncated deflate stream");
                    }
                    byte[] chunk = region.readAvailable(fed, CHUNK);
                    inflater.setInput(chunk);
                    fed += chunk.length;
                }
                if (inflater.needsDictionary()) {
                    return ParseResult.mismatch("deflate stream needs a preset dictionary");
                }
                int n = inflater.inflate(out);
                if (output.size() + n > MAX_INFLATED) {
                    return ParseResult.mismatch("inflated size exceeds %d bytes", MAX_INFLATED);
                }
                if (n > 0) {
                    crc.update(out, 0, n);
                    output = output.spillIfNeeded(output.size() + n);
                    output.write(ByteBuffer.wrap(out, 0, n));
                }
            }

            long trailerStart = fed - inflater.getRemaining();
            if (trailerStart + 8 > region.length()) {
                return ParseResult.mismatch("missing gzip trailer");
            }
            RegionReader trailer = RegionReader.littleEndian(region).seek(trailerStart);
            long expectedCrc = trailer.u32();
            long expectedSize = trailer.u32();
            if (expectedCrc != crc.getValue()) {
                return ParseResult.mismatch("CRC mismatch: stored %08x, computed %08x", expectedCrc, crc.getValue());
            }
            if (expectedSize != (output.size() & 0xFFFFFFFFL)) {
                return ParseResult.mismatch("size mismatch: stored %d, inflated %d", expectedSize, output.size());
            }

            keep = true;
            log.debugf("Inflated gzip member: %d -> %d bytes", trailerStart - headerLength, output.size());
            return ParseResult.ok(new Member(trailerStart + 8, name, comment, mtime, os, output));
        } catch (DataFormatException e) {
            return ParseResult.mismatch("invalid deflate data: %s", e.getMessage());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write inflated gzip data", e);
        } finally {
            inflater.end();
            if (!keep) {
                closeQuietly(output);
            }
        }
    }

    @Override
    public long consumedLength(Member state) {
        return state.consumed();
    }

    @Override
    public List<ExtractedChild> extractChildren(Member state, ByteRegion region) {
        if (state.content().size() == 0) {
            return List.of();
        }
        String hint = state.originalName() == null || state.originalName().isEmpty()
                ? DEFAULT_CHILD_NAME
                : state.originalName();
        return List.of(new ExtractedChild(hint, ByteRegion.of(state.content())));
    }

    @Override
    public Description describe(Member state) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        Optional.ofNullable(state.originalName()).ifPresent(n -> metadata.put("originalName", n));
        Optional.ofNullable(state.comment()).ifPresent(c -> metadata.put("comment", c));
        if (state.mtime() != 0) {
            metadata.put("mtime", state.mtime());
        }
        metadata.put("os", state.os());
        metadata.put("uncompressedSize", state.content().size());
        return Description.of(Set.of("gzip", "compressed"), metadata);
    }

    /** Reads a NUL-terminated ISO-8859-1 header field; null if no terminator within the limit. */
    private static String zeroTerminated(RegionReader in) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        while (bytes.size() < MAX_HEADER_STRING) {
            int b = in.u8();
            if (b == 0) {
                return bytes.toString(StandardCharsets.ISO_8859_1);
            }
            bytes.write(b);
        }
        return null;
    }

    private static void closeQuietly(Buffer buffer) {
        try {
            buffer.close();
        } catch (IOException e) {
            log.warnf(e, "Failed to release gzip scratch buffer");
        }
    }
}
