package com.libragraph.sift.formats.parsers;

import com.libragraph.sift.formats.api.Description;
import com.libragraph.sift.formats.api.ExtractedChild;
import com.libragraph.sift.formats.api.FormatParser;
import com.libragraph.sift.formats.api.ParseResult;
import com.libragraph.sift.formats.api.Signature;
import com.libragraph.sift.util.buffer.ByteRegion;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarFile;
import org.apache.commons.compress.archivers.tar.TarUtils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * POSIX/GNU TAR archives. Priority 200 so TAR wins over generic formats that might
 * share an offset. Members are children as sub-regions of the archive; nothing is copied.
 */
@ApplicationScoped
public class TarParser implements FormatParser<TarParser.Archive> {

    private static final int RECORD = 512;
    private static final int EOF_RECORDS = 2;

    record Member(String name, long dataOffset, long size, int mode, long mtime,
                  long uid, long gid, String userName) {}

    record Archive(List<Member> members, int entryCount, long consumed) {}

    @Override
    public String id() {
        return "tar";
    }

    @Override
    public List<Signature> signatures() {
        return List.of(Signature.ascii(257, "ustar"));
    }

    @Override
    public int priority() {
        return 200;
    }

    @Override
    public ParseResult<Archive> parse(ByteRegion region) {
        byte[] header = region.readBytes(0, RECORD);
        if (!TarUtils.verifyCheckSum(header)) {
            return ParseResult.mismatch("bad header checksum");
        }

        List<TarArchiveEntry> entries;
        try (TarFile tar = new TarFile(region.channel())) {
            entries = tar.getEntries();
        } catch (IOException | IllegalArgumentException e) {
            return ParseResult.mismatch("unreadable tar: %s", e.getMessage());
        }
        if (entries.isEmpty()) {
            return ParseResult.mismatch("no entries");
        }

        List<Member> members = new ArrayList<>();
        long end = 0;
        for (TarArchiveEntry entry : entries) {
            long dataEnd = entry.getDataOffset() + roundUp(entry.isFile() ? entry.getSize() : 0);
            end = Math.max(end, dataEnd);
            if (entry.isFile() && entry.getSize() > 0) {
                members.add(new Member(entry.getName(), entry.getDataOffset(), entry.getSize(),
                        entry.getMode(), entry.getLastModifiedTime().toMillis() / 1000,
                        entry.getLongUserId(), entry.getLongGroupId(), entry.getUserName()));
            }
        }
        if (end > region.length()) {
            return ParseResult.mismatch("entry data runs past the region");
        }
        return ParseResult.ok(new Archive(List.copyOf(members), entries.size(), end + trailingZeroRecords(region, end)));
    }

    @Override
    public long consumedLength(Archive state) {
        return state.consumed();
    }

    @Override
    public List<ExtractedChild> extractChildren(Archive state, ByteRegion region) {
        List<ExtractedChild> children = new ArrayList<>(state.members().size());
        for (Member member : state.members()) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("mode", member.mode());
            metadata.put("mtime", member.mtime());
            metadata.put("uid", member.uid());
            metadata.put("gid", member.gid());
            if (!member.userName().isEmpty()) {
                metadata.put("userName", member.userName());
            }
            children.add(new ExtractedChild(member.name(), region.slice(member.dataOffset(), member.size()), metadata));
        }
        return children;
    }

    @Override
    public Description describe(Archive state) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("entryCount", state.entryCount());
        metadata.put("fileCount", state.members().size());
        return Description.of(Set.of("tar", "archive"), metadata);
    }

    /** Bytes of end-of-archive zero records present at {@code from}, at most two records. */
    private static long trailingZeroRecords(ByteRegion region, long from) {
        long consumed = 0;
        for (int i = 0; i < EOF_RECORDS && from + consumed + RECORD <= region.length(); i++) {
            byte[] record = region.readBytes(from + consumed, RECORD);
            for (byte b : record) {
                if (b != 0) {
                    return consumed;
                }
            }
            consumed += RECORD;
        }
        return consumed;
    }

    private static long roundUp(long size) {
        return (size + RECORD - 1) / RECORD * RECORD;
    }
}
