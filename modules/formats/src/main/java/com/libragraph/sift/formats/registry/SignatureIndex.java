package com.libragraph.sift.formats.registry;

import com.libragraph.sift.formats.api.FormatParser;
import com.libragraph.sift.formats.api.Signature;
import com.libragraph.sift.util.buffer.ByteRegion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Maps signature bytes to the parser variants that may start at an offset.
 *
 * <p>Entries are bucketed by {@code (relative offset, first pattern byte)}. Probing an
 * offset costs one byte lookup per distinct relative offset; full pattern comparison only
 * happens for entries whose first byte already matched. Candidates come back in
 * registration order.
 *
 * <p>Immutable once built; shared by all scan workers.
 */
public final class SignatureIndex {

    /** Bytes scanned per read in {@link #nextCandidateOffset}. */
    private static final int CHUNK = 64 * 1024;

    private record Entry(Signature signature, FormatParser<?> parser, int rank) {}

    private final Map<Long, List<Entry>> buckets;
    private final int[] relativeOffsets;
    private final int maxSpan;
    private final int minLength;
    private final int size;

    private SignatureIndex(Map<Long, List<Entry>> buckets, int[] relativeOffsets,
                           int maxSpan, int minLength, int size) {
        this.buckets = buckets;
        this.relativeOffsets = relativeOffsets;
        this.maxSpan = maxSpan;
        this.minLength = minLength;
        this.size = size;
    }

    /**
     * Builds the index; {@code parsers} must already be in registration order.
     */
    static SignatureIndex build(List<FormatParser<?>> parsers) {
        Map<Long, List<Entry>> buckets = new HashMap<>();
        TreeSet<Integer> offsets = new TreeSet<>();
        int maxSpan = 0;
        int minLength = Integer.MAX_VALUE;
        int size = 0;

        for (int rank = 0; rank < parsers.size(); rank++) {
            FormatParser<?> parser = parsers.get(rank);
            for (Signature signature : parser.signatures()) {
                buckets.computeIfAbsent(key(signature.offset(), signature.firstByte()), k -> new ArrayList<>())
                        .add(new Entry(signature, parser, rank));
                offsets.add(signature.offset());
                maxSpan = Math.max(maxSpan, signature.span());
                minLength = Math.min(minLength, signature.length());
                size++;
            }
        }

        Map<Long, List<Entry>> frozen = new HashMap<>();
        buckets.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        int[] relativeOffsets = offsets.stream().mapToInt(Integer::intValue).toArray();
        return new SignatureIndex(Collections.unmodifiableMap(frozen), relativeOffsets,
                maxSpan, size == 0 ? 0 : minLength, size);
    }

    /**
     * Parser variants whose signatures all line up at {@code offset}, in registration order.
     */
    public List<FormatParser<?>> candidatesAt(ByteRegion region, long offset) {
        if (size == 0 || offset >= region.length()) {
            return List.of();
        }
        byte[] window = region.readAvailable(offset, maxSpan);
        TreeMap<Integer, FormatParser<?>> byRank = new TreeMap<>();
        for (int relative : relativeOffsets) {
            if (relative >= window.length) {
                break;
            }
            List<Entry> bucket = buckets.get(key(relative, window[relative] & 0xFF));
            if (bucket == null) {
                continue;
            }
            for (Entry entry : bucket) {
                if (entry.signature().matchesAt(window, 0)) {
                    byRank.putIfAbsent(entry.rank(), entry.parser());
                }
            }
        }
        return List.copyOf(byRank.values());
    }

    /**
     * First offset at or after {@code from} where any signature matches, or -1.
     */
    public long nextCandidateOffset(ByteRegion region, long from) {
        if (size == 0) {
            return -1;
        }
        long pos = Math.max(from, 0);
        while (pos < region.length()) {
            int chunkLen = (int) Math.min(CHUNK, region.length() - pos);
            byte[] window = region.readAvailable(pos, chunkLen + maxSpan);
            for (int i = 0; i < chunkLen; i++) {
                if (anyMatch(window, i)) {
                    return pos + i;
                }
            }
            pos += chunkLen;
        }
        return -1;
    }

    /**
     * Length of the shortest registered pattern; 0 when there are no signatures.
     */
    public int minimumSignatureLength() {
        return minLength;
    }

    /**
     * Number of registered signatures.
     */
    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    private boolean anyMatch(byte[] window, int start) {
        for (int relative : relativeOffsets) {
            int at = start + relative;
            if (at >= window.length) {
                return false;
            }
            List<Entry> bucket = buckets.get(key(relative, window[at] & 0xFF));
            if (bucket == null) {
                continue;
            }
            for (Entry entry : bucket) {
                if (entry.signature().matchesAt(window, start)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static long key(int relativeOffset, int firstByte) {
        return ((long) relativeOffset << 8) | firstByte;
    }
}
