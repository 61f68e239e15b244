package com.libragraph.sift.core.dispatch;

import com.libragraph.sift.formats.api.Description;
import com.libragraph.sift.formats.api.ExtractedChild;
import com.libragraph.sift.util.buffer.ByteRegion;

import java.util.List;

/**
 * A candidate that passed every stage at one offset.
 *
 * @param parserId winning variant
 * @param offset   start relative to the dispatched region
 * @param consumed bytes claimed from {@code offset}
 * @param carved   bytes kept as the artifact; inside the consumed range
 * @param children extracted sub-artifacts in parser order
 */
public record ValidatedMatch(
        String parserId,
        long offset,
        long consumed,
        ByteRegion carved,
        List<ExtractedChild> children,
        Description description
) {
    public ValidatedMatch {
        children = List.copyOf(children);
    }

    /**
     * The consumed range as a region of {@code region}.
     */
    public ByteRegion consumedRegion(ByteRegion region) {
        return region.slice(offset, consumed);
    }

    public long end() {
        return offset + consumed;
    }
}
