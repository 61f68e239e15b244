package com.libragraph.sift.formats.api;

import com.libragraph.sift.util.buffer.ByteRegion;

import java.util.List;
import java.util.Optional;

/**
 * Contract every format plugin implements.
 *
 * <p>The engine calls the stages in a fixed order:
 * {@link #signatures()} once at registration, then per candidate offset
 * {@link #parse} → {@link #consumedLength} → {@link #carve} → {@link #extractChildren}
 * → {@link #describe}. Every stage after {@code parse} takes the state that only a
 * successful parse produces, so the order cannot be broken from the plugin side.
 *
 * <p>{@code region} is always the region handed to {@code parse}: it starts at the candidate
 * offset and runs to the end of the scanned region. Implementations must be stateless
 * between calls (several workers share one instance), must not perform network or
 * interactive I/O, and should be {@code @ApplicationScoped} CDI beans.
 *
 * @param <S> parsed-structure state produced by {@link #parse}
 */
public interface FormatParser<S> {

    /**
     * Stable variant id, unique within a registry (e.g. {@code "bmp"}).
     */
    String id();

    /**
     * Signatures that suggest this format starts at a given offset.
     * An empty list makes this a fallback parser, tried only at the start of a region.
     */
    List<Signature> signatures();

    /**
     * Registration order among CDI-discovered parsers: higher goes first.
     * Specific formats should outrank generic ones sharing a signature.
     */
    default int priority() {
        return 100;
    }

    /**
     * Validates the structure at the start of {@code region}.
     * Reads past the region raise {@link com.libragraph.sift.util.buffer.BufferBoundsException},
     * which the engine treats as a mismatch.
     */
    ParseResult<S> parse(ByteRegion region);

    /**
     * Bytes of {@code region} this instance occupies. Must be in {@code (0, region.length()]}.
     * Must not read the region again.
     */
    long consumedLength(S state);

    /**
     * Precise sub-region to keep when the logical file is shorter than what was consumed.
     * Empty means the consumed prefix is kept as is.
     */
    default Optional<ByteRegion> carve(S state, ByteRegion region) {
        return Optional.empty();
    }

    /**
     * Embedded sub-artifacts in a stable order: sub-regions of the carved range or
     * regions over buffers the parser derived (decompressed data).
     */
    default List<ExtractedChild> extractChildren(S state, ByteRegion region) {
        return List.of();
    }

    /**
     * Labels and metadata for the result tree. Must not fail.
     */
    Description describe(S state);
}
