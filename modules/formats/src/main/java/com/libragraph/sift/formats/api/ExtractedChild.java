package com.libragraph.sift.formats.api;

import com.libragraph.sift.util.buffer.ByteRegion;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A sub-artifact a parser found inside its carved region.
 *
 * @param pathHint where the child lives inside its container (member name, partition name)
 * @param region   bytes of the child
 * @param metadata container-specific facts about the entry (mode, mtime); may be empty
 */
public record ExtractedChild(
        String pathHint,
        ByteRegion region,
        Map<String, Object> metadata
) {
    public ExtractedChild {
        Objects.requireNonNull(region, "region cannot be null");
        pathHint = pathHint == null ? "" : pathHint;
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public ExtractedChild(String pathHint, ByteRegion region) {
        this(pathHint, region, Map.of());
    }
}
