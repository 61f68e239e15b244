package com.libragraph.sift.formats.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Descriptive output of a parser: labels plus free-form metadata.
 * Labels are kept sorted and metadata keeps insertion order so output is reproducible.
 */
public record Description(SortedSet<String> labels, Map<String, Object> metadata) {

    public Description {
        labels = Collections.unmodifiableSortedSet(new TreeSet<>(labels));
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Description of(Set<String> labels, Map<String, Object> metadata) {
        return new Description(new TreeSet<>(labels), metadata);
    }

    public static Description ofLabels(String... labels) {
        return new Description(new TreeSet<>(Set.of(labels)), Map.of());
    }
}
