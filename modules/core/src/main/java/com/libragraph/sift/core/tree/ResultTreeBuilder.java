package com.libragraph.sift.core.tree;

import com.libragraph.sift.types.ArtifactKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.TreeSet;

/**
 * Freezes a finished {@link ArtifactNode} tree into {@link Artifact} records.
 * Must only run once every task that could write to the tree has finished.
 */
public final class ResultTreeBuilder {

    private ResultTreeBuilder() {
    }

    public static Artifact build(ArtifactNode root) {
        return freeze(root);
    }

    private static Artifact freeze(ArtifactNode node) {
        List<Artifact> children = new ArrayList<>(node.children().size());
        for (ArtifactNode child : node.children()) {
            children.add(freeze(child));
        }

        TreeSet<String> labels = new TreeSet<>(node.labels());
        if (node.kind() != ArtifactKind.ARTIFACT) {
            labels.add(node.kind().label());
        }

        long offset = 0;
        ArtifactNode parent = node.parent();
        if (parent != null && !node.derived()) {
            offset = node.region().offset() - parent.region().offset();
        }

        return new Artifact(
                node.pathHint(),
                offset,
                node.region().length(),
                node.kind(),
                node.parserId(),
                Collections.unmodifiableSortedSet(labels),
                Collections.unmodifiableMap(new LinkedHashMap<>(node.metadata())),
                children,
                node.derived(),
                node.scanned());
    }
}
