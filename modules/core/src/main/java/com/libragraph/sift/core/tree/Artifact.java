package com.libragraph.sift.core.tree;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.libragraph.sift.types.ArtifactKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.function.Consumer;

/**
 * Immutable node of a finished result tree.
 *
 * @param pathHint where the node sits inside its parent (member name, partition name,
 *                 or a generated name for carved pieces and gaps)
 * @param offset   start within the parent's region when both share a buffer;
 *                 0 for derived nodes and the root
 * @param length   bytes covered
 * @param parser   id of the validating variant; null unless kind is ARTIFACT
 * @param labels   sorted
 * @param derived  true when the bytes were produced by a parser (decompressed) rather
 *                 than cut out of the parent
 * @param scanned  false when the session was cancelled before the node was examined
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Artifact(
        String pathHint,
        long offset,
        long length,
        ArtifactKind kind,
        String parser,
        SortedSet<String> labels,
        Map<String, Object> metadata,
        List<Artifact> children,
        boolean derived,
        boolean scanned
) {
    public Artifact {
        children = List.copyOf(children);
    }

    /**
     * Visits this node and all descendants, depth first, in child order.
     */
    public void walk(Consumer<Artifact> visitor) {
        visitor.accept(this);
        for (Artifact child : children) {
            child.walk(visitor);
        }
    }

    /**
     * This node and all descendants, depth first.
     */
    public List<Artifact> flatten() {
        List<Artifact> all = new ArrayList<>();
        walk(all::add);
        return all;
    }

    /**
     * Edges on the longest root-to-leaf path; 0 for a leaf.
     */
    @JsonIgnore
    public int height() {
        int max = 0;
        for (Artifact child : children) {
            max = Math.max(max, child.height() + 1);
        }
        return max;
    }

    @JsonIgnore
    public boolean isLeaf() {
        return children.isEmpty();
    }
}
