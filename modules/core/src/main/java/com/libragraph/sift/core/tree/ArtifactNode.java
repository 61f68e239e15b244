package com.libragraph.sift.core.tree;

import com.libragraph.sift.formats.api.Description;
import com.libragraph.sift.types.ArtifactKind;
import com.libragraph.sift.util.buffer.ByteRegion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Mutable result-tree node, filled in while a session runs.
 *
 * <p>A node is created by the task that discovered it, in discovery order, before any
 * task for it is queued. After that only the one task that owns the node writes to it,
 * so no locking is needed; the session's completion publishes all writes to the reader.
 */
public final class ArtifactNode {

    private final ArtifactNode parent;
    private final String pathHint;
    private final String path;
    private final ByteRegion region;
    private final int depth;
    private final int ordinal;

    private final List<ArtifactNode> children = new ArrayList<>();
    private final SortedSet<String> labels = new TreeSet<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private final Map<String, Object> extraction = new LinkedHashMap<>();
    private ArtifactKind kind = ArtifactKind.UNRECOGNIZED;
    private String parserId;
    private boolean scanned = true;

    private ArtifactNode(ArtifactNode parent, String pathHint, ByteRegion region, int depth, int ordinal) {
        this.parent = parent;
        this.pathHint = pathHint;
        this.region = region;
        this.depth = depth;
        this.ordinal = ordinal;
        this.path = parent == null ? pathHint : parent.path + "/" + pathHint;
    }

    public static ArtifactNode root(String name, ByteRegion region) {
        return new ArtifactNode(null, name, region, 0, 0);
    }

    /**
     * Appends a child; children keep insertion order.
     */
    public ArtifactNode addChild(String pathHint, ByteRegion region) {
        ArtifactNode child = new ArtifactNode(this, pathHint, region, depth + 1, children.size());
        children.add(child);
        return child;
    }

    /**
     * Marks the node as a validated artifact of {@code parserId}.
     */
    public void recognize(String parserId, Description description) {
        this.kind = ArtifactKind.ARTIFACT;
        this.parserId = parserId;
        labels.addAll(description.labels());
        metadata.putAll(description.metadata());
    }

    /**
     * Marks the node as split into the carved artifacts and gaps added as its children.
     */
    public void carved() {
        this.kind = ArtifactKind.CARVED;
    }

    public void unrecognized() {
        this.kind = ArtifactKind.UNRECOGNIZED;
    }

    /**
     * Turns the node into a leaf linked to {@code firstPath}. Anything found by scanning it
     * is dropped; metadata from the parent's extraction is kept.
     */
    public void duplicateOf(String firstPath) {
        this.kind = ArtifactKind.DUPLICATE;
        this.parserId = null;
        labels.clear();
        children.clear();
        metadata.clear();
        metadata.putAll(extraction);
        metadata.put("duplicateOf", firstPath);
    }

    public void cycleOf(String ancestorPath) {
        this.kind = ArtifactKind.UNRECOGNIZED;
        metadata.put("cycleOf", ancestorPath);
    }

    public void skipped() {
        this.kind = ArtifactKind.SKIPPED;
        this.scanned = false;
    }

    public void putMetadata(String key, Object value) {
        metadata.put(key, value);
    }

    /**
     * Metadata the parent's parser attached when extracting this node.
     */
    public void putExtractionMetadata(Map<String, Object> values) {
        extraction.putAll(values);
        metadata.putAll(values);
    }

    public ArtifactNode parent() {
        return parent;
    }

    public String pathHint() {
        return pathHint;
    }

    /**
     * Slash-joined path hints from the root.
     */
    public String path() {
        return path;
    }

    public ByteRegion region() {
        return region;
    }

    public int depth() {
        return depth;
    }

    public ArtifactKind kind() {
        return kind;
    }

    public String parserId() {
        return parserId;
    }

    public boolean scanned() {
        return scanned;
    }

    public SortedSet<String> labels() {
        return Collections.unmodifiableSortedSet(labels);
    }

    public Map<String, Object> metadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public List<ArtifactNode> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * True when this node comes before {@code other} in a pre-order walk of their tree.
     */
    public boolean precedes(ArtifactNode other) {
        if (this == other) {
            return false;
        }
        List<ArtifactNode> mine = lineage();
        List<ArtifactNode> theirs = other.lineage();
        int common = Math.min(mine.size(), theirs.size());
        for (int i = 0; i < common; i++) {
            if (mine.get(i) != theirs.get(i)) {
                return mine.get(i).ordinal < theirs.get(i).ordinal;
            }
        }
        return mine.size() < theirs.size();
    }

    // Root first.
    private List<ArtifactNode> lineage() {
        List<ArtifactNode> nodes = new ArrayList<>(depth + 1);
        for (ArtifactNode n = this; n != null; n = n.parent) {
            nodes.add(n);
        }
        Collections.reverse(nodes);
        return nodes;
    }

    /**
     * True when the node's bytes live in a buffer other than its parent's.
     */
    public boolean derived() {
        return parent != null && parent.region.data() != region.data();
    }

    @Override
    public String toString() {
        return "ArtifactNode[" + path + " " + kind + " " + region + "]";
    }
}
