package com.libragraph.sift.core.scan;

import com.libragraph.sift.core.ledger.ClaimLedger;
import com.libragraph.sift.core.tree.ArtifactNode;
import com.libragraph.sift.util.buffer.ByteRegion;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One region queued for scanning. Processed end to end by a single worker.
 */
public final class ScanTask {

    /** An artifact on the path from the root to this task, for cycle detection. */
    record Ancestor(ByteRegion region, ArtifactNode node) {}

    private final ByteRegion region;
    private final int depth;
    private final ArtifactNode node;
    private final ClaimLedger ledger;
    private final boolean gapScan;
    private final List<Ancestor> ancestry;
    private volatile ScanTaskState state = ScanTaskState.PENDING;

    private ScanTask(ByteRegion region, int depth, ArtifactNode node, ClaimLedger ledger,
                     boolean gapScan, List<Ancestor> ancestry) {
        this.region = region;
        this.depth = depth;
        this.node = node;
        this.ledger = ledger;
        this.gapScan = gapScan;
        this.ancestry = ancestry;
    }

    static ScanTask root(ArtifactNode node) {
        return new ScanTask(node.region(), 0, node, new ClaimLedger(node.region()), false, List.of());
    }

    /**
     * Task for a child extracted from the artifact {@code origin}; gets its own ledger.
     */
    ScanTask child(ArtifactNode childNode, ArtifactNode origin) {
        List<Ancestor> lineage = new ArrayList<>(ancestry.size() + 1);
        lineage.addAll(ancestry);
        lineage.add(new Ancestor(origin.region(), origin));
        return new ScanTask(childNode.region(), childNode.depth(), childNode,
                new ClaimLedger(childNode.region()), false, List.copyOf(lineage));
    }

    /**
     * Task for an unclaimed gap of this task's region; shares this task's ledger.
     */
    ScanTask gap(ArtifactNode gapNode) {
        return new ScanTask(gapNode.region(), gapNode.depth(), gapNode, ledger, true, ancestry);
    }

    /**
     * Nearest artifact above this task covering exactly the same bytes of the same data.
     */
    Optional<ArtifactNode> cycleAncestor() {
        for (int i = ancestry.size() - 1; i >= 0; i--) {
            Ancestor ancestor = ancestry.get(i);
            if (ancestor.region().sameSpan(region)) {
                return Optional.of(ancestor.node());
            }
        }
        return Optional.empty();
    }

    void transition(ScanTaskState next) {
        if (!state.next().contains(next)) {
            throw new IllegalStateException("Illegal task transition " + state + " -> " + next + " for " + node.path());
        }
        state = next;
    }

    public ByteRegion region() {
        return region;
    }

    public int depth() {
        return depth;
    }

    public ArtifactNode node() {
        return node;
    }

    public ClaimLedger ledger() {
        return ledger;
    }

    public boolean gapScan() {
        return gapScan;
    }

    public ScanTaskState state() {
        return state;
    }

    @Override
    public String toString() {
        return "ScanTask[" + node.path() + " depth=" + depth + " " + region + " " + state + "]";
    }
}
