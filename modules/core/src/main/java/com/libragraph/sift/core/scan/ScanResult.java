package com.libragraph.sift.core.scan;

import com.libragraph.sift.core.report.ScanFailure;
import com.libragraph.sift.core.tree.Artifact;

import java.util.List;
import java.util.SortedSet;

/**
 * Outcome of a session: the tree plus the failure and poison report.
 * An aborted result still carries every node finished before the stop.
 */
public record ScanResult(
        Artifact root,
        Status status,
        List<ScanFailure> failures,
        SortedSet<String> poisoned
) {
    public enum Status { COMPLETE, ABORTED }

    public ScanResult {
        failures = List.copyOf(failures);
    }

    public boolean isComplete() {
        return status == Status.COMPLETE;
    }

    /**
     * Returns this result if complete.
     *
     * @throws ScanAbortedException carrying this partial result otherwise
     */
    public ScanResult orThrow() {
        if (status == Status.ABORTED) {
            throw new ScanAbortedException(this);
        }
        return this;
    }
}
