package com.libragraph.sift.api;

import com.libragraph.sift.core.report.ScanFailure;
import com.libragraph.sift.core.scan.ScanResult;
import com.libragraph.sift.core.tree.Artifact;

import java.util.List;
import java.util.SortedSet;

/**
 * JSON body returned by {@code POST /api/scan}.
 */
public record ScanReport(
        String status,
        Artifact root,
        List<ScanFailure> failures,
        SortedSet<String> poisoned
) {
    public static ScanReport from(ScanResult result) {
        return new ScanReport(result.status().name(), result.root(), result.failures(), result.poisoned());
    }
}
