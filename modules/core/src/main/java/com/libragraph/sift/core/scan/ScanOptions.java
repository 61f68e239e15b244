package com.libragraph.sift.core.scan;

/**
 * Policy knobs for one scan session.
 *
 * @param maxDepth           tasks at or beyond this depth are not matched; they become
 *                           unrecognized leaves
 * @param minRegionSize      regions shorter than this are not matched; 0 means the shortest
 *                           registered signature
 * @param dedupByContentHash link byte-identical extracted regions instead of re-scanning them
 * @param scanGaps           scan unclaimed gaps as tasks of their own instead of leaving them
 *                           as terminal leaves
 * @param workerCount        worker threads per session
 * @param poisonThreshold    unexpected faults after which a variant is disabled
 */
public record ScanOptions(
        int maxDepth,
        int minRegionSize,
        boolean dedupByContentHash,
        boolean scanGaps,
        int workerCount,
        int poisonThreshold
) {
    public static final int DEFAULT_MAX_DEPTH = 8;
    public static final int DEFAULT_POISON_THRESHOLD = 3;

    public ScanOptions {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, got " + maxDepth);
        }
        if (minRegionSize < 0) {
            throw new IllegalArgumentException("minRegionSize must not be negative, got " + minRegionSize);
        }
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1, got " + workerCount);
        }
        if (poisonThreshold < 1) {
            throw new IllegalArgumentException("poisonThreshold must be at least 1, got " + poisonThreshold);
        }
    }

    public static ScanOptions defaults() {
        return new ScanOptions(DEFAULT_MAX_DEPTH, 0, false, false,
                Runtime.getRuntime().availableProcessors(), DEFAULT_POISON_THRESHOLD);
    }

    public ScanOptions withMaxDepth(int value) {
        return new ScanOptions(value, minRegionSize, dedupByContentHash, scanGaps, workerCount, poisonThreshold);
    }

    public ScanOptions withMinRegionSize(int value) {
        return new ScanOptions(maxDepth, value, dedupByContentHash, scanGaps, workerCount, poisonThreshold);
    }

    public ScanOptions withDedupByContentHash(boolean value) {
        return new ScanOptions(maxDepth, minRegionSize, value, scanGaps, workerCount, poisonThreshold);
    }

    public ScanOptions withScanGaps(boolean value) {
        return new ScanOptions(maxDepth, minRegionSize, dedupByContentHash, value, workerCount, poisonThreshold);
    }

    public ScanOptions withWorkerCount(int value) {
        return new ScanOptions(maxDepth, minRegionSize, dedupByContentHash, scanGaps, value, poisonThreshold);
    }

    public ScanOptions withPoisonThreshold(int value) {
        return new ScanOptions(maxDepth, minRegionSize, dedupByContentHash, scanGaps, workerCount, value);
    }
}
