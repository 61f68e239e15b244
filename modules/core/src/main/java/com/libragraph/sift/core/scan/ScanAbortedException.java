package com.libragraph.sift.core.scan;

/**
 * The session was cancelled before every task ran. The partial tree is still available.
 */
public class ScanAbortedException extends RuntimeException {

    private final transient ScanResult partialResult;

    public ScanAbortedException(ScanResult partialResult) {
        super("Scan of '" + partialResult.root().pathHint() + "' was cancelled; result is incomplete");
        this.partialResult = partialResult;
    }

    public ScanResult partialResult() {
        return partialResult;
    }
}
