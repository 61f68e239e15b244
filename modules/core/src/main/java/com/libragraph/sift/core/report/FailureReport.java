package com.libragraph.sift.core.report;

import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Side channel for failures raised by any worker of a session.
 */
public final class FailureReport {

    private static final Logger log = Logger.getLogger(FailureReport.class);

    private static final Comparator<ScanFailure> ORDER = Comparator
            .comparing(ScanFailure::path)
            .thenComparingLong(ScanFailure::offset)
            .thenComparing(ScanFailure::kind)
            .thenComparing(f -> f.parserId() == null ? "" : f.parserId());

    private final ConcurrentLinkedQueue<ScanFailure> failures = new ConcurrentLinkedQueue<>();

    public void record(ScanFailure failure) {
        failures.add(failure);
        switch (failure.kind()) {
            case OVERLAP, TASK_FAULT -> log.errorf("%s at %s+%d: %s",
                    failure.kind().label(), failure.path(), failure.offset(), failure.message());
            default -> log.warnf("%s in '%s' at %s+%d: %s",
                    failure.kind().label(), failure.parserId(), failure.path(), failure.offset(), failure.message());
        }
    }

    /**
     * Snapshot sorted by path and offset, so reports do not depend on worker timing.
     */
    public List<ScanFailure> failures() {
        List<ScanFailure> sorted = new ArrayList<>(failures);
        sorted.sort(ORDER);
        return List.copyOf(sorted);
    }

    /**
     * Drops failures raised while scanning {@code path} or anything below it. Poisoning
     * records stay, since the poisoned variant stays disabled.
     */
    public void discardUnder(String path) {
        String prefix = path + "/";
        failures.removeIf(f -> f.kind() != FailureKind.POISONED
                && (f.path().equals(path) || f.path().startsWith(prefix)));
    }

    public boolean isEmpty() {
        return failures.isEmpty();
    }

    public long count(FailureKind kind) {
        return failures.stream().filter(f -> f.kind() == kind).count();
    }
}
