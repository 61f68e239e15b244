package com.libragraph.sift.core.scan;

import java.util.EnumSet;
import java.util.Set;

public enum ScanTaskState {
    PENDING(0, "PENDING"),
    MATCHING(1, "MATCHING"),
    VALIDATING(2, "VALIDATING"),
    VALIDATED(3, "VALIDATED"),
    REJECTED(4, "REJECTED");

    private final int id;
    private final String label;

    ScanTaskState(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this == VALIDATED || this == REJECTED;
    }

    /**
     * States reachable from this one in a single step.
     */
    public Set<ScanTaskState> next() {
        return switch (this) {
            case PENDING -> EnumSet.of(MATCHING, REJECTED);
            case MATCHING -> EnumSet.of(VALIDATING, REJECTED);
            case VALIDATING -> EnumSet.of(VALIDATED, REJECTED);
            case VALIDATED, REJECTED -> EnumSet.noneOf(ScanTaskState.class);
        };
    }

    public static ScanTaskState fromId(int id) {
        for (ScanTaskState s : values()) {
            if (s.id == id) return s;
        }
        throw new IllegalArgumentException("Unknown ScanTaskState id: " + id);
    }
}
