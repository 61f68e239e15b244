package com.libragraph.sift.core.report;

public enum FailureKind {
    CONTRACT_VIOLATION(0, "contract violation"),
    PARSER_FAULT(1, "parser fault"),
    POISONED(2, "poisoned"),
    OVERLAP(3, "overlap"),
    TASK_FAULT(4, "task fault");

    private final int id;
    private final String label;

    FailureKind(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }
}
