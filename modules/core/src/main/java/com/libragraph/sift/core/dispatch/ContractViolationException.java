package com.libragraph.sift.core.dispatch;

/**
 * A parser returned something its contract forbids: a consumed length outside the
 * region, a carve outside the consumed range, a child region outside the carve or
 * overlapping another child.
 * Raised and handled inside the engine; the variant is poisoned for the session.
 */
public class ContractViolationException extends RuntimeException {

    private final String parserId;

    public ContractViolationException(String parserId, String message) {
        super("Parser '" + parserId + "' violated its contract: " + message);
        this.parserId = parserId;
    }

    public ContractViolationException(String parserId, String message, Throwable cause) {
        super("Parser '" + parserId + "' violated its contract: " + message, cause);
        this.parserId = parserId;
    }

    public String parserId() {
        return parserId;
    }
}
