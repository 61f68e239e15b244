package com.libragraph.sift.formats.registry;

/**
 * A parser was rejected while building the registry: bad id, duplicate id or
 * malformed signatures. Raised at startup, never during a scan.
 */
public class RegistrationException extends RuntimeException {

    private final String parserId;

    public RegistrationException(String parserId, String message) {
        super("Cannot register parser '" + parserId + "': " + message);
        this.parserId = parserId;
    }

    public String parserId() {
        return parserId;
    }
}
