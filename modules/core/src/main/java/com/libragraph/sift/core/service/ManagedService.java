package com.libragraph.sift.core.service;

import java.time.Instant;
import java.util.Optional;

/**
 * A component with a start/stop lifecycle whose state is exposed to health checks.
 */
public interface ManagedService {

    enum State { STOPPED, STARTING, RUNNING, STOPPING, FAILED }

    String serviceId();

    State state();

    /** When the service entered its current state. */
    Instant since();

    /** Cause of the last failure, while the service is FAILED. */
    Optional<Throwable> failure();

    void start() throws Exception;

    void stop() throws Exception;

    default boolean isRunning() {
        return state() == State.RUNNING;
    }
}
