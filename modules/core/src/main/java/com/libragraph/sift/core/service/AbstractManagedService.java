package com.libragraph.sift.core.service;

import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Optional;

/**
 * Lifecycle skeleton: subclasses supply {@link #doStart()} and {@link #doStop()}.
 * Start and stop are serialized and idempotent; a failed service may be started again.
 */
public abstract class AbstractManagedService implements ManagedService {

    protected final Logger log = Logger.getLogger(getClass());

    private volatile State state = State.STOPPED;
    private volatile Instant since = Instant.now();
    private volatile Throwable failure;

    protected abstract void doStart() throws Exception;

    protected abstract void doStop() throws Exception;

    @Override
    public State state() {
        return state;
    }

    @Override
    public Instant since() {
        return since;
    }

    @Override
    public Optional<Throwable> failure() {
        return state == State.FAILED ? Optional.ofNullable(failure) : Optional.empty();
    }

    @Override
    public synchronized void start() throws Exception {
        if (state == State.RUNNING) {
            return;
        }
        enter(State.STARTING);
        try {
            doStart();
        } catch (Exception e) {
            failed(e);
            throw e;
        }
        failure = null;
        enter(State.RUNNING);
    }

    @Override
    public synchronized void stop() throws Exception {
        if (state == State.STOPPED) {
            return;
        }
        enter(State.STOPPING);
        try {
            doStop();
        } catch (Exception e) {
            failed(e);
            throw e;
        }
        enter(State.STOPPED);
    }

    private void failed(Exception cause) {
        log.errorf(cause, "Service '%s' failed while %s", serviceId(), state);
        failure = cause;
        enter(State.FAILED);
    }

    private void enter(State next) {
        State previous = state;
        state = next;
        since = Instant.now();
        log.infof("Service '%s': %s -> %s", serviceId(), previous, next);
    }
}
