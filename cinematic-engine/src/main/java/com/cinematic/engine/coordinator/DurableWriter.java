package com.cinematic.engine.coordinator;

import com.cinematic.core.exception.PersistenceUnavailableException;
import com.cinematic.engine.dispatch.DispatchGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs persistence writes against the control-plane store.
 *
 * A write that finds the store unreachable closes the dispatch gate and
 * rethrows. Callers that must see the write through wait in
 * {@link #awaitStore} and then re-evaluate what they were writing; that wait
 * happens outside any project monitor.
 */
public class DurableWriter {

    private static final Logger log = LoggerFactory.getLogger(DurableWriter.class);

    private final DispatchGate gate;

    public DurableWriter(DispatchGate gate) {
        this.gate = gate;
    }

    /**
     * Run a write once.
     *
     * @param what short description for logs
     * @throws PersistenceUnavailableException if the store is unreachable; dispatch is paused first
     */
    public void attempt(String what, Runnable action) {
        try {
            action.run();
        } catch (PersistenceUnavailableException e) {
            log.warn("Persistence unavailable during {}: {}", what, e.getMessage());
            gate.pause("Persistence unavailable: " + e.getMessage());
            throw e;
        }
    }

    /**
     * Block until dispatch resumes after a failed write.
     *
     * @param cause the failure that closed the gate
     * @throws PersistenceUnavailableException {@code cause}, if interrupted while waiting
     */
    public void awaitStore(String what, PersistenceUnavailableException cause) {
        try {
            gate.awaitOpen();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw cause;
        }
        log.info("Retrying {} after store recovered", what);
    }

    public DispatchGate gate() {
        return gate;
    }
}
