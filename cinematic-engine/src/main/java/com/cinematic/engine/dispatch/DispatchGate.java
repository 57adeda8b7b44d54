package com.cinematic.engine.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Global switch that halts dispatch while the control-plane store is unreachable.
 * Dispatchers and writers block in {@link #awaitOpen()} until the gate is resumed.
 */
public class DispatchGate {

    private static final Logger log = LoggerFactory.getLogger(DispatchGate.class);

    private boolean paused = false;
    private String reason;
    private Instant pausedAt;

    /**
     * Close the gate. Repeated calls keep the first reason.
     */
    public synchronized void pause(String reason) {
        if (paused) {
            return;
        }
        this.paused = true;
        this.reason = reason;
        this.pausedAt = Instant.now();
        log.warn("Dispatch paused: {}", reason);
    }

    public synchronized void resume() {
        if (!paused) {
            return;
        }
        log.info("Dispatch resumed after pause since {} ({})", pausedAt, reason);
        this.paused = false;
        this.reason = null;
        this.pausedAt = null;
        notifyAll();
    }

    /**
     * Block while the gate is closed.
     */
    public synchronized void awaitOpen() throws InterruptedException {
        while (paused) {
            wait();
        }
    }

    public synchronized boolean isPaused() {
        return paused;
    }

    public synchronized String pauseReason() {
        return reason;
    }

    public synchronized Instant pausedAt() {
        return pausedAt;
    }
}
