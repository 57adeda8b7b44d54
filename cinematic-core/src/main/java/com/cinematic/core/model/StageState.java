package com.cinematic.core.model;

/**
 * Lifecycle states for a stage.
 */
public enum StageState {
    /**
     * Waiting on at least one dependency.
     * Transitions: -> READY, CANCELLED
     */
    PENDING,

    /**
     * All dependencies succeeded, queued for a worker slot.
     * Transitions: -> RUNNING, CANCELLED
     */
    READY,

    /**
     * Dispatched to a capability.
     * Transitions: -> SUCCEEDED, FAILED, CANCELLED
     */
    RUNNING,

    /**
     * Output produced. Terminal state.
     */
    SUCCEEDED,

    /**
     * Capability or safety gate failure.
     * Transitions: -> READY (backoff elapsed or manual retry), CANCELLED
     */
    FAILED,

    /**
     * Cancelled by request or by an upstream failure.
     * Transitions: -> PENDING (manual retry re-derives it)
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(StageState target) {
        return switch (this) {
            case PENDING -> target == READY || target == CANCELLED;
            case READY -> target == RUNNING || target == CANCELLED;
            case RUNNING -> target == SUCCEEDED || target == FAILED || target == CANCELLED;
            case FAILED -> target == READY || target == CANCELLED;
            case CANCELLED -> target == PENDING;
            case SUCCEEDED -> false;
        };
    }
}
