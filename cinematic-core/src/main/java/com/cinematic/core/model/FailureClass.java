package com.cinematic.core.model;

/**
 * Classification of a stage failure.
 */
public enum FailureClass {
    /** Network or resource exhaustion, including timeouts. Retried with backoff. */
    TRANSIENT,
    /** Bad input or incompatible asset reported by a capability. */
    PERMANENT,
    /** Rejected by the safety gate. */
    POLICY;

    public boolean isRetryable() {
        return this == TRANSIENT;
    }
}
