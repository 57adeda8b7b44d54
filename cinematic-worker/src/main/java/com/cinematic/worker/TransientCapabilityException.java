package com.cinematic.worker;

/**
 * Network or resource exhaustion (rate limits, busy GPU, unreachable storage). Retryable.
 */
public class TransientCapabilityException extends CapabilityException {

    public TransientCapabilityException(String errorCode, String message) {
        super(errorCode, message, true);
    }

    public TransientCapabilityException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause, true);
    }
}
