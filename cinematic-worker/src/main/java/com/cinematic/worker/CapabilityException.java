package com.cinematic.worker;

/**
 * Classified failure reported by a capability adapter.
 * The scheduler retries retryable failures with backoff and escalates the rest immediately.
 */
public class CapabilityException extends Exception {

    private final String errorCode;
    private final boolean retryable;

    public CapabilityException(String errorCode, String message, boolean retryable) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public CapabilityException(String errorCode, String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
