package com.cinematic.worker;

/**
 * Malformed input or incompatible asset. Never retried automatically.
 */
public class PermanentCapabilityException extends CapabilityException {

    public PermanentCapabilityException(String errorCode, String message) {
        super(errorCode, message, false);
    }

    public PermanentCapabilityException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause, false);
    }
}
