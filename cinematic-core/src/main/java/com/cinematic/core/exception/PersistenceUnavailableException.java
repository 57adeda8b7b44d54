package com.cinematic.core.exception;

/**
 * Thrown when the project/stage store cannot be reached.
 * This is a control-plane outage: dispatch pauses until the store answers again.
 */
public class PersistenceUnavailableException extends PipelineException {

    public static final String ERROR_CODE = "PERSISTENCE_UNAVAILABLE";

    public PersistenceUnavailableException(String message) {
        super(ERROR_CODE, message);
    }

    public PersistenceUnavailableException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
