package com.cinematic.core.exception;

/**
 * Thrown when an operation is not allowed in the current state,
 * either by a caller (retrying a project that has not failed) or by the stage state machine.
 */
public class InvalidStateException extends PipelineException {

    public static final String ERROR_CODE = "INVALID_STATE";

    public InvalidStateException(String message) {
        super(ERROR_CODE, message);
    }

    public InvalidStateException(String entityType, String currentState, String targetState) {
        super(ERROR_CODE, String.format(
            "Cannot transition %s from %s to %s",
            entityType, currentState, targetState
        ));
    }
}
