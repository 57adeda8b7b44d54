package com.cinematic.core.exception;

/**
 * Thrown when a requested entity does not exist.
 */
public class NotFoundException extends PipelineException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String id) {
        super(ERROR_CODE, String.format("%s not found: %s", entityType, id));
    }
}
