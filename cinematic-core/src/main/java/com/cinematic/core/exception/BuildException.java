package com.cinematic.core.exception;

import java.util.List;

/**
 * Thrown when a project cannot be turned into a stage graph.
 * Raised before any work is scheduled.
 */
public class BuildException extends PipelineException {

    public static final String ERROR_CODE = "BUILD_ERROR";

    private final List<String> errors;

    public BuildException(String message) {
        super(ERROR_CODE, message);
        this.errors = List.of(message);
    }

    public BuildException(List<String> errors) {
        super(ERROR_CODE, "Invalid project: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
