package com.cinematic.worker.storage;

import com.cinematic.worker.TransientCapabilityException;

/**
 * The asset store could not be reached.
 */
public class StorageException extends TransientCapabilityException {

    public static final String ERROR_CODE = "STORAGE_UNAVAILABLE";

    public StorageException(String message) {
        super(ERROR_CODE, message);
    }

    public StorageException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
