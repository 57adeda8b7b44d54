package com.cinematic.worker.storage;

import com.cinematic.worker.PermanentCapabilityException;

/**
 * A referenced asset key does not exist in the store.
 */
public class AssetNotFoundException extends PermanentCapabilityException {

    public static final String ERROR_CODE = "ASSET_NOT_FOUND";

    public AssetNotFoundException(String key) {
        super(ERROR_CODE, "Asset not found: " + key);
    }
}
