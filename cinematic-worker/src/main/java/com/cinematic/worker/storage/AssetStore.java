package com.cinematic.worker.storage;

/**
 * Binary blob storage for generated assets, addressed by key.
 */
public interface AssetStore {

    /**
     * Store an asset.
     *
     * @param key Asset key, see {@link AssetKeys}
     * @param data Asset bytes
     * @param contentType MIME type
     * @return The key under which the asset was stored
     * @throws StorageException if the store is unavailable
     */
    String put(String key, byte[] data, String contentType) throws StorageException;

    /**
     * Load an asset.
     *
     * @param key Asset key
     * @return Asset bytes
     * @throws StorageException if the store is unavailable
     * @throws AssetNotFoundException if no asset exists under the key
     */
    byte[] get(String key) throws StorageException, AssetNotFoundException;

    /**
     * Check whether an asset exists.
     */
    boolean exists(String key) throws StorageException;

    /**
     * Delete an asset. Missing keys are ignored.
     */
    void delete(String key) throws StorageException;
}
