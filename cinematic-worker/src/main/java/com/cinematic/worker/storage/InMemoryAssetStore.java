package com.cinematic.worker.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory asset store used for offline runs and tests.
 * Can be switched unavailable to simulate a storage outage.
 */
public class InMemoryAssetStore implements AssetStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAssetStore.class);

    private record StoredAsset(byte[] data, String contentType) {}

    private final Map<String, StoredAsset> assets = new ConcurrentHashMap<>();
    private volatile boolean available = true;

    @Override
    public String put(String key, byte[] data, String contentType) throws StorageException {
        checkAvailable();
        assets.put(key, new StoredAsset(data.clone(), contentType));
        log.debug("Stored asset {} ({} bytes, {})", key, data.length, contentType);
        return key;
    }

    @Override
    public byte[] get(String key) throws StorageException, AssetNotFoundException {
        checkAvailable();
        StoredAsset asset = assets.get(key);
        if (asset == null) {
            throw new AssetNotFoundException(key);
        }
        return asset.data().clone();
    }

    @Override
    public boolean exists(String key) throws StorageException {
        checkAvailable();
        return assets.containsKey(key);
    }

    @Override
    public void delete(String key) throws StorageException {
        checkAvailable();
        assets.remove(key);
    }

    public String contentType(String key) {
        StoredAsset asset = assets.get(key);
        return asset != null ? asset.contentType() : null;
    }

    public int size() {
        return assets.size();
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    private void checkAvailable() throws StorageException {
        if (!available) {
            throw new StorageException("Asset store is unavailable");
        }
    }
}
