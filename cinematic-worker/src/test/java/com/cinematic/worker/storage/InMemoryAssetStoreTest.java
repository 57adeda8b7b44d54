package com.cinematic.worker.storage;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryAssetStoreTest {

    private final InMemoryAssetStore store = new InMemoryAssetStore();

    @Test
    void put_shouldStoreBytesAndContentType() throws Exception {
        String key = store.put("images/1_000000.png", "pixels".getBytes(StandardCharsets.UTF_8), "image/png");

        assertEquals("images/1_000000.png", key);
        assertArrayEquals("pixels".getBytes(StandardCharsets.UTF_8), store.get(key));
        assertEquals("image/png", store.contentType(key));
        assertTrue(store.exists(key));
    }

    @Test
    void get_withUnknownKey_shouldThrowPermanentNotFound() {
        AssetNotFoundException error = assertThrows(AssetNotFoundException.class, () -> store.get("images/missing.png"));

        assertFalse(error.isRetryable());
        assertEquals(AssetNotFoundException.ERROR_CODE, error.getErrorCode());
    }

    @Test
    void unavailable_shouldThrowRetryableStorageError() {
        store.setAvailable(false);

        StorageException error = assertThrows(StorageException.class,
            () -> store.put("images/x.png", new byte[0], "image/png"));

        assertTrue(error.isRetryable());
    }

    @Test
    void delete_shouldRemoveAsset() throws Exception {
        store.put("video/1_000001.mp4", new byte[]{1, 2}, "video/mp4");

        store.delete("video/1_000001.mp4");

        assertFalse(store.exists("video/1_000001.mp4"));
        assertEquals(0, store.size());
    }
}
