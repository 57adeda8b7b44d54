package com.cinematic.worker.storage;

import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Builds asset keys of the form {@code <folder>/<epochSeconds>_<6 hex>.<ext>}.
 */
public final class AssetKeys {

    /**
     * Storage folders and the file type stored in each.
     */
    public enum Folder {
        IMAGES("images", "png", "image/png"),
        VIDEO("video", "mp4", "video/mp4"),
        RENDERS("renders", "mp4", "video/mp4");

        private final String path;
        private final String extension;
        private final String contentType;

        Folder(String path, String extension, String contentType) {
            this.path = path;
            this.extension = extension;
            this.contentType = contentType;
        }

        public String path() {
            return path;
        }

        public String extension() {
            return extension;
        }

        public String contentType() {
            return contentType;
        }
    }

    private AssetKeys() {
    }

    public static String newKey(Folder folder) {
        return newKey(folder, Instant.now());
    }

    public static String newKey(Folder folder, Instant at) {
        String suffix = String.format("%06x", ThreadLocalRandom.current().nextInt(0x1000000));
        return folder.path() + "/" + at.getEpochSecond() + "_" + suffix + "." + folder.extension();
    }

    /**
     * Folder part of a key, or null if the key has none.
     */
    public static String folderOf(String key) {
        int slash = key.indexOf('/');
        return slash > 0 ? key.substring(0, slash) : null;
    }
}
