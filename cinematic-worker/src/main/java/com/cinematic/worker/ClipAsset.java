package com.cinematic.worker;

/**
 * Reference to a scene clip in the asset store.
 */
public record ClipAsset(String key, double durationSeconds) {
}
