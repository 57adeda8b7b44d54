package com.cinematic.worker;

/**
 * Reference to a generated still image in the asset store.
 */
public record ImageAsset(String key) {
}
