package com.cinematic.worker;

/**
 * Reference to a composed final video in the asset store.
 */
public record VideoAsset(String key, double durationSeconds) {
}
