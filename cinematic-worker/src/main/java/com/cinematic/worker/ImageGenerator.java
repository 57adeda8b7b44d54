package com.cinematic.worker;

/**
 * Image synthesis capability. GPU-bound.
 */
@FunctionalInterface
public interface ImageGenerator {

    /**
     * Generate a still image for a scene.
     *
     * @param request Prompt and framing
     * @return The stored image
     * @throws CapabilityException classified as transient or permanent
     */
    ImageAsset generateImage(ImageRequest request) throws CapabilityException;
}
