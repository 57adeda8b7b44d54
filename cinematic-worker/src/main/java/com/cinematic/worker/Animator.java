package com.cinematic.worker;

/**
 * Image-to-video capability. GPU-bound.
 */
@FunctionalInterface
public interface Animator {

    /**
     * Animate a still image into a clip.
     *
     * @param image The source image
     * @param request Duration and framing
     * @return The stored clip
     * @throws CapabilityException classified as transient or permanent
     */
    ClipAsset animate(ImageAsset image, AnimationRequest request) throws CapabilityException;
}
