package com.cinematic.worker;

/**
 * Concatenates scene clips with transitions into the final video. CPU-bound.
 */
@FunctionalInterface
public interface Composer {

    /**
     * Compose the final video.
     *
     * @param request Ordered clips and transitions
     * @return The stored video
     * @throws CapabilityException classified as transient or permanent
     */
    VideoAsset compose(CompositionRequest request) throws CapabilityException;
}
