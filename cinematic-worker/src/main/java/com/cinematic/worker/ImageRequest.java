package com.cinematic.worker;

/**
 * Input to image generation.
 *
 * @param prompt prompt with the style booster already applied
 * @param aspectRatio one of 16:9, 9:16, 1:1
 */
public record ImageRequest(int sceneNumber, String prompt, String aspectRatio) {
}
