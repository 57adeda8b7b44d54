package com.cinematic.worker;

/**
 * Input to animation of a still image.
 *
 * @param motionPrompt the scene prompt, used to guide motion
 */
public record AnimationRequest(int sceneNumber, double durationSeconds, String aspectRatio, String motionPrompt) {
}
