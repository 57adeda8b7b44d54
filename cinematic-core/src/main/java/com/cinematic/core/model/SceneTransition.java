package com.cinematic.core.model;

/**
 * Transition between two consecutive scenes of the composed video.
 */
public record SceneTransition(int fromScene, int toScene, TransitionType type) {
}
