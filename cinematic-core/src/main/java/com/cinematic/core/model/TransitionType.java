package com.cinematic.core.model;

/**
 * How one scene hands over to the next in the composed video.
 */
public enum TransitionType {
    NONE,
    CROSSFADE,
    CUT,
    FADE
}
