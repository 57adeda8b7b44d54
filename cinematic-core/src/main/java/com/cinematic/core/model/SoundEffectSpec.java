package com.cinematic.core.model;

/**
 * A sound effect to be mixed into a scene's clip.
 *
 * @param type short category, e.g. "ambient" or "impact"
 * @param description free text handed to the audio capability
 */
public record SoundEffectSpec(String type, String description) {
}
