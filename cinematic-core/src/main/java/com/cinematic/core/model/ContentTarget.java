package com.cinematic.core.model;

/**
 * What a safety check stage screens.
 */
public enum ContentTarget {
    /** The scene prompt, before image generation. */
    PROMPT,
    /** The generated image, before it feeds animation. */
    IMAGE_ASSET
}
