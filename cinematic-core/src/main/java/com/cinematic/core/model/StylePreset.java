package com.cinematic.core.model;

/**
 * Visual style applied to a scene's image prompt.
 * Each preset appends a quality booster to the prompt before it reaches the image capability.
 */
public enum StylePreset {
    NONE(""),
    CINEMATIC(", stunning quality, highly detailed, 8k resolution, sharp focus, professional image, cinematic lighting"),
    PHOTOREALISTIC(", photorealistic, natural lighting, 35mm photograph, highly detailed, sharp focus"),
    ANIME(", anime style, vibrant colors, clean line art, detailed background"),
    WATERCOLOR(", watercolor painting, soft washes, textured paper, delicate brush strokes"),
    NOIR(", film noir, black and white, high contrast, dramatic shadows, moody atmosphere");

    private final String promptSuffix;

    StylePreset(String promptSuffix) {
        this.promptSuffix = promptSuffix;
    }

    public String promptSuffix() {
        return promptSuffix;
    }

    /**
     * Append this preset's booster to a prompt.
     */
    public String decorate(String prompt) {
        if (promptSuffix.isEmpty()) {
            return prompt;
        }
        return prompt.strip() + promptSuffix;
    }

    /**
     * Lenient lookup used when binding external input. Unknown or blank names map to NONE.
     */
    public static StylePreset fromName(String name) {
        if (name == null || name.isBlank()) {
            return NONE;
        }
        for (StylePreset preset : values()) {
            if (preset.name().equalsIgnoreCase(name.strip())) {
                return preset;
            }
        }
        return NONE;
    }
}
