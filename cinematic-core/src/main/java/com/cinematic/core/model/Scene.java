package com.cinematic.core.model;

import java.util.List;

/**
 * One scene of a project. Immutable once the project is submitted.
 *
 * @param sceneNumber unique within the project, defines order (1-based, contiguous)
 * @param prompt text description handed to image generation
 * @param durationSeconds clip length, must be positive
 * @param stylePreset visual style appended to the prompt
 * @param soundEffects effects to mix in; an empty list means no audio stage
 * @param transitionToNext how this scene hands over to the next one
 */
public record Scene(
    int sceneNumber,
    String prompt,
    double durationSeconds,
    StylePreset stylePreset,
    List<SoundEffectSpec> soundEffects,
    TransitionType transitionToNext
) {
    public Scene {
        stylePreset = stylePreset != null ? stylePreset : StylePreset.NONE;
        soundEffects = soundEffects != null ? List.copyOf(soundEffects) : List.of();
        transitionToNext = transitionToNext != null ? transitionToNext : TransitionType.NONE;
    }

    public static Scene of(int sceneNumber, String prompt, double durationSeconds) {
        return new Scene(sceneNumber, prompt, durationSeconds, StylePreset.NONE, List.of(), TransitionType.NONE);
    }

    public boolean hasSoundEffects() {
        return !soundEffects.isEmpty();
    }

    /**
     * Prompt with the style preset's booster applied.
     */
    public String styledPrompt() {
        return stylePreset.decorate(prompt);
    }

    public Scene withSoundEffects(List<SoundEffectSpec> effects) {
        return new Scene(sceneNumber, prompt, durationSeconds, stylePreset, effects, transitionToNext);
    }

    public Scene withTransition(TransitionType transition) {
        return new Scene(sceneNumber, prompt, durationSeconds, stylePreset, soundEffects, transition);
    }

    public Scene withStyle(StylePreset preset) {
        return new Scene(sceneNumber, prompt, durationSeconds, preset, soundEffects, transitionToNext);
    }
}
