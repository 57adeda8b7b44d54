package com.cinematic.worker;

import com.cinematic.core.model.SceneTransition;

import java.util.List;
import java.util.UUID;

/**
 * Input to the final composition of a project.
 *
 * @param clips scene clips in scene order
 * @param transitions transitions between consecutive clips
 */
public record CompositionRequest(
    UUID projectId,
    String title,
    List<ClipAsset> clips,
    List<SceneTransition> transitions,
    String aspectRatio
) {
    public CompositionRequest {
        clips = List.copyOf(clips);
        transitions = List.copyOf(transitions);
    }

    public double totalDurationSeconds() {
        return clips.stream().mapToDouble(ClipAsset::durationSeconds).sum();
    }
}
