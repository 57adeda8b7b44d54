package com.cinematic.engine.progress;

import com.cinematic.core.model.ProjectStatus;

import java.util.List;
import java.util.UUID;

/**
 * Progress snapshot of a project.
 *
 * @param percent weighted share of succeeded stages, 0-100
 * @param finalAssetKey key of the composed video once composition succeeded
 */
public record ProjectProgress(
    UUID projectId,
    String title,
    ProjectStatus status,
    int percent,
    int completedStages,
    int totalStages,
    List<SceneProgress> scenes,
    String finalAssetKey
) {
    public ProjectProgress {
        scenes = List.copyOf(scenes);
    }
}
