package com.cinematic.engine.progress;

import com.cinematic.core.model.ProjectStatus;
import com.cinematic.core.model.StageState;

import java.util.Map;

/**
 * Progress of one scene.
 *
 * @param status derived from the scene's own stages
 * @param imageAssetKey generated still, once image generation succeeded
 * @param clipAssetKey clip fed to composition, once the scene's last stage succeeded
 * @param stages state of each stage of the scene, in chain order
 */
public record SceneProgress(
    int sceneNumber,
    ProjectStatus status,
    int percent,
    String imageAssetKey,
    String clipAssetKey,
    Map<String, StageState> stages
) {
}
