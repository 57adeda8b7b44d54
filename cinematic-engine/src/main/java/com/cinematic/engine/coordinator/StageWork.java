package com.cinematic.engine.coordinator;

import com.cinematic.core.model.Project;
import com.cinematic.core.model.Scene;
import com.cinematic.core.model.Stage;

import java.util.Map;

/**
 * Everything a worker needs to run one stage, captured when the stage starts.
 *
 * @param scene the owning scene, null for composition
 * @param inputAssetKey output of the stage this one consumes, null for prompt checks and composition
 * @param sceneClips composition only: clip key of every succeeded scene, by scene number in order
 */
public record StageWork(
    Project project,
    Stage stage,
    Scene scene,
    String inputAssetKey,
    Map<Integer, String> sceneClips
) {
    public StageWork {
        sceneClips = sceneClips != null ? sceneClips : Map.of();
    }

    /**
     * 1-based attempt number of this run.
     */
    public int attempt() {
        return stage.retryCount() + 1;
    }
}
