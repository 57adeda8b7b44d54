package com.cinematic.engine.progress;

import com.cinematic.core.graph.StageGraph;
import com.cinematic.core.model.Project;
import com.cinematic.core.model.ProjectStatus;
import com.cinematic.core.model.Scene;
import com.cinematic.core.model.Stage;
import com.cinematic.core.model.StageKind;
import com.cinematic.core.model.StageState;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes weighted progress from stage states.
 *
 * Each stage counts with the weight of its kind; the percentage is the
 * succeeded weight over the total weight, rounded down. Keeping the reported
 * value from going backwards is the caller's job.
 */
public class ProgressAggregator {

    /**
     * Weighted percentage of succeeded stages, rounded down.
     */
    public int weightedPercent(Collection<Stage> stages) {
        long total = 0;
        long done = 0;
        for (Stage stage : stages) {
            int weight = stage.kind().weight();
            total += weight;
            if (stage.state() == StageState.SUCCEEDED) {
                done += weight;
            }
        }
        if (total == 0) {
            return 0;
        }
        return (int) (done * 100 / total);
    }

    /**
     * Build a full snapshot.
     *
     * @param stages stages indexed by graph position
     * @param status the project status to report
     * @param percent the project percentage to report
     */
    public ProjectProgress aggregate(
            Project project,
            StageGraph graph,
            List<Stage> stages,
            ProjectStatus status,
            int percent) {
        List<SceneProgress> scenes = new ArrayList<>();
        for (Scene scene : project.scenes()) {
            scenes.add(sceneProgress(project, graph, stages, scene.sceneNumber()));
        }
        int completed = (int) stages.stream().filter(s -> s.state() == StageState.SUCCEEDED).count();
        return new ProjectProgress(
            project.projectId(),
            project.title(),
            status,
            percent,
            completed,
            stages.size(),
            scenes,
            project.finalAssetKey()
        );
    }

    // ========== Internal Methods ==========

    private SceneProgress sceneProgress(Project project, StageGraph graph, List<Stage> stages, int sceneNumber) {
        List<Stage> sceneStages = graph.sceneStages(sceneNumber).stream().map(stages::get).toList();

        Map<String, StageState> states = new LinkedHashMap<>();
        String imageKey = null;
        for (Stage stage : sceneStages) {
            states.put(stage.stageId(), stage.state());
            if (stage.kind() == StageKind.IMAGE_GEN) {
                imageKey = stage.outputAssetKey();
            }
        }
        Stage output = stages.get(graph.sceneOutput(sceneNumber));

        return new SceneProgress(
            sceneNumber,
            ProjectStatus.derive(sceneStages, project.isCancelRequested()),
            weightedPercent(sceneStages),
            imageKey,
            output.outputAssetKey(),
            states
        );
    }
}
