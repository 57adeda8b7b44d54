package com.cinematic.core.graph;

import com.cinematic.core.exception.BuildException;
import com.cinematic.core.graph.StageGraph.StageNode;
import com.cinematic.core.model.ContentTarget;
import com.cinematic.core.model.Project;
import com.cinematic.core.model.Scene;
import com.cinematic.core.model.SceneTransition;
import com.cinematic.core.model.StageKind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a project into its stage graph.
 *
 * Per scene, in scene-number order:
 * <pre>
 * prompt-check -> image-gen [-> image-check] -> animate [-> audio-mix]
 * </pre>
 * The bracketed stages are optional: image-check only when generated images are
 * screened, audio-mix only when the scene has sound effects. A single composition
 * stage depends on the last stage of every scene.
 */
public class StageGraphBuilder {

    public static final String COMPOSITION_ID = "composition";

    private final boolean screenGeneratedImages;

    public StageGraphBuilder() {
        this(false);
    }

    public StageGraphBuilder(boolean screenGeneratedImages) {
        this.screenGeneratedImages = screenGeneratedImages;
    }

    /**
     * Build the stage graph for a project.
     *
     * @throws BuildException if the project is malformed
     */
    public StageGraph build(Project project) {
        validate(project);

        List<StageNode> nodes = new ArrayList<>();
        List<Integer> sceneOutputs = new ArrayList<>();

        for (Scene scene : project.scenes()) {
            int n = scene.sceneNumber();
            int last = add(nodes, stageId(n, "prompt-check"), StageKind.SAFETY_CHECK, n, ContentTarget.PROMPT, List.of());
            last = add(nodes, stageId(n, StageKind.IMAGE_GEN.slug()), StageKind.IMAGE_GEN, n, null, List.of(last));
            if (screenGeneratedImages) {
                last = add(nodes, stageId(n, "image-check"), StageKind.SAFETY_CHECK, n, ContentTarget.IMAGE_ASSET, List.of(last));
            }
            last = add(nodes, stageId(n, StageKind.ANIMATE.slug()), StageKind.ANIMATE, n, null, List.of(last));
            if (scene.hasSoundEffects()) {
                last = add(nodes, stageId(n, StageKind.AUDIO_MIX.slug()), StageKind.AUDIO_MIX, n, null, List.of(last));
            }
            sceneOutputs.add(last);
        }
        add(nodes, COMPOSITION_ID, StageKind.COMPOSITION, null, null, sceneOutputs);

        return new StageGraph(project.projectId(), nodes, transitions(project));
    }

    /**
     * Transitions between each pair of consecutive scenes.
     */
    public static List<SceneTransition> transitions(Project project) {
        List<Scene> scenes = project.scenes();
        List<SceneTransition> result = new ArrayList<>();
        for (int i = 0; i + 1 < scenes.size(); i++) {
            Scene from = scenes.get(i);
            result.add(new SceneTransition(from.sceneNumber(), scenes.get(i + 1).sceneNumber(), from.transitionToNext()));
        }
        return result;
    }

    public static String stageId(int sceneNumber, String step) {
        return "s" + sceneNumber + ":" + step;
    }

    // ========== Internal Methods ==========

    private int add(List<StageNode> nodes, String id, StageKind kind, Integer scene,
                    ContentTarget target, List<Integer> deps) {
        int index = nodes.size();
        nodes.add(new StageNode(index, id, kind, scene, target, deps));
        return index;
    }

    private void validate(Project project) {
        List<String> errors = new ArrayList<>();
        List<Scene> scenes = project.scenes();

        if (scenes.isEmpty()) {
            errors.add("project has no scenes");
        }
        if (!Project.SUPPORTED_ASPECT_RATIOS.contains(project.aspectRatio())) {
            errors.add("unsupported aspect ratio " + project.aspectRatio()
                + " (expected one of " + Project.SUPPORTED_ASPECT_RATIOS + ")");
        }

        Set<Integer> seen = new HashSet<>();
        for (Scene scene : scenes) {
            if (!seen.add(scene.sceneNumber())) {
                errors.add("duplicate scene number " + scene.sceneNumber());
            }
            if (!(scene.durationSeconds() > 0) || Double.isInfinite(scene.durationSeconds())) {
                errors.add("scene " + scene.sceneNumber() + " has non-positive duration " + scene.durationSeconds());
            }
            if (scene.prompt() == null || scene.prompt().isBlank()) {
                errors.add("scene " + scene.sceneNumber() + " has an empty prompt");
            }
        }
        for (int expected = 1; expected <= seen.size(); expected++) {
            if (!seen.contains(expected)) {
                errors.add("scene numbers must be contiguous from 1; missing " + expected);
                break;
            }
        }

        if (!errors.isEmpty()) {
            throw new BuildException(errors);
        }
    }
}
