package com.cinematic.core.graph;

import com.cinematic.core.exception.BuildException;
import com.cinematic.core.model.CompositionPolicy;
import com.cinematic.core.model.Project;
import com.cinematic.core.model.Scene;
import com.cinematic.core.model.SceneTransition;
import com.cinematic.core.model.SoundEffectSpec;
import com.cinematic.core.model.Stage;
import com.cinematic.core.model.StageKind;
import com.cinematic.core.model.StageState;
import com.cinematic.core.model.TransitionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

class StageGraphBuilderTest {

    private final StageGraphBuilder builder = new StageGraphBuilder();

    @Test
    @DisplayName("N scenes without sound effects build 3N+1 stages")
    void buildsThreeStagesPerScenePlusComposition() {
        for (int n = 1; n <= 5; n++) {
            StageGraph graph = builder.build(project(scenes(n)));

            assertThat(graph.size()).isEqualTo(3 * n + 1);
        }
    }

    @Test
    @DisplayName("Sound effects add exactly one audio mix stage to their scene")
    void soundEffectsAddAudioMix() {
        List<Scene> scenes = scenes(2);
        Scene withSfx = scenes.get(0).withSoundEffects(List.of(
            new SoundEffectSpec("ambient", "rain on a tin roof"),
            new SoundEffectSpec("impact", "distant thunder")));
        StageGraph graph = builder.build(project(List.of(withSfx, scenes.get(1))));

        assertThat(graph.size()).isEqualTo(8);
        assertThat(graph.sceneStages(1)).hasSize(4);
        assertThat(graph.sceneStages(2)).hasSize(3);
        assertThat(graph.node(graph.sceneOutput(1)).kind()).isEqualTo(StageKind.AUDIO_MIX);
        assertThat(graph.node(graph.sceneOutput(2)).kind()).isEqualTo(StageKind.ANIMATE);
    }

    @Test
    @DisplayName("Each scene is a chain starting at its prompt safety check")
    void sceneChainOrder() {
        StageGraph graph = builder.build(project(scenes(1)));

        List<StageKind> kinds = graph.sceneStages(1).stream().map(i -> graph.node(i).kind()).toList();
        assertThat(kinds).containsExactly(StageKind.SAFETY_CHECK, StageKind.IMAGE_GEN, StageKind.ANIMATE);

        int imageGen = graph.indexOf("s1:image-gen");
        assertThat(graph.dependencies(imageGen)).containsExactly(graph.indexOf("s1:prompt-check"));
        assertThat(graph.dependencies(graph.indexOf("s1:prompt-check"))).isEmpty();
    }

    @Test
    @DisplayName("Composition depends on every scene output in scene order")
    void compositionDependsOnAllScenes() {
        StageGraph graph = builder.build(project(scenes(3)));

        StageGraph.StageNode composition = graph.node(graph.compositionIndex());
        assertThat(composition.stageId()).isEqualTo(StageGraphBuilder.COMPOSITION_ID);
        assertThat(composition.sceneNumber()).isNull();
        assertThat(composition.dependencies()).containsExactly(
            graph.sceneOutput(1), graph.sceneOutput(2), graph.sceneOutput(3));
    }

    @Test
    @DisplayName("Screening generated images inserts an asset check before animation")
    void screeningInsertsImageCheck() {
        StageGraph graph = new StageGraphBuilder(true).build(project(scenes(2)));

        assertThat(graph.size()).isEqualTo(9);
        int check = graph.indexOf("s1:image-check");
        assertThat(graph.dependencies(graph.indexOf("s1:animate"))).containsExactly(check);
    }

    @Test
    @DisplayName("Transitions are carried between consecutive scenes")
    void carriesTransitions() {
        List<Scene> scenes = scenes(3);
        Project project = project(List.of(
            scenes.get(0).withTransition(TransitionType.CROSSFADE),
            scenes.get(1).withTransition(TransitionType.CUT),
            scenes.get(2).withTransition(TransitionType.FADE)));

        StageGraph graph = builder.build(project);

        assertThat(graph.transitions()).containsExactly(
            new SceneTransition(1, 2, TransitionType.CROSSFADE),
            new SceneTransition(2, 3, TransitionType.CUT));
    }

    @Test
    @DisplayName("Duplicate scene numbers are rejected")
    void rejectsDuplicateSceneNumbers() {
        Project project = project(List.of(Scene.of(1, "a", 5), Scene.of(1, "b", 5)));

        assertThatThrownBy(() -> builder.build(project))
            .isInstanceOf(BuildException.class)
            .hasMessageContaining("duplicate scene number 1");
    }

    @Test
    @DisplayName("Scene numbers with a gap are rejected")
    void rejectsNonContiguousSceneNumbers() {
        Project project = project(List.of(Scene.of(1, "a", 5), Scene.of(3, "b", 5)));

        assertThatThrownBy(() -> builder.build(project))
            .isInstanceOf(BuildException.class)
            .hasMessageContaining("contiguous");
    }

    @Test
    @DisplayName("Scene numbers must start at 1")
    void rejectsSceneNumbersNotStartingAtOne() {
        Project project = project(List.of(Scene.of(2, "a", 5), Scene.of(3, "b", 5)));

        assertThatThrownBy(() -> builder.build(project)).isInstanceOf(BuildException.class);
    }

    @Test
    @DisplayName("Non-positive durations are rejected")
    void rejectsNonPositiveDuration() {
        Project project = project(List.of(Scene.of(1, "a", 0)));

        BuildException error = catchThrowableOfType(() -> builder.build(project), BuildException.class);
        assertThat(error.getErrors()).anyMatch(e -> e.contains("non-positive duration"));
    }

    @Test
    @DisplayName("Empty projects and unsupported aspect ratios are rejected")
    void rejectsEmptyProjectAndBadAspectRatio() {
        Project empty = project(List.of());
        Project square = Project.create(UUID.randomUUID(), "t", scenes(1), "4:3", CompositionPolicy.REQUIRE_ALL_SCENES);

        assertThatThrownBy(() -> builder.build(empty)).isInstanceOf(BuildException.class);
        assertThatThrownBy(() -> builder.build(square))
            .isInstanceOf(BuildException.class)
            .hasMessageContaining("aspect ratio");
    }

    @Test
    @DisplayName("Materialized stages start pending and round-trip back into the same graph")
    void rebuildsFromStages() {
        Project project = project(scenes(2));
        StageGraph graph = builder.build(project);

        List<Stage> stages = graph.toStages();
        StageGraph rebuilt = StageGraph.fromStages(project.projectId(), stages, graph.transitions());

        assertThat(stages).allMatch(s -> s.state() == StageState.PENDING);
        assertThat(rebuilt.nodes()).isEqualTo(graph.nodes());
        assertThat(rebuilt.compositionIndex()).isEqualTo(graph.compositionIndex());
    }

    @Test
    @DisplayName("A cyclic stage set is rejected")
    void rejectsCycles() {
        UUID id = UUID.randomUUID();
        List<Stage> cyclic = List.of(
            Stage.create(id, "a", 0, StageKind.IMAGE_GEN, 1, null, List.of("b")),
            Stage.create(id, "b", 1, StageKind.ANIMATE, 1, null, List.of("a")),
            Stage.create(id, "composition", 2, StageKind.COMPOSITION, null, null, List.of("b")));

        assertThatThrownBy(() -> StageGraph.fromStages(id, cyclic, List.of()))
            .isInstanceOf(BuildException.class)
            .hasMessageContaining("cycle");
    }

    @Test
    @DisplayName("Downstream traversal reaches composition from any scene stage")
    void downstreamReachesComposition() {
        StageGraph graph = builder.build(project(scenes(2)));

        List<Integer> downstream = graph.downstreamOf(graph.indexOf("s1:prompt-check"));

        assertThat(downstream).contains(graph.indexOf("s1:image-gen"), graph.indexOf("s1:animate"), graph.compositionIndex());
        assertThat(downstream).doesNotContain(graph.indexOf("s2:image-gen"));
    }

    private Project project(List<Scene> scenes) {
        return Project.create("test", scenes);
    }

    private List<Scene> scenes(int n) {
        return IntStream.rangeClosed(1, n)
            .mapToObj(i -> Scene.of(i, "scene " + i + " of a lighthouse at dusk", 5))
            .toList();
    }
}
