package com.cinematic.core.graph;

import com.cinematic.core.exception.BuildException;
import com.cinematic.core.model.ContentTarget;
import com.cinematic.core.model.SceneTransition;
import com.cinematic.core.model.Stage;
import com.cinematic.core.model.StageKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * The DAG of stages for one project.
 *
 * Stages live in an arena indexed by position; edges are index lists in both
 * directions, so cascades are plain graph traversals. The graph is immutable
 * and checked for cycles on construction. Mutable stage state is kept by the
 * scheduler, not here.
 */
public final class StageGraph {

    /**
     * One stage slot in the arena.
     *
     * @param dependencies indices of the stages that must succeed first
     */
    public record StageNode(
        int index,
        String stageId,
        StageKind kind,
        Integer sceneNumber,
        ContentTarget checkTarget,
        List<Integer> dependencies
    ) {
        public StageNode {
            dependencies = List.copyOf(dependencies);
        }
    }

    private final UUID projectId;
    private final List<StageNode> nodes;
    private final List<List<Integer>> dependents;
    private final Map<String, Integer> indexById;
    private final Map<Integer, Integer> sceneOutputs;
    private final int compositionIndex;
    private final List<SceneTransition> transitions;

    StageGraph(UUID projectId, List<StageNode> nodes, List<SceneTransition> transitions) {
        this.projectId = projectId;
        this.nodes = List.copyOf(nodes);
        this.transitions = List.copyOf(transitions);

        Map<String, Integer> ids = new HashMap<>();
        List<List<Integer>> reverse = new ArrayList<>();
        for (StageNode node : this.nodes) {
            if (ids.put(node.stageId(), node.index()) != null) {
                throw new BuildException("Duplicate stage id: " + node.stageId());
            }
            reverse.add(new ArrayList<>());
        }
        for (StageNode node : this.nodes) {
            for (int dep : node.dependencies()) {
                if (dep < 0 || dep >= this.nodes.size()) {
                    throw new BuildException("Stage " + node.stageId() + " depends on unknown index " + dep);
                }
                reverse.get(dep).add(node.index());
            }
        }
        this.indexById = Map.copyOf(ids);
        this.dependents = reverse.stream().map(List::copyOf).toList();

        int composition = -1;
        for (StageNode node : this.nodes) {
            if (node.kind() == StageKind.COMPOSITION) {
                composition = node.index();
            }
        }
        if (composition < 0) {
            throw new BuildException("Stage graph has no composition stage");
        }
        this.compositionIndex = composition;

        // Scene outputs are exactly the composition's inputs, in scene order
        Map<Integer, Integer> outputs = new LinkedHashMap<>();
        this.nodes.get(composition).dependencies().stream()
            .sorted((a, b) -> Integer.compare(
                this.nodes.get(a).sceneNumber(), this.nodes.get(b).sceneNumber()))
            .forEach(i -> outputs.put(this.nodes.get(i).sceneNumber(), i));
        this.sceneOutputs = Collections.unmodifiableMap(outputs);

        checkAcyclic();
    }

    /**
     * Rebuild a graph from persisted stages.
     */
    public static StageGraph fromStages(UUID projectId, List<Stage> stages, List<SceneTransition> transitions) {
        List<Stage> ordered = stages.stream()
            .sorted((a, b) -> Integer.compare(a.index(), b.index()))
            .toList();
        Map<String, Integer> ids = new HashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            if (ordered.get(i).index() != i) {
                throw new BuildException("Stage indices are not contiguous for project " + projectId);
            }
            ids.put(ordered.get(i).stageId(), i);
        }
        List<StageNode> nodes = new ArrayList<>();
        for (Stage stage : ordered) {
            List<Integer> deps = new ArrayList<>();
            for (String dep : stage.dependsOn()) {
                Integer idx = ids.get(dep);
                if (idx == null) {
                    throw new BuildException("Stage " + stage.stageId() + " depends on unknown stage " + dep);
                }
                deps.add(idx);
            }
            nodes.add(new StageNode(stage.index(), stage.stageId(), stage.kind(),
                stage.sceneNumber(), stage.checkTarget(), deps));
        }
        return new StageGraph(projectId, nodes, transitions);
    }

    /**
     * Materialize the graph as PENDING stages.
     */
    public List<Stage> toStages() {
        return nodes.stream()
            .map(n -> Stage.create(
                projectId,
                n.stageId(),
                n.index(),
                n.kind(),
                n.sceneNumber(),
                n.checkTarget(),
                n.dependencies().stream().map(d -> nodes.get(d).stageId()).toList()))
            .toList();
    }

    public UUID projectId() {
        return projectId;
    }

    public int size() {
        return nodes.size();
    }

    public StageNode node(int index) {
        return nodes.get(index);
    }

    public List<StageNode> nodes() {
        return nodes;
    }

    public int indexOf(String stageId) {
        Integer index = indexById.get(stageId);
        if (index == null) {
            throw new IllegalArgumentException("Unknown stage " + stageId + " in project " + projectId);
        }
        return index;
    }

    public List<Integer> dependencies(int index) {
        return nodes.get(index).dependencies();
    }

    public List<Integer> dependents(int index) {
        return dependents.get(index);
    }

    /**
     * Index of the stage whose output feeds composition for each scene, keyed by scene number in order.
     */
    public Map<Integer, Integer> sceneOutputs() {
        return sceneOutputs;
    }

    public int sceneOutput(int sceneNumber) {
        Integer index = sceneOutputs.get(sceneNumber);
        if (index == null) {
            throw new IllegalArgumentException("No scene " + sceneNumber + " in project " + projectId);
        }
        return index;
    }

    public int compositionIndex() {
        return compositionIndex;
    }

    public List<SceneTransition> transitions() {
        return transitions;
    }

    /**
     * Indices of every stage owned by a scene, in chain order.
     */
    public List<Integer> sceneStages(int sceneNumber) {
        return nodes.stream()
            .filter(n -> n.sceneNumber() != null && n.sceneNumber() == sceneNumber)
            .map(StageNode::index)
            .toList();
    }

    /**
     * All stages reachable from {@code start} along dependent edges, excluding {@code start}.
     */
    public List<Integer> downstreamOf(int start) {
        boolean[] seen = new boolean[nodes.size()];
        List<Integer> result = new ArrayList<>();
        Deque<Integer> queue = new ArrayDeque<>(dependents.get(start));
        while (!queue.isEmpty()) {
            int current = queue.poll();
            if (seen[current]) {
                continue;
            }
            seen[current] = true;
            result.add(current);
            queue.addAll(dependents.get(current));
        }
        return result;
    }

    // Kahn's algorithm; every node must be emitted
    private void checkAcyclic() {
        int[] inDegree = new int[nodes.size()];
        for (StageNode node : nodes) {
            inDegree[node.index()] = node.dependencies().size();
        }
        Deque<Integer> ready = new ArrayDeque<>();
        for (int i = 0; i < inDegree.length; i++) {
            if (inDegree[i] == 0) {
                ready.add(i);
            }
        }
        int emitted = 0;
        while (!ready.isEmpty()) {
            int current = ready.poll();
            emitted++;
            for (int dependent : dependents.get(current)) {
                if (--inDegree[dependent] == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (emitted != nodes.size()) {
            throw new BuildException("Stage graph for project " + projectId + " contains a cycle");
        }
    }
}
