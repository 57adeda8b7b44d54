package com.cinematic.core.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * A submitted video project.
 * The scene list is immutable after creation. Status is not stored here;
 * it is derived from the stage states (see {@link ProjectStatus#derive}).
 *
 * Invariants:
 * - scenes are kept ordered by scene number
 * - cancelRequestedAt is set once and never cleared
 */
public record Project(
    UUID projectId,
    String title,
    List<Scene> scenes,
    String aspectRatio,
    CompositionPolicy compositionPolicy,
    Instant cancelRequestedAt,
    String finalAssetKey,
    Instant createdAt,
    Instant updatedAt
) {
    public static final String DEFAULT_ASPECT_RATIO = "16:9";
    public static final Set<String> SUPPORTED_ASPECT_RATIOS = Set.of("16:9", "9:16", "1:1");

    public Project {
        scenes = scenes != null
            ? scenes.stream().sorted(Comparator.comparingInt(Scene::sceneNumber)).toList()
            : List.of();
        aspectRatio = aspectRatio != null && !aspectRatio.isBlank() ? aspectRatio : DEFAULT_ASPECT_RATIO;
        compositionPolicy = compositionPolicy != null ? compositionPolicy : CompositionPolicy.REQUIRE_ALL_SCENES;
    }

    /**
     * Create a new project with a generated id.
     */
    public static Project create(String title, List<Scene> scenes) {
        return create(UUID.randomUUID(), title, scenes, DEFAULT_ASPECT_RATIO, CompositionPolicy.REQUIRE_ALL_SCENES);
    }

    /**
     * Create a new project.
     */
    public static Project create(
            UUID projectId,
            String title,
            List<Scene> scenes,
            String aspectRatio,
            CompositionPolicy compositionPolicy) {
        Instant now = Instant.now();
        return new Project(
            projectId != null ? projectId : UUID.randomUUID(),
            title,
            scenes,
            aspectRatio,
            compositionPolicy,
            null,
            null,
            now,
            now
        );
    }

    public boolean isCancelRequested() {
        return cancelRequestedAt != null;
    }

    public Scene scene(int sceneNumber) {
        return scenes.stream()
            .filter(s -> s.sceneNumber() == sceneNumber)
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("No scene " + sceneNumber + " in project " + projectId));
    }

    public Project withCancelRequested(Instant at) {
        return new Project(projectId, title, scenes, aspectRatio, compositionPolicy,
            cancelRequestedAt != null ? cancelRequestedAt : at, finalAssetKey, createdAt, at);
    }

    public Project withFinalAsset(String assetKey) {
        return new Project(projectId, title, scenes, aspectRatio, compositionPolicy,
            cancelRequestedAt, assetKey, createdAt, Instant.now());
    }

    public Project withUpdatedAt(Instant at) {
        return new Project(projectId, title, scenes, aspectRatio, compositionPolicy,
            cancelRequestedAt, finalAssetKey, createdAt, at);
    }
}
