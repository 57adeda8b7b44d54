package com.cinematic.api.rest;

import com.cinematic.core.model.FailureClass;
import com.cinematic.core.model.Project;
import com.cinematic.core.model.ProjectStatus;
import com.cinematic.core.model.Scene;
import com.cinematic.core.model.SoundEffectSpec;
import com.cinematic.core.model.Stage;
import com.cinematic.core.model.StageKind;
import com.cinematic.core.model.StageState;
import com.cinematic.core.model.StylePreset;
import com.cinematic.core.model.TransitionType;
import com.cinematic.engine.progress.ProjectProgress;
import com.cinematic.engine.service.PipelineService;
import com.cinematic.engine.service.PipelineService.ProjectHandle;
import com.cinematic.engine.service.PipelineService.SubmitProjectRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for video projects.
 */
@RestController
@RequestMapping("/api/v1/projects")
public class ProjectController {

    private final PipelineService pipelineService;

    public ProjectController(PipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    /**
     * Submit a project. Work starts asynchronously.
     */
    @PostMapping
    public ResponseEntity<ProjectHandle> submit(@RequestBody SubmitProjectDto request) {
        ProjectHandle handle = pipelineService.submit(request.toRequest());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(handle);
    }

    @GetMapping("/{projectId}")
    public ResponseEntity<ProjectResponse> getProject(@PathVariable UUID projectId) {
        Project project = pipelineService.getProject(projectId);
        ProjectProgress progress = pipelineService.progress(projectId);
        return ResponseEntity.ok(ProjectResponse.from(project, progress.status()));
    }

    @GetMapping("/{projectId}/progress")
    public ResponseEntity<ProjectProgress> getProgress(@PathVariable UUID projectId) {
        return ResponseEntity.ok(pipelineService.progress(projectId));
    }

    @GetMapping("/{projectId}/stages")
    public ResponseEntity<List<StageResponse>> getStages(@PathVariable UUID projectId) {
        List<StageResponse> stages = pipelineService.getStages(projectId).stream()
            .map(StageResponse::from)
            .toList();
        return ResponseEntity.ok(stages);
    }

    /**
     * Cancel a project. Repeating the call is harmless.
     */
    @PostMapping("/{projectId}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable UUID projectId) {
        boolean cancelled = pipelineService.cancel(projectId);
        return ResponseEntity.ok(Map.of(
            "cancelled", cancelled,
            "status", pipelineService.progress(projectId).status()
        ));
    }

    /**
     * Retry the retryable failed stages of a failed project.
     */
    @PostMapping("/{projectId}/retry")
    public ResponseEntity<Map<String, Object>> retry(@PathVariable UUID projectId) {
        int reset = pipelineService.retry(projectId);
        return ResponseEntity.ok(Map.of(
            "stagesReset", reset,
            "status", pipelineService.progress(projectId).status()
        ));
    }

    @DeleteMapping("/{projectId}")
    public ResponseEntity<Void> delete(@PathVariable UUID projectId) {
        pipelineService.delete(projectId);
        return ResponseEntity.noContent().build();
    }

    // ========== DTOs ==========

    public record SubmitProjectDto(
        UUID projectId,
        String title,
        List<SceneDto> scenes,
        String aspectRatio
    ) {
        SubmitProjectRequest toRequest() {
            List<Scene> converted = new ArrayList<>();
            if (scenes != null) {
                for (int i = 0; i < scenes.size(); i++) {
                    converted.add(scenes.get(i).toScene(i + 1));
                }
            }
            return new SubmitProjectRequest(projectId, title, converted, aspectRatio);
        }
    }

    /**
     * @param sceneNumber defaults to the position in the list, from 1
     */
    public record SceneDto(
        Integer sceneNumber,
        String prompt,
        Double durationSeconds,
        StylePreset style,
        List<SoundEffectSpec> soundEffects,
        TransitionType transitionToNext
    ) {
        Scene toScene(int position) {
            return new Scene(
                sceneNumber != null ? sceneNumber : position,
                prompt,
                durationSeconds != null ? durationSeconds : 0.0,
                style,
                soundEffects,
                transitionToNext
            );
        }
    }

    public record ProjectResponse(
        UUID projectId,
        String title,
        ProjectStatus status,
        String aspectRatio,
        List<Scene> scenes,
        String finalAssetKey,
        Instant cancelRequestedAt,
        Instant createdAt,
        Instant updatedAt
    ) {
        public static ProjectResponse from(Project project, ProjectStatus status) {
            return new ProjectResponse(
                project.projectId(),
                project.title(),
                status,
                project.aspectRatio(),
                project.scenes(),
                project.finalAssetKey(),
                project.cancelRequestedAt(),
                project.createdAt(),
                project.updatedAt()
            );
        }
    }

    public record StageResponse(
        String stageId,
        StageKind kind,
        Integer sceneNumber,
        StageState state,
        List<String> dependsOn,
        int retryCount,
        FailureClass failureClass,
        String errorCode,
        String lastError,
        String outputAssetKey,
        Instant retryAt,
        Instant startedAt,
        Instant completedAt
    ) {
        public static StageResponse from(Stage stage) {
            return new StageResponse(
                stage.stageId(),
                stage.kind(),
                stage.sceneNumber(),
                stage.state(),
                stage.dependsOn(),
                stage.retryCount(),
                stage.failureClass(),
                stage.errorCode(),
                stage.lastError(),
                stage.outputAssetKey(),
                stage.retryAt(),
                stage.startedAt(),
                stage.completedAt()
            );
        }
    }
}
