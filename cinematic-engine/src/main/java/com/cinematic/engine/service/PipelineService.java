package com.cinematic.engine.service;

import com.cinematic.core.model.Project;
import com.cinematic.core.model.ProjectStatus;
import com.cinematic.core.model.Scene;
import com.cinematic.core.model.Stage;
import com.cinematic.core.model.StageEvent;
import com.cinematic.engine.events.EventSubscription;
import com.cinematic.engine.events.StageEventListener;
import com.cinematic.engine.progress.ProjectProgress;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Operations exposed to the API layer.
 */
public interface PipelineService {

    /**
     * Build the stage graph of a project, persist it and start scheduling.
     * Resubmitting an existing project id returns the existing handle.
     *
     * @param request The submission
     * @return Handle of the accepted project
     * @throws com.cinematic.core.exception.BuildException if the project is malformed
     * @throws com.cinematic.core.exception.PersistenceUnavailableException if the store is unreachable
     */
    ProjectHandle submit(SubmitProjectRequest request);

    /**
     * Cancel every non-terminal stage of a project. Idempotent.
     *
     * @param projectId The project ID
     * @return true if this call recorded the cancellation
     */
    boolean cancel(UUID projectId);

    /**
     * Reset the retryable failed stages of a failed project and resume scheduling.
     *
     * @param projectId The project ID
     * @return Number of stages reset
     * @throws com.cinematic.core.exception.InvalidStateException if the project is not Failed
     */
    int retry(UUID projectId);

    /**
     * Current progress snapshot.
     *
     * @param projectId The project ID
     * @return Weighted percent, per-scene breakdown and status
     */
    ProjectProgress progress(UUID projectId);

    /**
     * Get a project by ID.
     *
     * @param projectId The project ID
     * @return The project
     */
    Project getProject(UUID projectId);

    /**
     * Get the stages of a project in graph order.
     *
     * @param projectId The project ID
     * @return The stages
     */
    List<Stage> getStages(UUID projectId);

    /**
     * Poll state-change events.
     *
     * @param projectId The project ID
     * @param afterSequence Exclusive lower bound on the sequence number
     * @return Events in sequence order
     */
    List<StageEvent> events(UUID projectId, long afterSequence);

    /**
     * Receive state-change events of a project as they are recorded.
     *
     * @param projectId The project ID
     * @param listener Called once per event, in sequence order
     * @return Subscription to close when done
     */
    EventSubscription subscribe(UUID projectId, StageEventListener listener);

    /**
     * Delete a project with its stages and events.
     *
     * @param projectId The project ID
     * @throws com.cinematic.core.exception.InvalidStateException if the project is not terminal
     */
    void delete(UUID projectId);

    /**
     * Request to submit a project.
     *
     * @param projectId optional client-chosen id; makes submission idempotent
     * @param aspectRatio optional; the configured default applies when null
     */
    record SubmitProjectRequest(
        UUID projectId,
        String title,
        List<Scene> scenes,
        String aspectRatio
    ) {}

    /**
     * Result of a submission.
     */
    record ProjectHandle(
        UUID projectId,
        ProjectStatus status,
        int stageCount,
        Instant submittedAt
    ) {}
}
