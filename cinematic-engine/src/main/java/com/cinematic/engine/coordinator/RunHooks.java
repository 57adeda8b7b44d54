package com.cinematic.engine.coordinator;

import com.cinematic.core.model.Project;
import com.cinematic.core.model.ProjectStatus;
import com.cinematic.core.model.StageKind;
import com.cinematic.engine.dispatch.StageTicket;

import java.time.Duration;
import java.util.UUID;

/**
 * Side effects a {@link ProjectRun} triggers after committing a transition.
 */
interface RunHooks {

    void enqueue(StageTicket ticket);

    void scheduleRetry(UUID projectId, String stageId, Duration delay);

    void retryScheduled(StageKind kind);

    void cancelTimers(UUID projectId);

    void statusChanged(Project project, ProjectStatus from, ProjectStatus to);
}
