package com.cinematic.core.model;

import java.util.Collection;

/**
 * Roll-up status of a project, derived from its stages.
 */
public enum ProjectStatus {
    /** No stage has started. */
    QUEUED,
    /** At least one stage started and work remains. */
    RUNNING,
    /** Every stage succeeded. */
    COMPLETED,
    /** No work remains and some stage failed beyond its retry budget. */
    FAILED,
    /** Cancellation was recorded. */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Derive the status from a project's stages.
     *
     * @param stages every stage of the project
     * @param cancelRequested whether cancellation has been recorded for the project
     */
    public static ProjectStatus derive(Collection<Stage> stages, boolean cancelRequested) {
        if (cancelRequested) {
            return CANCELLED;
        }
        if (!stages.isEmpty() && stages.stream().allMatch(s -> s.state() == StageState.SUCCEEDED)) {
            return COMPLETED;
        }

        boolean started = stages.stream().anyMatch(s ->
            s.state() == StageState.RUNNING
                || s.state() == StageState.SUCCEEDED
                || s.state() == StageState.FAILED);

        if (stages.stream().anyMatch(Stage::isActive)) {
            return started ? RUNNING : QUEUED;
        }
        if (stages.stream().anyMatch(Stage::isFinallyFailed)) {
            return FAILED;
        }
        if (stages.stream().anyMatch(s -> s.state() == StageState.PENDING)) {
            return started ? RUNNING : QUEUED;
        }
        return CANCELLED;
    }
}
