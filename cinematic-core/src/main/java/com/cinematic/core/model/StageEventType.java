package com.cinematic.core.model;

/**
 * Types of state-change events published per project.
 */
public enum StageEventType {
    // Project lifecycle
    PROJECT_SUBMITTED,
    PROJECT_COMPLETED,
    PROJECT_FAILED,
    PROJECT_CANCELLED,
    PROJECT_RETRIED,
    PROJECT_RECOVERED,

    // Stage lifecycle
    STAGE_READY,
    STAGE_STARTED,
    STAGE_SUCCEEDED,
    STAGE_FAILED,
    STAGE_RETRY_SCHEDULED,
    STAGE_CANCELLED,
    STAGE_RESET,
    STAGE_RESULT_DISCARDED;

    public boolean isProjectEvent() {
        return name().startsWith("PROJECT_");
    }
}
