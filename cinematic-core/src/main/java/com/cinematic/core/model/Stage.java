package com.cinematic.core.model;

import com.cinematic.core.exception.InvalidStateException;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * The unit of scheduling: one capability invocation within a project.
 *
 * Primary Key: (projectId, stageId)
 *
 * Invariants:
 * - state changes only through the with* methods, which enforce {@link StageState#canTransitionTo}
 * - outputAssetKey set only while SUCCEEDED (prompt checks produce none)
 * - retryAt set only while FAILED with an automatic retry scheduled
 * - sceneNumber is null only for COMPOSITION
 */
public record Stage(
    UUID projectId,
    String stageId,
    int index,

    // Shape
    StageKind kind,
    Integer sceneNumber,
    ContentTarget checkTarget,
    ResourceClass resourceClass,
    List<String> dependsOn,

    // State
    StageState state,
    int retryCount,
    FailureClass failureClass,
    String errorCode,
    String lastError,
    String outputAssetKey,
    Instant retryAt,

    // Timing
    Instant updatedAt,
    Instant startedAt,
    Instant completedAt
) {
    public Stage {
        dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
    }

    /**
     * Create a stage in PENDING state.
     */
    public static Stage create(
            UUID projectId,
            String stageId,
            int index,
            StageKind kind,
            Integer sceneNumber,
            ContentTarget checkTarget,
            List<String> dependsOn) {
        return new Stage(
            projectId, stageId, index,
            kind, sceneNumber, checkTarget, kind.resourceClass(), dependsOn,
            StageState.PENDING, 0, null, null, null, null, null,
            Instant.now(), null, null
        );
    }

    public boolean isAwaitingRetry() {
        return state == StageState.FAILED && retryAt != null;
    }

    /**
     * True while the stage still holds or expects scheduler work.
     */
    public boolean isActive() {
        return state == StageState.READY || state == StageState.RUNNING || isAwaitingRetry();
    }

    /**
     * Failed with no automatic retry pending.
     */
    public boolean isFinallyFailed() {
        return state == StageState.FAILED && retryAt == null;
    }

    public Stage withReady() {
        checkTransition(StageState.READY);
        return new Stage(
            projectId, stageId, index, kind, sceneNumber, checkTarget, resourceClass, dependsOn,
            StageState.READY, retryCount, null, errorCode, lastError, null, null,
            Instant.now(), null, null
        );
    }

    public Stage withRunning() {
        checkTransition(StageState.RUNNING);
        Instant now = Instant.now();
        return new Stage(
            projectId, stageId, index, kind, sceneNumber, checkTarget, resourceClass, dependsOn,
            StageState.RUNNING, retryCount, null, errorCode, lastError, null, null,
            now, now, null
        );
    }

    public Stage withSucceeded(String assetKey) {
        checkTransition(StageState.SUCCEEDED);
        Instant now = Instant.now();
        return new Stage(
            projectId, stageId, index, kind, sceneNumber, checkTarget, resourceClass, dependsOn,
            StageState.SUCCEEDED, retryCount, null, null, null, assetKey, null,
            now, startedAt, now
        );
    }

    public Stage withFailed(FailureClass failure, String code, String message) {
        checkTransition(StageState.FAILED);
        Instant now = Instant.now();
        return new Stage(
            projectId, stageId, index, kind, sceneNumber, checkTarget, resourceClass, dependsOn,
            StageState.FAILED, retryCount, failure, code, message, null, null,
            now, startedAt, now
        );
    }

    /**
     * Mark a failed stage as awaiting an automatic retry. Counts one retry.
     */
    public Stage withRetryScheduled(Instant at) {
        if (state != StageState.FAILED) {
            throw new InvalidStateException("Stage " + stageId, state.name(), "RETRY_SCHEDULED");
        }
        return new Stage(
            projectId, stageId, index, kind, sceneNumber, checkTarget, resourceClass, dependsOn,
            StageState.FAILED, retryCount + 1, failureClass, errorCode, lastError, null, at,
            Instant.now(), startedAt, completedAt
        );
    }

    /**
     * Manual retry of a failed stage: back to READY with a fresh retry budget.
     */
    public Stage withRetryReset() {
        checkTransition(StageState.READY);
        return new Stage(
            projectId, stageId, index, kind, sceneNumber, checkTarget, resourceClass, dependsOn,
            StageState.READY, 0, null, errorCode, lastError, null, null,
            Instant.now(), null, null
        );
    }

    public Stage withCancelled() {
        checkTransition(StageState.CANCELLED);
        return new Stage(
            projectId, stageId, index, kind, sceneNumber, checkTarget, resourceClass, dependsOn,
            StageState.CANCELLED, retryCount, failureClass, errorCode, lastError, null, null,
            Instant.now(), startedAt, Instant.now()
        );
    }

    /**
     * A cancelled stage re-derived by a manual retry.
     */
    public Stage withPending() {
        checkTransition(StageState.PENDING);
        return new Stage(
            projectId, stageId, index, kind, sceneNumber, checkTarget, resourceClass, dependsOn,
            StageState.PENDING, 0, null, null, null, null, null,
            Instant.now(), null, null
        );
    }

    /**
     * Reset a succeeded composition so it runs again over the scenes available after a retry.
     */
    public Stage withRecomposition() {
        if (kind != StageKind.COMPOSITION || state != StageState.SUCCEEDED) {
            throw new InvalidStateException("Stage " + stageId, state.name(), "PENDING");
        }
        return new Stage(
            projectId, stageId, index, kind, sceneNumber, checkTarget, resourceClass, dependsOn,
            StageState.PENDING, 0, null, null, null, null, null,
            Instant.now(), null, null
        );
    }

    private void checkTransition(StageState target) {
        if (!state.canTransitionTo(target)) {
            throw new InvalidStateException("Stage " + stageId, state.name(), target.name());
        }
    }
}
