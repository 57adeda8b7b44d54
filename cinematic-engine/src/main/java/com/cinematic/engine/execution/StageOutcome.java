package com.cinematic.engine.execution;

import com.cinematic.core.model.FailureClass;

/**
 * Result of one stage execution.
 *
 * @param assetKey output on success; null for prompt checks
 */
public record StageOutcome(
    boolean succeeded,
    String assetKey,
    FailureClass failureClass,
    String errorCode,
    String message
) {
    public static StageOutcome success(String assetKey) {
        return new StageOutcome(true, assetKey, null, null, null);
    }

    public static StageOutcome failure(FailureClass failureClass, String errorCode, String message) {
        return new StageOutcome(false, null, failureClass, errorCode, message);
    }
}
