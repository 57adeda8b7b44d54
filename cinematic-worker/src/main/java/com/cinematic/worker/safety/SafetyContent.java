package com.cinematic.worker.safety;

import com.cinematic.core.model.ContentTarget;

/**
 * Content submitted to the safety gate: either prompt text or a stored asset.
 */
public record SafetyContent(ContentTarget target, int sceneNumber, String text, String assetKey) {

    public static SafetyContent prompt(int sceneNumber, String prompt) {
        return new SafetyContent(ContentTarget.PROMPT, sceneNumber, prompt, null);
    }

    public static SafetyContent asset(int sceneNumber, String assetKey) {
        return new SafetyContent(ContentTarget.IMAGE_ASSET, sceneNumber, null, assetKey);
    }
}
