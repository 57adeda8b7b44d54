package com.cinematic.worker.safety;

import com.cinematic.worker.CapabilityException;

/**
 * Moderation checkpoint applied to prompts and, optionally, to generated images.
 * A rejection is a policy decision; an exception means the gate itself could not decide.
 */
@FunctionalInterface
public interface SafetyGate {

    SafetyVerdict evaluate(SafetyContent content) throws CapabilityException;
}
