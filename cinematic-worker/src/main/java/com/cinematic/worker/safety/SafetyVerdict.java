package com.cinematic.worker.safety;

/**
 * Moderation outcome. A rejection carries the reason shown to the caller.
 */
public record SafetyVerdict(boolean allowed, String reason) {

    private static final SafetyVerdict ALLOW = new SafetyVerdict(true, null);

    public static SafetyVerdict allow() {
        return ALLOW;
    }

    public static SafetyVerdict reject(String reason) {
        return new SafetyVerdict(false, reason);
    }
}
