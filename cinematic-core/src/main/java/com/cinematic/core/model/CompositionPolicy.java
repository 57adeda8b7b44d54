package com.cinematic.core.model;

/**
 * When the final composition stage may run.
 */
public enum CompositionPolicy {
    /** Every scene output must succeed. */
    REQUIRE_ALL_SCENES,
    /** Every scene must be terminal and at least one must have succeeded. */
    ALLOW_PARTIAL
}
