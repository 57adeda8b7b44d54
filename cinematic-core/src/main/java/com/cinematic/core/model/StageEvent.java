package com.cinematic.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of a project or stage state change.
 * Consumed by pollers and stream subscribers for progress notification.
 *
 * Invariants:
 * - sequenceNumber is contiguous within a project, starting at 1
 * - percent is the project progress right after the change
 * - stageId and state are null for project-level events
 */
public record StageEvent(
    UUID eventId,
    UUID projectId,
    long sequenceNumber,
    StageEventType type,
    String stageId,
    StageState state,
    int percent,
    Instant timestamp,
    JsonNode payload,
    String actor
) {
    public static final String ACTOR_SCHEDULER = "SCHEDULER";
    public static final String ACTOR_WORKER = "WORKER";
    public static final String ACTOR_RECOVERY = "RECOVERY";
    public static final String ACTOR_USER = "USER";

    public static StageEvent create(
            UUID projectId,
            long sequenceNumber,
            StageEventType type,
            String stageId,
            StageState state,
            int percent,
            JsonNode payload,
            String actor) {
        return new StageEvent(
            UUID.randomUUID(),
            projectId,
            sequenceNumber,
            type,
            stageId,
            state,
            percent,
            Instant.now(),
            payload,
            actor
        );
    }
}
