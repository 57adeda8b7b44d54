package com.cinematic.engine.dispatch;

import com.cinematic.core.model.ResourceClass;

import java.time.Instant;
import java.util.UUID;

/**
 * A READY stage waiting in a resource-class queue.
 */
public record StageTicket(UUID projectId, String stageId, ResourceClass resourceClass, Instant enqueuedAt) {

    public static StageTicket of(UUID projectId, String stageId, ResourceClass resourceClass) {
        return new StageTicket(projectId, stageId, resourceClass, Instant.now());
    }
}
