package com.cinematic.engine.coordinator;

import com.cinematic.core.model.ResourceClass;

import java.util.Map;

/**
 * Point-in-time view of the scheduler, used by health checks.
 */
public record SchedulerStats(
    boolean paused,
    String pauseReason,
    Map<ResourceClass, PoolStats> pools,
    int activeProjects,
    int pendingTimers
) {
    /**
     * @param peakInUse highest number of slots held at once since start
     */
    public record PoolStats(int capacity, int inUse, int peakInUse, int queueDepth) {}
}
