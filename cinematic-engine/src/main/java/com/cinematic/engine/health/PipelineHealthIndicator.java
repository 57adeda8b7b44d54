package com.cinematic.engine.health;

import com.cinematic.engine.coordinator.PipelineScheduler;
import com.cinematic.engine.coordinator.SchedulerStats;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of the pipeline scheduler.
 * Reports DOWN while dispatch is paused by a control-plane outage or the scheduler is not accepting work.
 */
@Component
public class PipelineHealthIndicator implements HealthIndicator {

    private final PipelineScheduler scheduler;

    public PipelineHealthIndicator(PipelineScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        try {
            SchedulerStats stats = scheduler.stats();
            details.put("accepting", scheduler.isAccepting());
            details.put("dispatchPaused", stats.paused());
            if (stats.pauseReason() != null) {
                details.put("pauseReason", stats.pauseReason());
            }
            details.put("activeProjects", stats.activeProjects());
            details.put("pendingRetryTimers", stats.pendingTimers());

            Map<String, Object> pools = new LinkedHashMap<>();
            stats.pools().forEach((resourceClass, pool) -> pools.put(resourceClass.name(), Map.of(
                "capacity", pool.capacity(),
                "inUse", pool.inUse(),
                "queueDepth", pool.queueDepth())));
            details.put("pools", pools);

            if (stats.paused() || !scheduler.isAccepting()) {
                return Health.down().withDetails(details).build();
            }
            return Health.up().withDetails(details).build();
        } catch (Exception e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }
}
