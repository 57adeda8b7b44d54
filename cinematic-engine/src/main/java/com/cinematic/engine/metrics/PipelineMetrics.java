package com.cinematic.engine.metrics;

import com.cinematic.core.model.FailureClass;
import com.cinematic.core.model.ResourceClass;
import com.cinematic.core.model.StageKind;
import com.cinematic.engine.dispatch.StageDispatcher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer metrics for the pipeline.
 *
 * Metrics exposed:
 * - Project counts by outcome
 * - Stage outcomes by kind and failure class
 * - Stage execution duration by kind
 * - Automatic retries
 * - Queue depth and slots in use per resource class
 */
public class PipelineMetrics {

    public static final String PROJECTS_SUBMITTED = "cinematic.projects.submitted";
    public static final String PROJECTS_COMPLETED = "cinematic.projects.completed";
    public static final String PROJECTS_FAILED = "cinematic.projects.failed";
    public static final String PROJECTS_CANCELLED = "cinematic.projects.cancelled";

    public static final String STAGE_OUTCOMES = "cinematic.stages.outcomes";
    public static final String STAGE_DURATION = "cinematic.stage.duration";
    public static final String STAGE_RETRIES = "cinematic.stage.retries";

    public static final String QUEUE_DEPTH = "cinematic.queue.depth";
    public static final String SLOTS_IN_USE = "cinematic.slots.in_use";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Register the queue and slot gauges of a dispatcher.
     */
    public void bindDispatcher(StageDispatcher dispatcher) {
        ResourceClass resourceClass = dispatcher.pool().resourceClass();
        Gauge.builder(QUEUE_DEPTH, dispatcher, StageDispatcher::queueDepth)
            .tag("resource", resourceClass.name())
            .description("Ready stages waiting for a slot")
            .register(registry);
        Gauge.builder(SLOTS_IN_USE, dispatcher.pool(), pool -> pool.inUse())
            .tag("resource", resourceClass.name())
            .description("Worker slots currently held")
            .register(registry);
    }

    // ========== Project Metrics ==========

    public void projectSubmitted() {
        counter(PROJECTS_SUBMITTED, "Projects accepted for scheduling").increment();
    }

    public void projectCompleted() {
        counter(PROJECTS_COMPLETED, "Projects whose every stage succeeded").increment();
    }

    public void projectFailed() {
        counter(PROJECTS_FAILED, "Projects that ended with a failed stage").increment();
    }

    public void projectCancelled() {
        counter(PROJECTS_CANCELLED, "Projects cancelled by request").increment();
    }

    // ========== Stage Metrics ==========

    public void stageSucceeded(StageKind kind, Duration duration) {
        Counter.builder(STAGE_OUTCOMES)
            .tag("kind", kind.name())
            .tag("outcome", "success")
            .tag("failure_class", "none")
            .description("Stage executions by outcome")
            .register(registry)
            .increment();
        stageTimer(kind, "success").record(duration);
    }

    public void stageFailed(StageKind kind, FailureClass failureClass, Duration duration) {
        Counter.builder(STAGE_OUTCOMES)
            .tag("kind", kind.name())
            .tag("outcome", "failure")
            .tag("failure_class", failureClass.name())
            .description("Stage executions by outcome")
            .register(registry)
            .increment();
        stageTimer(kind, "failure").record(duration);
    }

    public void stageRetryScheduled(StageKind kind) {
        Counter.builder(STAGE_RETRIES)
            .tag("kind", kind.name())
            .description("Automatic retries scheduled")
            .register(registry)
            .increment();
    }

    public MeterRegistry registry() {
        return registry;
    }

    // ========== Internal Methods ==========

    private Counter counter(String name, String description) {
        return Counter.builder(name)
            .description(description)
            .register(registry);
    }

    private Timer stageTimer(StageKind kind, String outcome) {
        return Timer.builder(STAGE_DURATION)
            .tag("kind", kind.name())
            .tag("outcome", outcome)
            .description("Stage execution duration")
            .register(registry);
    }
}
