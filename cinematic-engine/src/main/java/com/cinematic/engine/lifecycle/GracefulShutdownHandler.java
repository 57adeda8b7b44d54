package com.cinematic.engine.lifecycle;

import com.cinematic.engine.config.PipelineSettings;
import com.cinematic.engine.coordinator.PipelineScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Graceful shutdown of the scheduler.
 *
 * On shutdown:
 * 1. Stops accepting submissions
 * 2. Stops dispatching queued stages
 * 3. Waits for in-flight stages, bounded by the configured timeout
 *
 * Stages still running when the timeout expires stay RUNNING in the store and
 * are retried by recovery on the next start.
 */
@Component
public class GracefulShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownHandler.class);

    private final PipelineScheduler scheduler;
    private final PipelineSettings settings;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public GracefulShutdownHandler(PipelineScheduler scheduler, PipelineSettings settings) {
        this.scheduler = scheduler;
        this.settings = settings;
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown(ContextClosedEvent event) {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        log.info("Initiating graceful shutdown (timeout: {})", settings.shutdownTimeout());
        boolean drained = scheduler.shutdown(settings.shutdownTimeout());
        if (drained) {
            log.info("Graceful shutdown complete");
        } else {
            log.warn("Shutdown timeout reached; interrupted stages will be recovered on restart");
        }
    }
}
