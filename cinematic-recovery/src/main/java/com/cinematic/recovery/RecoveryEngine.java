package com.cinematic.recovery;

import com.cinematic.core.exception.PersistenceUnavailableException;
import com.cinematic.core.model.Project;
import com.cinematic.core.model.Stage;
import com.cinematic.core.model.StageState;
import com.cinematic.core.repository.ProjectRepository;
import com.cinematic.core.repository.StageRepository;
import com.cinematic.engine.coordinator.PipelineScheduler;
import com.cinematic.engine.dispatch.DispatchGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Recovery Engine responsible for resuming work after restarts and outages.
 *
 * Responsibilities:
 * - Hand every unfinished project found in the store to the scheduler at startup
 * - Probe the store while dispatch is paused and resume once it answers
 * - Retry startup recovery that was cut short by an outage
 */
public class RecoveryEngine {

    private static final Logger log = LoggerFactory.getLogger(RecoveryEngine.class);

    private static final int RUNNING_SAMPLE_SIZE = 1000;

    private final ProjectRepository projectRepository;
    private final StageRepository stageRepository;
    private final PipelineScheduler scheduler;
    private final Duration probeInterval;

    private final ScheduledExecutorService executor;
    private volatile boolean running = false;
    private volatile boolean recoveryPending = false;

    public RecoveryEngine(
            ProjectRepository projectRepository,
            StageRepository stageRepository,
            PipelineScheduler scheduler,
            Duration probeInterval) {
        this.projectRepository = projectRepository;
        this.stageRepository = stageRepository;
        this.scheduler = scheduler;
        this.probeInterval = probeInterval;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "recovery-probe");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Recover unfinished projects, then start probing for store outages.
     */
    public void start() {
        if (running) {
            log.warn("Recovery engine already running");
            return;
        }

        running = true;
        log.info("Starting recovery engine (probe interval: {})", probeInterval);

        recoverUnfinished();

        executor.scheduleWithFixedDelay(
            this::probe,
            probeInterval.toMillis(),
            probeInterval.toMillis(),
            TimeUnit.MILLISECONDS
        );

        log.info("Recovery engine started");
    }

    public void stop() {
        running = false;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Recovery engine stopped");
    }

    public boolean isRecoveryPending() {
        return recoveryPending;
    }

    /**
     * Hand every project with unowned work to the scheduler.
     *
     * @return number of projects recovered
     */
    public int recoverUnfinished() {
        List<Project> projects;
        try {
            projects = projectRepository.findAll();
            int runningStages = stageRepository.findByState(StageState.RUNNING, RUNNING_SAMPLE_SIZE).size();
            if (runningStages > 0) {
                log.info("Found {} stages left RUNNING by a previous scheduler", runningStages);
            }
        } catch (PersistenceUnavailableException e) {
            log.warn("Store unavailable during startup recovery; will retry once it answers: {}", e.getMessage());
            recoveryPending = true;
            scheduler.gate().pause("Persistence unavailable: " + e.getMessage());
            return 0;
        }

        int recovered = 0;
        for (Project project : projects) {
            try {
                List<Stage> stages = stageRepository.findByProject(project.projectId());
                if (stages.stream().noneMatch(Stage::isActive)) {
                    continue;
                }
                scheduler.recover(project, stages);
                recovered++;
            } catch (PersistenceUnavailableException e) {
                log.warn("Store became unavailable while recovering project {}", project.projectId());
                recoveryPending = true;
                scheduler.gate().pause("Persistence unavailable: " + e.getMessage());
                return recovered;
            } catch (Exception e) {
                log.error("Failed to recover project {}", project.projectId(), e);
            }
        }

        recoveryPending = false;
        log.info("Recovered {} of {} stored projects", recovered, projects.size());
        return recovered;
    }

    // ========== Internal Methods ==========

    /**
     * While dispatch is paused, ping the store and reopen the gate once it answers.
     */
    void probe() {
        if (!running) return;

        DispatchGate gate = scheduler.gate();
        if (!gate.isPaused() && !recoveryPending) {
            return;
        }

        try {
            projectRepository.ping();
        } catch (PersistenceUnavailableException e) {
            log.debug("Store still unavailable: {}", e.getMessage());
            return;
        } catch (Exception e) {
            log.error("Error probing store", e);
            return;
        }

        log.info("Store reachable again; resuming dispatch");
        gate.resume();
        if (recoveryPending) {
            recoverUnfinished();
        }
    }
}
