package com.cinematic.recovery;

import com.cinematic.core.graph.StageGraphBuilder;
import com.cinematic.core.model.Project;
import com.cinematic.core.model.ProjectStatus;
import com.cinematic.core.model.RetryPolicy;
import com.cinematic.core.model.Scene;
import com.cinematic.core.model.Stage;
import com.cinematic.core.model.StageEventType;
import com.cinematic.core.model.StageState;
import com.cinematic.engine.config.PipelineSettings;
import com.cinematic.engine.coordinator.PipelineScheduler;
import com.cinematic.engine.metrics.PipelineMetrics;
import com.cinematic.engine.persistence.InMemoryEventRepository;
import com.cinematic.engine.persistence.InMemoryProjectRepository;
import com.cinematic.engine.persistence.InMemoryStageRepository;
import com.cinematic.worker.Capabilities;
import com.cinematic.worker.safety.KeywordSafetyGate;
import com.cinematic.worker.simulated.SimulatedCapabilities;
import com.cinematic.worker.storage.InMemoryAssetStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.*;

/**
 * Restart scenarios: the store holds state written by a scheduler that is gone.
 */
class RecoveryEngineTest {

    private InMemoryProjectRepository projectRepository;
    private InMemoryStageRepository stageRepository;
    private InMemoryEventRepository eventRepository;
    private PipelineScheduler scheduler;
    private RecoveryEngine recovery;

    @BeforeEach
    void setUp() {
        projectRepository = new InMemoryProjectRepository();
        stageRepository = new InMemoryStageRepository();
        eventRepository = new InMemoryEventRepository();
    }

    @AfterEach
    void tearDown() {
        if (recovery != null) {
            recovery.stop();
        }
        if (scheduler != null) {
            scheduler.shutdown(Duration.ofSeconds(5));
        }
    }

    @Test
    @DisplayName("A stage left RUNNING is retried within its budget and the project completes")
    void testInterruptedStageResumed() {
        Project project = Project.create("Interrupted", List.of(Scene.of(1, "Harbor at night", 2.0)));
        List<Stage> stages = new ArrayList<>(new StageGraphBuilder().build(project).toStages());
        stages.set(0, stages.get(0).withReady().withRunning().withSucceeded(null));
        stages.set(1, stages.get(1).withReady().withRunning());
        store(project, stages);

        startAll();

        await(() -> scheduler.progress(project.projectId()).status() == ProjectStatus.COMPLETED);
        Stage imageGen = scheduler.getStages(project.projectId()).get(1);
        assertThat(imageGen.state()).isEqualTo(StageState.SUCCEEDED);
        assertThat(imageGen.retryCount()).isEqualTo(1);
        assertThat(scheduler.events(project.projectId(), 0))
            .anyMatch(e -> e.type() == StageEventType.PROJECT_RECOVERED);
    }

    @Test
    @DisplayName("A project whose cancellation was cut short finishes cancelling")
    void testInterruptedCancellationCompleted() {
        Project project = Project.create("Cancelled", List.of(Scene.of(1, "Meteor shower", 2.0)))
            .withCancelRequested(Instant.now());
        List<Stage> stages = new ArrayList<>(new StageGraphBuilder().build(project).toStages());
        stages.set(0, stages.get(0).withReady());
        store(project, stages);

        startAll();

        await(() -> stageRepository.findByProject(project.projectId()).stream()
            .allMatch(s -> s.state() == StageState.CANCELLED));
        assertThat(scheduler.progress(project.projectId()).status()).isEqualTo(ProjectStatus.CANCELLED);
    }

    @Test
    @DisplayName("Finished projects are left alone")
    void testFinishedProjectsSkipped() {
        Project project = Project.create("Done", List.of(Scene.of(1, "Dune", 2.0)));
        List<Stage> stages = new ArrayList<>();
        for (Stage stage : new StageGraphBuilder().build(project).toStages()) {
            stages.add(stage.withReady().withRunning().withSucceeded(null));
        }
        store(project, stages);

        startAll();

        assertThat(recovery.recoverUnfinished()).isZero();
        assertThat(eventRepository.findByProjectAfter(project.projectId(), 0)).isEmpty();
    }

    @Test
    @DisplayName("An outage at startup pauses dispatch; the probe resumes and recovers once the store answers")
    void testStartupOutageRecoveredByProbe() {
        Project project = Project.create("Outage", List.of(Scene.of(1, "Volcano", 2.0)));
        List<Stage> stages = new ArrayList<>(new StageGraphBuilder().build(project).toStages());
        stages.set(0, stages.get(0).withReady());
        store(project, stages);
        projectRepository.setAvailable(false);

        startAll();

        assertThat(recovery.isRecoveryPending()).isTrue();
        assertThat(scheduler.gate().isPaused()).isTrue();

        recovery.probe();
        assertThat(scheduler.gate().isPaused()).isTrue();

        projectRepository.setAvailable(true);
        recovery.probe();

        assertThat(recovery.isRecoveryPending()).isFalse();
        assertThat(scheduler.gate().isPaused()).isFalse();
        await(() -> scheduler.progress(project.projectId()).status() == ProjectStatus.COMPLETED);
    }

    // ========== Helpers ==========

    private void store(Project project, List<Stage> stages) {
        projectRepository.save(project);
        stageRepository.saveAll(stages);
    }

    private void startAll() {
        InMemoryAssetStore assets = new InMemoryAssetStore();
        Capabilities capabilities = Capabilities.simulated(
            new KeywordSafetyGate(List.of("forbidden"), assets),
            new SimulatedCapabilities(assets, Duration.ZERO),
            assets);
        PipelineSettings settings = PipelineSettings.builder()
            .retryPolicy(RetryPolicy.builder()
                .maxAttempts(3)
                .initialBackoff(Duration.ofMillis(10))
                .maxBackoff(Duration.ofMillis(50))
                .backoffMultiplier(2.0)
                .jitterFactor(0.0)
                .build())
            .build();
        scheduler = new PipelineScheduler(settings, capabilities, projectRepository, stageRepository,
            eventRepository, new ObjectMapper(), new PipelineMetrics(new SimpleMeterRegistry()));
        scheduler.start();
        // Long interval: tests drive the probe directly
        recovery = new RecoveryEngine(projectRepository, stageRepository, scheduler, Duration.ofHours(1));
        recovery.start();
    }

    private static void await(BooleanSupplier condition) {
        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within 10s");
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted while waiting");
            }
        }
    }
}
