package com.cinematic.engine.coordinator;

import com.cinematic.core.exception.InvalidStateException;
import com.cinematic.core.exception.NotFoundException;
import com.cinematic.core.exception.PersistenceUnavailableException;
import com.cinematic.core.graph.StageGraph;
import com.cinematic.core.graph.StageGraphBuilder;
import com.cinematic.core.model.Project;
import com.cinematic.core.model.ProjectStatus;
import com.cinematic.core.model.ResourceClass;
import com.cinematic.core.model.Stage;
import com.cinematic.core.model.StageEvent;
import com.cinematic.core.model.StageKind;
import com.cinematic.core.repository.EventRepository;
import com.cinematic.core.repository.ProjectRepository;
import com.cinematic.core.repository.StageRepository;
import com.cinematic.engine.config.PipelineSettings;
import com.cinematic.engine.dispatch.DispatchGate;
import com.cinematic.engine.dispatch.ResourcePool;
import com.cinematic.engine.dispatch.StageDispatcher;
import com.cinematic.engine.dispatch.StageTicket;
import com.cinematic.engine.events.EventRecorder;
import com.cinematic.engine.events.EventSubscription;
import com.cinematic.engine.events.StageEventListener;
import com.cinematic.engine.execution.StageExecutor;
import com.cinematic.engine.execution.StageOutcome;
import com.cinematic.engine.logging.LoggingContext;
import com.cinematic.engine.metrics.PipelineMetrics;
import com.cinematic.engine.progress.ProgressAggregator;
import com.cinematic.engine.progress.ProjectProgress;
import com.cinematic.engine.service.PipelineService;
import com.cinematic.scheduler.TimerScheduler;
import com.cinematic.worker.Capabilities;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Schedules the stages of every project onto the shared resource pools.
 *
 * Responsibilities:
 * - Build and persist the stage graph of submitted projects
 * - Dispatch READY stages through one FIFO queue per resource class
 * - Run stages through the executor and feed outcomes back to their {@link ProjectRun}
 * - Drive automatic retries with backoff timers
 * - Cancellation, manual retry and restart recovery
 */
public class PipelineScheduler implements PipelineService {

    private static final Logger log = LoggerFactory.getLogger(PipelineScheduler.class);

    private final PipelineSettings settings;
    private final ProjectRepository projectRepository;
    private final StageRepository stageRepository;
    private final StageGraphBuilder graphBuilder;
    private final StageExecutor executor;
    private final TimerScheduler timers;
    private final PipelineMetrics metrics;
    private final DispatchGate gate;
    private final DurableWriter writer;
    private final EventRecorder events;
    private final ProgressAggregator aggregator = new ProgressAggregator();
    private final Map<ResourceClass, StageDispatcher> dispatchers = new EnumMap<>(ResourceClass.class);
    private final Map<UUID, ProjectRun> runs = new ConcurrentHashMap<>();
    private final Object submitLock = new Object();
    private final RunHooks hooks = new SchedulerHooks();

    private volatile boolean accepting = false;

    public PipelineScheduler(
            PipelineSettings settings,
            Capabilities capabilities,
            ProjectRepository projectRepository,
            StageRepository stageRepository,
            EventRepository eventRepository,
            ObjectMapper objectMapper,
            PipelineMetrics metrics) {
        this.settings = settings;
        this.projectRepository = projectRepository;
        this.stageRepository = stageRepository;
        this.graphBuilder = new StageGraphBuilder(settings.screenGeneratedImages());
        this.executor = new StageExecutor(capabilities, settings);
        this.timers = new TimerScheduler();
        this.metrics = metrics;
        this.gate = new DispatchGate();
        this.writer = new DurableWriter(gate);
        this.events = new EventRecorder(eventRepository, objectMapper);

        StageDispatcher.TicketHandler handler = new StageDispatcher.TicketHandler() {
            @Override
            public boolean isStale(StageTicket ticket) {
                ProjectRun run = runs.get(ticket.projectId());
                return run == null || !run.isDispatchable(ticket.stageId());
            }

            @Override
            public void handle(StageTicket ticket) {
                runStage(ticket);
            }
        };
        for (ResourceClass resourceClass : ResourceClass.values()) {
            StageDispatcher dispatcher = new StageDispatcher(
                new ResourcePool(resourceClass, settings.slots(resourceClass)), gate, handler);
            dispatchers.put(resourceClass, dispatcher);
            metrics.bindDispatcher(dispatcher);
        }
    }

    // ========== Lifecycle ==========

    public void start() {
        timers.start();
        dispatchers.values().forEach(StageDispatcher::start);
        accepting = true;
        log.info("Pipeline scheduler started (GPU slots: {}, CPU slots: {})",
            settings.slots(ResourceClass.GPU), settings.slots(ResourceClass.CPU));
    }

    /**
     * Stop accepting submissions, stop dispatching and wait for in-flight stages.
     *
     * @return true if every in-flight stage finished within the timeout
     */
    public boolean shutdown(Duration timeout) {
        if (!accepting && !timers.isRunning()) {
            return true;
        }
        accepting = false;
        log.info("Shutting down pipeline scheduler (timeout: {})", timeout);
        timers.stop();

        boolean drained = true;
        for (StageDispatcher dispatcher : dispatchers.values()) {
            drained &= dispatcher.stop(timeout);
        }
        executor.shutdown();
        events.shutdown();
        log.info("Pipeline scheduler stopped{}", drained ? "" : " with stages still running");
        return drained;
    }

    public boolean isAccepting() {
        return accepting;
    }

    // ========== PipelineService ==========

    @Override
    public ProjectHandle submit(SubmitProjectRequest request) {
        if (!accepting) {
            throw new InvalidStateException("Scheduler is not accepting submissions");
        }

        ProjectRun run;
        synchronized (submitLock) {
            if (request.projectId() != null) {
                Optional<ProjectRun> existing = findRun(request.projectId());
                if (existing.isPresent()) {
                    log.info("Project {} already submitted; returning existing handle", request.projectId());
                    return handle(existing.get());
                }
            }

            String aspectRatio = request.aspectRatio() != null ? request.aspectRatio() : settings.defaultAspectRatio();
            Project project = Project.create(
                request.projectId(), request.title(), request.scenes(), aspectRatio, settings.compositionPolicy());
            StageGraph graph = graphBuilder.build(project);
            List<Stage> stages = graph.toStages();

            writer.attempt("submit project " + project.projectId(), () -> {
                projectRepository.save(project);
                stageRepository.saveAll(stages);
            });

            run = newRun(project, graph, stages);
            runs.put(project.projectId(), run);
        }

        try (LoggingContext ctx = LoggingContext.forProject(run.projectId())) {
            log.info("Submitted project '{}' with {} scenes", request.title(), run.project().scenes().size());
        }
        metrics.projectSubmitted();
        run.start();
        return handle(run);
    }

    @Override
    public boolean cancel(UUID projectId) {
        try (LoggingContext ctx = LoggingContext.forProject(projectId)) {
            return requireRun(projectId).cancel();
        }
    }

    @Override
    public int retry(UUID projectId) {
        try (LoggingContext ctx = LoggingContext.forProject(projectId)) {
            return requireRun(projectId).retry();
        }
    }

    @Override
    public ProjectProgress progress(UUID projectId) {
        return requireRun(projectId).progress();
    }

    @Override
    public Project getProject(UUID projectId) {
        return requireRun(projectId).project();
    }

    @Override
    public List<Stage> getStages(UUID projectId) {
        return requireRun(projectId).stages();
    }

    @Override
    public List<StageEvent> events(UUID projectId, long afterSequence) {
        requireRun(projectId);
        return events.events(projectId, afterSequence);
    }

    @Override
    public EventSubscription subscribe(UUID projectId, StageEventListener listener) {
        requireRun(projectId);
        return events.subscribe(projectId, listener);
    }

    @Override
    public void delete(UUID projectId) {
        ProjectRun run = requireRun(projectId);
        run.markDeleted();
        try {
            writer.attempt("delete project " + projectId, () -> {
                stageRepository.deleteByProject(projectId);
                projectRepository.delete(projectId);
                events.forget(projectId);
            });
        } catch (PersistenceUnavailableException e) {
            run.clearDeleted();
            throw e;
        }
        timers.cancelProjectTimers(projectId);
        runs.remove(projectId, run);
        log.info("Deleted project {}", projectId);
    }

    // ========== Recovery ==========

    /**
     * Take over a project found in the store after a restart.
     */
    public void recover(Project project, List<Stage> stages) {
        ProjectRun run;
        synchronized (submitLock) {
            if (runs.containsKey(project.projectId())) {
                log.debug("Project {} already loaded; skipping recovery", project.projectId());
                return;
            }
            run = load(project, stages);
        }
        recoverLoaded(run);
    }

    public DispatchGate gate() {
        return gate;
    }

    public SchedulerStats stats() {
        Map<ResourceClass, SchedulerStats.PoolStats> pools = new EnumMap<>(ResourceClass.class);
        dispatchers.forEach((resourceClass, dispatcher) -> pools.put(resourceClass, new SchedulerStats.PoolStats(
            dispatcher.pool().capacity(),
            dispatcher.pool().inUse(),
            dispatcher.pool().peakInUse(),
            dispatcher.queueDepth())));
        int active = (int) runs.values().stream().filter(r -> !r.status().isTerminal()).count();
        return new SchedulerStats(gate.isPaused(), gate.pauseReason(), pools, active, timers.pendingCount());
    }

    // ========== Internal Methods ==========

    private void runStage(StageTicket ticket) {
        ProjectRun run = runs.get(ticket.projectId());
        if (run == null) {
            return;
        }
        if (executor.runAfterCallEnded(ticket.projectId(), ticket.stageId(), () -> hooks.enqueue(ticket))) {
            log.info("Deferring {} of project {} until its abandoned adapter call returns",
                ticket.stageId(), ticket.projectId());
            return;
        }
        Optional<StageWork> started = run.tryStart(ticket.stageId());
        if (started.isEmpty()) {
            return;
        }

        StageWork work = started.get();
        Stage stage = work.stage();
        try (LoggingContext ctx = LoggingContext.forStage(
                ticket.projectId(), stage.stageId(), stage.sceneNumber(), work.attempt())) {
            log.info("Running {} (attempt {})", stage.kind(), work.attempt());
            long startNanos = System.nanoTime();
            StageOutcome outcome = executor.execute(work);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);

            if (outcome.succeeded()) {
                metrics.stageSucceeded(stage.kind(), elapsed);
                run.onSucceeded(stage.stageId(), outcome.assetKey());
            } else {
                metrics.stageFailed(stage.kind(), outcome.failureClass(), elapsed);
                run.onFailed(stage.stageId(), outcome.failureClass(), outcome.errorCode(), outcome.message());
                // The slot stays taken while a timed-out call is still running
                executor.awaitCallEnded(work);
            }
        }
    }

    private ProjectRun newRun(Project project, StageGraph graph, List<Stage> stages) {
        return new ProjectRun(project, graph, stages, settings.retryPolicy(),
            projectRepository, stageRepository, events, writer, aggregator, hooks);
    }

    private ProjectRun requireRun(UUID projectId) {
        return findRun(projectId).orElseThrow(() -> new NotFoundException("Project", projectId.toString()));
    }

    /**
     * Active runs live in memory; projects of earlier runs are loaded on demand.
     * A loaded project with unowned work is recovered before it is returned.
     */
    private Optional<ProjectRun> findRun(UUID projectId) {
        ProjectRun run = runs.get(projectId);
        if (run != null) {
            return Optional.of(run);
        }

        ProjectRun loaded;
        synchronized (submitLock) {
            run = runs.get(projectId);
            if (run != null) {
                return Optional.of(run);
            }
            Optional<Project> stored = projectRepository.findById(projectId);
            if (stored.isEmpty()) {
                return Optional.empty();
            }
            List<Stage> stages = stageRepository.findByProject(projectId);
            if (stages.isEmpty()) {
                return Optional.empty();
            }
            loaded = load(stored.get(), stages);
        }
        if (loaded.needsRecovery()) {
            recoverLoaded(loaded);
        }
        return Optional.of(loaded);
    }

    /**
     * A run whose recovery could not be written is unloaded again, so the next lookup
     * or recovery pass starts over from the store.
     */
    private void recoverLoaded(ProjectRun run) {
        try {
            run.recover();
        } catch (PersistenceUnavailableException e) {
            runs.remove(run.projectId(), run);
            throw e;
        }
    }

    private ProjectRun load(Project project, List<Stage> stages) {
        StageGraph graph = StageGraph.fromStages(project.projectId(), stages, StageGraphBuilder.transitions(project));
        ProjectRun run = newRun(project, graph, stages);
        runs.put(project.projectId(), run);
        return run;
    }

    private ProjectHandle handle(ProjectRun run) {
        Project project = run.project();
        return new ProjectHandle(project.projectId(), run.status(), run.graph().size(), project.createdAt());
    }

    /**
     * Side effects requested by project runs.
     */
    private final class SchedulerHooks implements RunHooks {

        @Override
        public void enqueue(StageTicket ticket) {
            dispatchers.get(ticket.resourceClass()).enqueue(ticket);
        }

        @Override
        public void scheduleRetry(UUID projectId, String stageId, Duration delay) {
            try {
                timers.scheduleDelay(projectId, stageId, delay, () -> {
                    ProjectRun run = runs.get(projectId);
                    if (run != null) {
                        try (LoggingContext ctx = LoggingContext.forProject(projectId)) {
                            run.onRetryDue(stageId);
                        }
                    }
                });
            } catch (IllegalStateException e) {
                log.warn("Retry of {} in project {} not scheduled; timers are stopped. Recovery will reschedule it.",
                    stageId, projectId);
            }
        }

        @Override
        public void retryScheduled(StageKind kind) {
            metrics.stageRetryScheduled(kind);
        }

        @Override
        public void cancelTimers(UUID projectId) {
            int timersCancelled = timers.cancelProjectTimers(projectId);
            int ticketsDropped = 0;
            for (StageDispatcher dispatcher : dispatchers.values()) {
                ticketsDropped += dispatcher.removeProject(projectId);
            }
            log.debug("Cancelled {} timers and dropped {} queued tickets of project {}",
                timersCancelled, ticketsDropped, projectId);
        }

        @Override
        public void statusChanged(Project project, ProjectStatus from, ProjectStatus to) {
            switch (to) {
                case COMPLETED -> metrics.projectCompleted();
                case FAILED -> metrics.projectFailed();
                case CANCELLED -> metrics.projectCancelled();
                default -> log.debug("Project {} moved from {} to {}", project.projectId(), from, to);
            }
        }
    }
}
