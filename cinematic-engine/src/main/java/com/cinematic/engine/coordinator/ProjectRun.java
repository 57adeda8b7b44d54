package com.cinematic.engine.coordinator;

import com.cinematic.core.exception.InvalidStateException;
import com.cinematic.core.exception.PersistenceUnavailableException;
import com.cinematic.core.graph.StageGraph;
import com.cinematic.core.model.CompositionPolicy;
import com.cinematic.core.model.FailureClass;
import com.cinematic.core.model.Project;
import com.cinematic.core.model.ProjectStatus;
import com.cinematic.core.model.RetryPolicy;
import com.cinematic.core.model.Scene;
import com.cinematic.core.model.Stage;
import com.cinematic.core.model.StageEvent;
import com.cinematic.core.model.StageEventType;
import com.cinematic.core.model.StageKind;
import com.cinematic.core.model.StageState;
import com.cinematic.core.repository.ProjectRepository;
import com.cinematic.core.repository.StageRepository;
import com.cinematic.engine.dispatch.StageTicket;
import com.cinematic.engine.events.EventRecorder;
import com.cinematic.engine.logging.LoggingContext;
import com.cinematic.engine.progress.ProgressAggregator;
import com.cinematic.engine.progress.ProjectProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Authoritative state table of one project.
 *
 * Every transition is evaluated under this object's monitor, so concurrent
 * completions of sibling stages are serialized while other projects proceed in
 * parallel. A transition, its cascade and its events are written to the store
 * in one attempt and applied to the in-memory arena only once that write
 * returned. When the store is unreachable nothing is applied: the monitor is
 * released, the caller waits for the store, and the transition is evaluated
 * again against whatever state it then finds.
 *
 * Queries read an immutable snapshot published after each commit and never
 * take the monitor. Adapter calls never run under the monitor.
 */
public class ProjectRun {

    private static final Logger log = LoggerFactory.getLogger(ProjectRun.class);

    static final String INTERRUPTED_BY_RESTART = "INTERRUPTED_BY_RESTART";

    private final StageGraph graph;
    private final Stage[] stages;
    private final RetryPolicy retryPolicy;
    private final ProjectRepository projectRepository;
    private final StageRepository stageRepository;
    private final EventRecorder events;
    private final DurableWriter writer;
    private final ProgressAggregator aggregator;
    private final RunHooks hooks;

    private Project project;
    private ProjectStatus status;
    private int highWaterPercent;
    private Integer frozenPercent;
    private boolean deleted;

    private volatile Snapshot snapshot;

    /**
     * State as of the last commit.
     */
    private record Snapshot(Project project, List<Stage> stages, ProjectStatus status, int percent) {}

    ProjectRun(
            Project project,
            StageGraph graph,
            List<Stage> stages,
            RetryPolicy retryPolicy,
            ProjectRepository projectRepository,
            StageRepository stageRepository,
            EventRecorder events,
            DurableWriter writer,
            ProgressAggregator aggregator,
            RunHooks hooks) {
        this.project = project;
        this.graph = graph;
        this.stages = new Stage[graph.size()];
        for (Stage stage : stages) {
            this.stages[stage.index()] = stage;
        }
        this.retryPolicy = retryPolicy;
        this.projectRepository = projectRepository;
        this.stageRepository = stageRepository;
        this.events = events;
        this.writer = writer;
        this.aggregator = aggregator;
        this.hooks = hooks;

        this.status = ProjectStatus.derive(Arrays.asList(this.stages), project.isCancelRequested());
        this.highWaterPercent = aggregator.weightedPercent(Arrays.asList(this.stages));
        if (project.isCancelRequested()) {
            this.frozenPercent = highWaterPercent;
        }
        publishSnapshot();
    }

    // ========== Lifecycle ==========

    /**
     * Record the submission and promote the root stages.
     */
    public void start() {
        transact("start project " + projectId(), () -> {
            try (LoggingContext ctx = LoggingContext.forProject(project.projectId())) {
                Change change = new Change();
                change.note(StageEventType.PROJECT_SUBMITTED,
                    Map.of("title", String.valueOf(project.title()),
                        "scenes", project.scenes().size(),
                        "stages", stages.length),
                    StageEvent.ACTOR_USER);
                for (Stage stage : stages) {
                    if (stage.state() == StageState.PENDING && stage.dependsOn().isEmpty()) {
                        change.put(stage.withReady(), StageEventType.STAGE_READY, Map.of());
                    }
                }
                commit(change, StageEvent.ACTOR_SCHEDULER);
                log.info("Project '{}' started with {} stages", project.title(), stages.length);
                return null;
            }
        });
    }

    /**
     * Whether a queued ticket for this stage should still be dispatched.
     * Reads the last committed snapshot; {@link #tryStart} re-checks under the monitor.
     */
    public boolean isDispatchable(String stageId) {
        Snapshot current = snapshot;
        return !current.project().isCancelRequested()
            && current.stages().get(graph.indexOf(stageId)).state() == StageState.READY;
    }

    /**
     * Move a READY stage to RUNNING and capture its inputs.
     *
     * @return empty if the stage is no longer READY or the project was cancelled or deleted
     */
    public Optional<StageWork> tryStart(String stageId) {
        return transact("start stage " + stageId, () -> {
            Stage stage = stage(stageId);
            if (deleted || project.isCancelRequested() || stage.state() != StageState.READY) {
                return Optional.empty();
            }

            Change change = new Change();
            Stage running = stage.withRunning();
            change.put(running, StageEventType.STAGE_STARTED, Map.of("attempt", running.retryCount() + 1));
            commit(change, StageEvent.ACTOR_WORKER);

            Scene scene = running.sceneNumber() != null ? project.scene(running.sceneNumber()) : null;
            String input = null;
            Map<Integer, String> clips = Map.of();
            if (running.kind() == StageKind.COMPOSITION) {
                clips = succeededSceneClips();
            } else if (!running.dependsOn().isEmpty()) {
                input = stages[graph.dependencies(running.index()).get(0)].outputAssetKey();
            }
            return Optional.of(new StageWork(project, running, scene, input, clips));
        });
    }

    /**
     * Apply a successful completion and promote dependents whose inputs are all available.
     */
    public void onSucceeded(String stageId, String assetKey) {
        transact("complete stage " + stageId, () -> {
            Stage stage = stage(stageId);
            if (deleted) {
                log.debug("Ignoring result of {}; project {} was deleted", stageId, project.projectId());
                return null;
            }
            if (stage.state() != StageState.RUNNING) {
                discard(stage, "succeeded");
                return null;
            }

            Change change = new Change();
            change.put(stage.withSucceeded(assetKey), StageEventType.STAGE_SUCCEEDED,
                assetKey != null ? Map.of("outputAssetKey", assetKey) : Map.of());
            if (stage.kind() == StageKind.COMPOSITION) {
                change.project = project.withFinalAsset(assetKey);
            }

            promoteDependents(change, stage.index());
            evaluateComposition(change);
            commit(change, StageEvent.ACTOR_WORKER);
            log.info("Stage {} succeeded{}", stageId, assetKey != null ? " with " + assetKey : "");
            return null;
        });
    }

    /**
     * Apply a failed execution: schedule an automatic retry when allowed, otherwise cascade-cancel dependents.
     */
    public void onFailed(String stageId, FailureClass failureClass, String errorCode, String message) {
        transact("fail stage " + stageId, () -> {
            Stage stage = stage(stageId);
            if (deleted) {
                log.debug("Ignoring failure of {}; project {} was deleted", stageId, project.projectId());
                return null;
            }
            if (stage.state() != StageState.RUNNING) {
                discard(stage, "failed");
                return null;
            }

            Change change = new Change();
            Duration delay = failAndMaybeRetry(change, stage, failureClass, errorCode, message);
            commit(change, StageEvent.ACTOR_WORKER);

            if (delay != null) {
                hooks.retryScheduled(stage.kind());
                hooks.scheduleRetry(project.projectId(), stageId, delay);
            }
            return null;
        });
    }

    /**
     * Backoff elapsed: put an awaiting stage back on its queue.
     */
    public void onRetryDue(String stageId) {
        transact("requeue stage " + stageId, () -> {
            Stage stage = stage(stageId);
            if (deleted || project.isCancelRequested() || !stage.isAwaitingRetry()) {
                log.debug("Ignoring retry timer for {} in state {}", stageId, stage.state());
                return null;
            }
            Change change = new Change();
            change.put(stage.withReady(), StageEventType.STAGE_READY, Map.of("attempt", stage.retryCount() + 1));
            commit(change, StageEvent.ACTOR_SCHEDULER);
            return null;
        });
    }

    /**
     * Record cancellation: every non-terminal stage becomes CANCELLED and no further stage is dispatched.
     * A RUNNING stage keeps running, but its result is discarded.
     *
     * @return false if the project was already cancelled or had nothing left to cancel
     * @throws PersistenceUnavailableException if the store is unreachable; nothing is cancelled
     */
    public synchronized boolean cancel() {
        if (project.isCancelRequested()) {
            return false;
        }
        boolean anyLive = Arrays.stream(stages).anyMatch(s -> !s.state().isTerminal() || s.isAwaitingRetry());
        if (!anyLive) {
            log.info("Cancel of project {} ignored; status is already {}", project.projectId(), status);
            return false;
        }

        Change change = new Change();
        change.project = project.withCancelRequested(Instant.now());
        for (Stage stage : stages) {
            if (!stage.state().isTerminal() || stage.isAwaitingRetry()) {
                change.put(stage.withCancelled(), StageEventType.STAGE_CANCELLED,
                    Map.of("reason", "project cancelled", "previousState", stage.state().name()));
            }
        }
        commit(change, StageEvent.ACTOR_USER);
        hooks.cancelTimers(project.projectId());
        log.info("Project {} cancelled at {}%", project.projectId(), frozenPercent);
        return true;
    }

    /**
     * Manual retry of a failed project.
     * Finally-failed transient stages go back to READY with a fresh retry budget and the
     * cancelled stages downstream of them are re-derived to PENDING.
     *
     * @return Number of stages reset; 0 when only policy or permanent failures remain
     * @throws InvalidStateException if the project is not FAILED
     * @throws PersistenceUnavailableException if the store is unreachable; nothing is reset
     */
    public synchronized int retry() {
        if (status != ProjectStatus.FAILED) {
            throw new InvalidStateException(
                "Project " + project.projectId() + " can only be retried when FAILED (status is " + status + ")");
        }

        Change change = new Change();
        boolean[] viable = new boolean[stages.length];
        int reset = 0;

        // Indices are topological, so dependencies are decided before their dependents
        for (Stage stage : stages) {
            int i = stage.index();
            if (stage.state() == StageState.SUCCEEDED) {
                viable[i] = true;
            } else if (stage.isFinallyFailed() && stage.failureClass() != null && stage.failureClass().isRetryable()) {
                change.put(stage.withRetryReset(), StageEventType.STAGE_RESET,
                    Map.of("previousError", String.valueOf(stage.errorCode())));
                viable[i] = true;
                reset++;
            } else if (stage.state() == StageState.CANCELLED && revivable(stage, viable)) {
                change.put(stage.withPending(), StageEventType.STAGE_RESET, Map.of("previousState", "CANCELLED"));
                viable[i] = true;
            } else if (stage.state() == StageState.PENDING) {
                viable[i] = true;
            }
        }

        if (reset == 0) {
            log.info("Retry of project {} found no retryable failures", project.projectId());
            return 0;
        }

        // A partial composition that already ran is redone over the scenes available after the retry
        Stage composition = stages[graph.compositionIndex()];
        if (project.compositionPolicy() == CompositionPolicy.ALLOW_PARTIAL
                && composition.state() == StageState.SUCCEEDED) {
            change.put(composition.withRecomposition(), StageEventType.STAGE_RESET, Map.of("reason", "recompose"));
            change.project = project.withFinalAsset(null);
        }

        promotePending(change);
        evaluateComposition(change);
        change.note(StageEventType.PROJECT_RETRIED, Map.of("stagesReset", reset), StageEvent.ACTOR_USER);
        commit(change, StageEvent.ACTOR_USER);
        log.info("Project {} retried; {} stages reset", project.projectId(), reset);
        return reset;
    }

    /**
     * Resume a project loaded from the store after a restart.
     * Stages found RUNNING have no record of their adapter call and are treated as transient failures.
     *
     * @throws PersistenceUnavailableException if the store is unreachable; nothing is recovered
     */
    public synchronized void recover() {
        try (LoggingContext ctx = LoggingContext.forProject(project.projectId())) {
            Change change = new Change();
            List<Stage> requeue = new ArrayList<>();
            Map<String, Duration> timers = new LinkedHashMap<>();
            List<Stage> retried = new ArrayList<>();
            Instant now = Instant.now();
            int interrupted = 0;

            if (project.isCancelRequested()) {
                for (Stage stage : stages) {
                    if (!stage.state().isTerminal() || stage.isAwaitingRetry()) {
                        change.put(stage.withCancelled(), StageEventType.STAGE_CANCELLED,
                            Map.of("reason", "project cancelled"));
                    }
                }
            } else {
                for (Stage stage : stages) {
                    if (stage.state() == StageState.RUNNING) {
                        interrupted++;
                        Duration delay = failAndMaybeRetry(change, stage, FailureClass.TRANSIENT,
                            INTERRUPTED_BY_RESTART, "Stage was running when the scheduler stopped");
                        if (delay != null) {
                            timers.put(stage.stageId(), delay);
                            retried.add(stage);
                        }
                    } else if (stage.state() == StageState.READY) {
                        requeue.add(stage);
                    } else if (stage.isAwaitingRetry()) {
                        Duration remaining = Duration.between(now, stage.retryAt());
                        timers.put(stage.stageId(), remaining.isNegative() ? Duration.ZERO : remaining);
                    }
                }
                promotePending(change);
                evaluateComposition(change);
            }

            change.note(StageEventType.PROJECT_RECOVERED,
                Map.of("interruptedStages", interrupted, "requeued", requeue.size(), "timers", timers.size()),
                StageEvent.ACTOR_RECOVERY);
            commit(change, StageEvent.ACTOR_RECOVERY);

            for (Stage stage : requeue) {
                hooks.enqueue(StageTicket.of(project.projectId(), stage.stageId(), stage.resourceClass()));
            }
            for (Stage stage : retried) {
                hooks.retryScheduled(stage.kind());
            }
            for (Map.Entry<String, Duration> timer : timers.entrySet()) {
                hooks.scheduleRetry(project.projectId(), timer.getKey(), timer.getValue());
            }
            log.info("Recovered project {} ({}): {} interrupted, {} requeued, {} retry timers",
                project.projectId(), status, interrupted, requeue.size(), timers.size());
        }
    }

    /**
     * Stop recording anything for this project. Results of stages still running are dropped silently.
     *
     * @throws InvalidStateException if the project has not finished
     */
    public synchronized void markDeleted() {
        if (!status.isTerminal()) {
            throw new InvalidStateException(
                "Project " + project.projectId() + " is " + status + "; only finished projects can be deleted");
        }
        deleted = true;
    }

    /**
     * Undo {@link #markDeleted()} after the delete could not be written.
     */
    public synchronized void clearDeleted() {
        deleted = false;
    }

    // ========== Queries ==========

    public Project project() {
        return snapshot.project();
    }

    public ProjectStatus status() {
        return snapshot.status();
    }

    /**
     * True when stored state shows work that no live scheduler owns: stages
     * READY, RUNNING or waiting for a retry timer.
     */
    public boolean needsRecovery() {
        return snapshot.stages().stream().anyMatch(Stage::isActive);
    }

    public List<Stage> stages() {
        return snapshot.stages();
    }

    public ProjectProgress progress() {
        Snapshot current = snapshot;
        return aggregator.aggregate(current.project(), graph, current.stages(), current.status(), current.percent());
    }

    public UUID projectId() {
        return graph.projectId();
    }

    public StageGraph graph() {
        return graph;
    }

    // ========== Internal Methods ==========

    /**
     * Evaluate and commit a transition under the monitor. If the store is unreachable the
     * monitor is released before waiting for it, and the transition is evaluated again.
     */
    private <T> T transact(String what, Supplier<T> transition) {
        while (true) {
            try {
                synchronized (this) {
                    return transition.get();
                }
            } catch (PersistenceUnavailableException e) {
                writer.awaitStore(what, e);
            }
        }
    }

    private Stage stage(String stageId) {
        return stages[graph.indexOf(stageId)];
    }

    /**
     * Fail a RUNNING stage into the change. Returns the backoff delay when an automatic retry
     * was scheduled, or null when the failure is final and the cascade was applied.
     */
    private Duration failAndMaybeRetry(Change change, Stage stage, FailureClass failureClass,
                                       String errorCode, String message) {
        Stage failed = stage.withFailed(failureClass, errorCode, message);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("failureClass", failureClass.name());
        details.put("errorCode", String.valueOf(errorCode));
        details.put("message", String.valueOf(message));
        details.put("attempt", stage.retryCount() + 1);

        if (failureClass.isRetryable() && retryPolicy.allowsRetry(stage.retryCount())) {
            Duration delay = retryPolicy.computeBackoff(stage.retryCount() + 1);
            change.put(failed, StageEventType.STAGE_FAILED, details);
            change.put(failed.withRetryScheduled(Instant.now().plus(delay)), StageEventType.STAGE_RETRY_SCHEDULED,
                Map.of("retry", stage.retryCount() + 1, "delayMs", delay.toMillis()));
            log.warn("Stage {} failed ({} {}); retry {} in {} ms",
                stage.stageId(), failureClass, errorCode, stage.retryCount() + 1, delay.toMillis());
            return delay;
        }

        change.put(failed, StageEventType.STAGE_FAILED, details);
        log.warn("Stage {} failed finally ({} {}): {}", stage.stageId(), failureClass, errorCode, message);
        cascadeCancel(change, stage);
        evaluateComposition(change);
        return null;
    }

    private void cascadeCancel(Change change, Stage failed) {
        boolean partial = project.compositionPolicy() == CompositionPolicy.ALLOW_PARTIAL;
        for (int index : graph.downstreamOf(failed.index())) {
            if (partial && index == graph.compositionIndex()) {
                continue;
            }
            Stage dependent = change.current(index);
            if (!dependent.state().isTerminal() || dependent.isAwaitingRetry()) {
                change.put(dependent.withCancelled(), StageEventType.STAGE_CANCELLED,
                    Map.of("reason", "upstream failed", "cause", failed.stageId()));
            }
        }
    }

    private void promoteDependents(Change change, int index) {
        for (int dependent : graph.dependents(index)) {
            promoteIfSatisfied(change, dependent);
        }
    }

    private void promotePending(Change change) {
        for (int i = 0; i < stages.length; i++) {
            promoteIfSatisfied(change, i);
        }
    }

    private void promoteIfSatisfied(Change change, int index) {
        if (index == graph.compositionIndex() && project.compositionPolicy() == CompositionPolicy.ALLOW_PARTIAL) {
            return;
        }
        Stage stage = change.current(index);
        if (stage.state() != StageState.PENDING) {
            return;
        }
        boolean satisfied = graph.dependencies(index).stream()
            .allMatch(dep -> change.current(dep).state() == StageState.SUCCEEDED);
        if (satisfied) {
            change.put(stage.withReady(), StageEventType.STAGE_READY, Map.of());
        }
    }

    /**
     * Under ALLOW_PARTIAL composition waits for every scene output to settle, then runs over the
     * scenes that succeeded, or is cancelled if none did.
     */
    private void evaluateComposition(Change change) {
        if (project.compositionPolicy() != CompositionPolicy.ALLOW_PARTIAL) {
            return;
        }
        Stage composition = change.current(graph.compositionIndex());
        if (composition.state() != StageState.PENDING) {
            return;
        }
        boolean settled = true;
        boolean anySucceeded = false;
        for (int output : graph.sceneOutputs().values()) {
            Stage stage = change.current(output);
            if (stage.state() == StageState.SUCCEEDED) {
                anySucceeded = true;
            } else if (stage.state() != StageState.CANCELLED && !stage.isFinallyFailed()) {
                settled = false;
            }
        }
        if (!settled) {
            return;
        }
        if (anySucceeded) {
            change.put(composition.withReady(), StageEventType.STAGE_READY, Map.of("partial", true));
        } else {
            change.put(composition.withCancelled(), StageEventType.STAGE_CANCELLED,
                Map.of("reason", "no scene succeeded"));
        }
    }

    private boolean revivable(Stage stage, boolean[] viable) {
        List<Integer> deps = graph.dependencies(stage.index());
        if (stage.index() == graph.compositionIndex() && project.compositionPolicy() == CompositionPolicy.ALLOW_PARTIAL) {
            return deps.stream().anyMatch(d -> viable[d]);
        }
        return deps.stream().allMatch(d -> viable[d]);
    }

    private Map<Integer, String> succeededSceneClips() {
        Map<Integer, String> clips = new LinkedHashMap<>();
        graph.sceneOutputs().forEach((sceneNumber, index) -> {
            Stage output = stages[index];
            if (output.state() == StageState.SUCCEEDED) {
                clips.put(sceneNumber, output.outputAssetKey());
            }
        });
        return Collections.unmodifiableMap(clips);
    }

    private void discard(Stage stage, String outcome) {
        log.warn("Discarding {} result of stage {} in state {}", outcome, stage.stageId(), stage.state());
        Change change = new Change();
        change.note(stage, StageEventType.STAGE_RESULT_DISCARDED, Map.of("outcome", outcome));
        commit(change, StageEvent.ACTOR_WORKER);
    }

    /**
     * Write the change with its events, then apply it. Nothing is applied or published if the write throws.
     */
    private void commit(Change change, String actor) {
        if (change.isEmpty()) {
            return;
        }

        checkReadiness(change);
        List<Stage> changed = change.changedStages();
        Project nextProject = change.project != null ? change.project : project;
        Stage[] next = stages.clone();
        for (Stage stage : changed) {
            next[stage.index()] = stage;
        }
        List<Stage> nextStages = Arrays.asList(next);

        int percent = frozenPercent != null
            ? frozenPercent
            : Math.max(highWaterPercent, aggregator.weightedPercent(nextStages));
        ProjectStatus nextStatus = ProjectStatus.derive(nextStages, nextProject.isCancelRequested());

        List<EventRecorder.Draft> drafts = new ArrayList<>();
        for (Change.Entry entry : change.entries) {
            Stage stage = entry.stage();
            drafts.add(new EventRecorder.Draft(entry.type(),
                stage != null ? stage.stageId() : null,
                stage != null ? stage.state() : null,
                entry.payload(),
                entry.actor() != null ? entry.actor() : actor));
        }
        StageEventType terminalEvent = terminalEvent(nextStatus);
        if (nextStatus != status && terminalEvent != null) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("previousStatus", status.name());
            if (nextProject.finalAssetKey() != null) {
                payload.put("finalAssetKey", nextProject.finalAssetKey());
            }
            drafts.add(new EventRecorder.Draft(terminalEvent, null, null, payload, StageEvent.ACTOR_SCHEDULER));
        }
        List<StageEvent> prepared = events.prepare(project.projectId(), drafts, percent);

        Project updatedProject = change.project;
        writer.attempt("commit " + changed.size() + " stage(s) of project " + project.projectId(), () -> {
            if (updatedProject != null) {
                projectRepository.update(updatedProject);
            }
            if (!changed.isEmpty()) {
                stageRepository.updateAll(changed);
            }
            events.store(prepared);
        });

        ProjectStatus previous = status;
        project = nextProject;
        for (Stage stage : changed) {
            stages[stage.index()] = stage;
        }
        status = nextStatus;
        if (frozenPercent == null) {
            highWaterPercent = percent;
            if (project.isCancelRequested()) {
                frozenPercent = percent;
            }
        }
        publishSnapshot();
        events.publish(prepared);

        for (Stage stage : changed) {
            if (stage.state() == StageState.READY && !project.isCancelRequested()) {
                hooks.enqueue(StageTicket.of(project.projectId(), stage.stageId(), stage.resourceClass()));
            }
        }
        if (previous != status) {
            if (terminalEvent != null) {
                log.info("Project {} is {} at {}%", project.projectId(), status, percent);
            }
            hooks.statusChanged(project, previous, status);
        }
    }

    private static StageEventType terminalEvent(ProjectStatus status) {
        return switch (status) {
            case COMPLETED -> StageEventType.PROJECT_COMPLETED;
            case FAILED -> StageEventType.PROJECT_FAILED;
            case CANCELLED -> StageEventType.PROJECT_CANCELLED;
            default -> null;
        };
    }

    /**
     * A stage may become READY only once every dependency succeeded. A partial composition
     * needs every scene output settled and at least one of them succeeded.
     */
    private void checkReadiness(Change change) {
        for (Stage stage : change.changedStages()) {
            if (stage.state() != StageState.READY) {
                continue;
            }
            List<Integer> deps = graph.dependencies(stage.index());
            boolean ok;
            if (stage.index() == graph.compositionIndex()
                    && project.compositionPolicy() == CompositionPolicy.ALLOW_PARTIAL) {
                ok = deps.stream().map(change::current).allMatch(d ->
                        d.state() == StageState.SUCCEEDED || d.state() == StageState.CANCELLED || d.isFinallyFailed())
                    && deps.stream().map(change::current).anyMatch(d -> d.state() == StageState.SUCCEEDED);
            } else {
                ok = deps.stream().map(change::current).allMatch(d -> d.state() == StageState.SUCCEEDED);
            }
            if (!ok) {
                throw new IllegalStateException("Stage " + stage.stageId() + " of project "
                    + project.projectId() + " cannot be READY before its dependencies succeeded");
            }
        }
    }

    private void publishSnapshot() {
        int percent = frozenPercent != null ? frozenPercent : highWaterPercent;
        snapshot = new Snapshot(project, List.of(stages), status, percent);
    }

    /**
     * Stages touched by one transition and its cascade, with the events to publish.
     * Later puts of the same stage overwrite earlier ones; events keep their order.
     */
    private final class Change {
        private final Map<Integer, Stage> updated = new LinkedHashMap<>();
        private final List<Entry> entries = new ArrayList<>();
        private Project project;

        /**
         * @param stage null for project-level events
         * @param actor null to use the actor of the commit
         */
        record Entry(Stage stage, StageEventType type, Map<String, ?> payload, String actor) {}

        void put(Stage stage, StageEventType type, Map<String, ?> payload) {
            updated.put(stage.index(), stage);
            entries.add(new Entry(stage, type, payload, null));
        }

        /**
         * An event about a stage whose state does not change.
         */
        void note(Stage stage, StageEventType type, Map<String, ?> payload) {
            entries.add(new Entry(stage, type, payload, null));
        }

        void note(StageEventType type, Map<String, ?> payload, String actor) {
            entries.add(new Entry(null, type, payload, actor));
        }

        Stage current(int index) {
            Stage pending = updated.get(index);
            return pending != null ? pending : stages[index];
        }

        List<Stage> changedStages() {
            return List.copyOf(updated.values());
        }

        boolean isEmpty() {
            return updated.isEmpty() && entries.isEmpty() && project == null;
        }
    }
}
