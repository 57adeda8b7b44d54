package com.cinematic.engine.execution;

import com.cinematic.core.model.ContentTarget;
import com.cinematic.core.model.FailureClass;
import com.cinematic.core.model.Project;
import com.cinematic.core.model.Scene;
import com.cinematic.core.model.SceneTransition;
import com.cinematic.core.model.Stage;
import com.cinematic.engine.config.PipelineSettings;
import com.cinematic.engine.coordinator.StageWork;
import com.cinematic.worker.AnimationRequest;
import com.cinematic.worker.Capabilities;
import com.cinematic.worker.CapabilityException;
import com.cinematic.worker.ClipAsset;
import com.cinematic.worker.CompositionRequest;
import com.cinematic.worker.ImageAsset;
import com.cinematic.worker.ImageRequest;
import com.cinematic.worker.safety.SafetyContent;
import com.cinematic.worker.safety.SafetyVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Invokes the capability adapter for a stage and classifies the result.
 *
 * Each call runs under the timeout of its stage kind. Expiry is reported as a
 * transient failure and the adapter thread is interrupted; its late result is
 * never seen by the scheduler. An adapter may ignore the interrupt, so an
 * abandoned call stays tracked until it really returns: callers use
 * {@link #awaitCallEnded} to keep its resource slot, and
 * {@link #runAfterCallEnded} to hold back another attempt of the same stage.
 */
public class StageExecutor {

    private static final Logger log = LoggerFactory.getLogger(StageExecutor.class);

    public static final String TIMEOUT = "TIMEOUT";
    public static final String POLICY_REJECTED = "POLICY_REJECTED";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";
    public static final String INTERRUPTED = "INTERRUPTED";

    private final Capabilities capabilities;
    private final PipelineSettings settings;
    private final ExecutorService adapterThreads;
    private final Map<String, AdapterCall> abandoned = new ConcurrentHashMap<>();

    public StageExecutor(Capabilities capabilities, PipelineSettings settings) {
        this.capabilities = capabilities;
        this.settings = settings;
        AtomicInteger counter = new AtomicInteger();
        this.adapterThreads = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "adapter-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Run a stage. Never throws; every failure is returned as an outcome.
     */
    public StageOutcome execute(StageWork work) {
        Stage stage = work.stage();
        Duration timeout = settings.timeout(stage.kind());

        AdapterCall call = new AdapterCall(callKey(stage.projectId(), stage.stageId()), work);
        adapterThreads.execute(call);
        try {
            return call.result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abandon(call);
            log.warn("Stage {} timed out after {}", stage.stageId(), timeout);
            return StageOutcome.failure(FailureClass.TRANSIENT, TIMEOUT,
                stage.kind() + " exceeded its timeout of " + timeout);
        } catch (InterruptedException e) {
            abandon(call);
            Thread.currentThread().interrupt();
            return StageOutcome.failure(FailureClass.TRANSIENT, INTERRUPTED, "Worker interrupted");
        } catch (ExecutionException e) {
            return classify(stage, e.getCause());
        }
    }

    /**
     * Whether an abandoned adapter call of the stage is still running.
     */
    public boolean isCallAlive(UUID projectId, String stageId) {
        AdapterCall call = abandoned.get(callKey(projectId, stageId));
        return call != null && !call.ended.isDone();
    }

    /**
     * Run {@code action} once the abandoned call of the stage has returned.
     *
     * @return false if no such call is running; {@code action} is not run
     */
    public boolean runAfterCallEnded(UUID projectId, String stageId, Runnable action) {
        AdapterCall call = abandoned.get(callKey(projectId, stageId));
        if (call == null || call.ended.isDone()) {
            return false;
        }
        call.ended.thenRun(action).exceptionally(e -> {
            log.error("Follow-up of abandoned call {} failed", call.key, e);
            return null;
        });
        return true;
    }

    /**
     * Block until an abandoned call of the stage has returned. Returns at once if there is none.
     */
    public void awaitCallEnded(StageWork work) {
        Stage stage = work.stage();
        AdapterCall call = abandoned.get(callKey(stage.projectId(), stage.stageId()));
        if (call == null || call.ended.isDone()) {
            return;
        }
        log.warn("Adapter call of {} ignored its interrupt; holding its slot until it returns", stage.stageId());
        try {
            call.ended.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Adapter call " + call.key + " ended abnormally", e.getCause());
        }
    }

    public int abandonedCount() {
        return (int) abandoned.values().stream().filter(c -> !c.ended.isDone()).count();
    }

    public void shutdown() {
        adapterThreads.shutdownNow();
    }

    // ========== Internal Methods ==========

    private StageOutcome invoke(StageWork work) throws CapabilityException {
        Stage stage = work.stage();
        Project project = work.project();
        Scene scene = work.scene();

        return switch (stage.kind()) {
            case SAFETY_CHECK -> screen(work);
            case IMAGE_GEN -> StageOutcome.success(capabilities.imageGenerator()
                .generateImage(new ImageRequest(scene.sceneNumber(), scene.styledPrompt(), project.aspectRatio()))
                .key());
            case ANIMATE -> StageOutcome.success(capabilities.animator()
                .animate(
                    new ImageAsset(work.inputAssetKey()),
                    new AnimationRequest(scene.sceneNumber(), scene.durationSeconds(), project.aspectRatio(), scene.prompt()))
                .key());
            case AUDIO_MIX -> StageOutcome.success(capabilities.audioMixer()
                .mixAudio(new ClipAsset(work.inputAssetKey(), scene.durationSeconds()), scene.soundEffects())
                .key());
            case COMPOSITION -> StageOutcome.success(capabilities.composer()
                .compose(compositionRequest(project, work.sceneClips()))
                .key());
        };
    }

    private StageOutcome screen(StageWork work) throws CapabilityException {
        Stage stage = work.stage();
        int sceneNumber = work.scene().sceneNumber();
        SafetyContent content = stage.checkTarget() == ContentTarget.IMAGE_ASSET
            ? SafetyContent.asset(sceneNumber, work.inputAssetKey())
            : SafetyContent.prompt(sceneNumber, work.scene().prompt());

        SafetyVerdict verdict = capabilities.safetyGate().evaluate(content);
        if (!verdict.allowed()) {
            log.warn("Safety gate rejected {} of scene {}: {}", content.target(), sceneNumber, verdict.reason());
            return StageOutcome.failure(FailureClass.POLICY, POLICY_REJECTED, verdict.reason());
        }
        // An image check passes the screened image through to animation
        return StageOutcome.success(content.assetKey());
    }

    /**
     * Clips of the included scenes in order, with each scene's transition toward the next included one.
     */
    static CompositionRequest compositionRequest(Project project, Map<Integer, String> sceneClips) {
        List<ClipAsset> clips = new ArrayList<>();
        List<SceneTransition> transitions = new ArrayList<>();
        Integer previous = null;
        for (Map.Entry<Integer, String> entry : sceneClips.entrySet()) {
            Scene scene = project.scene(entry.getKey());
            clips.add(new ClipAsset(entry.getValue(), scene.durationSeconds()));
            if (previous != null) {
                transitions.add(new SceneTransition(
                    previous, scene.sceneNumber(), project.scene(previous).transitionToNext()));
            }
            previous = scene.sceneNumber();
        }
        return new CompositionRequest(project.projectId(), project.title(), clips, transitions, project.aspectRatio());
    }

    private StageOutcome classify(Stage stage, Throwable cause) {
        if (cause instanceof CapabilityException ce) {
            FailureClass failureClass = ce.isRetryable() ? FailureClass.TRANSIENT : FailureClass.PERMANENT;
            log.warn("Stage {} failed ({} {}): {}", stage.stageId(), failureClass, ce.getErrorCode(), ce.getMessage());
            return StageOutcome.failure(failureClass, ce.getErrorCode(), ce.getMessage());
        }
        if (cause instanceof InterruptedException) {
            return StageOutcome.failure(FailureClass.TRANSIENT, INTERRUPTED, "Adapter call interrupted");
        }
        log.error("Unexpected error in stage {}", stage.stageId(), cause);
        return StageOutcome.failure(FailureClass.TRANSIENT, INTERNAL_ERROR,
            cause != null ? cause.getClass().getSimpleName() + ": " + cause.getMessage() : "unknown error");
    }

    private void abandon(AdapterCall call) {
        call.interrupt();
        abandoned.put(call.key, call);
        if (call.ended.isDone()) {
            abandoned.remove(call.key, call);
        }
    }

    private static String callKey(UUID projectId, String stageId) {
        return projectId + "/" + stageId;
    }

    /**
     * One adapter invocation. {@code ended} completes when the adapter thread is done with it,
     * which may be long after the caller stopped waiting for {@code result}.
     */
    private final class AdapterCall implements Runnable {
        private final String key;
        private final StageWork work;
        private final CompletableFuture<StageOutcome> result = new CompletableFuture<>();
        private final CompletableFuture<Void> ended = new CompletableFuture<>();
        private Thread runner;
        private boolean interrupted;

        AdapterCall(String key, StageWork work) {
            this.key = key;
            this.work = work;
        }

        @Override
        public void run() {
            synchronized (this) {
                if (interrupted) {
                    result.completeExceptionally(new InterruptedException("Abandoned before it started"));
                    finish();
                    return;
                }
                runner = Thread.currentThread();
            }
            try {
                result.complete(invoke(work));
            } catch (Exception e) {
                result.completeExceptionally(e);
            } finally {
                synchronized (this) {
                    runner = null;
                }
                // Clear an interrupt that arrived after the adapter returned
                Thread.interrupted();
                finish();
            }
        }

        synchronized void interrupt() {
            interrupted = true;
            if (runner != null) {
                runner.interrupt();
            }
        }

        private void finish() {
            ended.complete(null);
            abandoned.remove(key, this);
        }
    }
}
