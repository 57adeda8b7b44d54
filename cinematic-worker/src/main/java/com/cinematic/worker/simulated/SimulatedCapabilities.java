package com.cinematic.worker.simulated;

import com.cinematic.core.model.SoundEffectSpec;
import com.cinematic.worker.AnimationRequest;
import com.cinematic.worker.Animator;
import com.cinematic.worker.AudioMixer;
import com.cinematic.worker.CapabilityException;
import com.cinematic.worker.ClipAsset;
import com.cinematic.worker.Composer;
import com.cinematic.worker.CompositionRequest;
import com.cinematic.worker.ImageAsset;
import com.cinematic.worker.ImageGenerator;
import com.cinematic.worker.ImageRequest;
import com.cinematic.worker.PermanentCapabilityException;
import com.cinematic.worker.TransientCapabilityException;
import com.cinematic.worker.VideoAsset;
import com.cinematic.worker.storage.AssetKeys;
import com.cinematic.worker.storage.AssetStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Offline stand-ins for the generation capabilities.
 *
 * Each call waits for the configured latency and writes a small placeholder
 * asset into the store, so the pipeline can run end to end without model
 * providers. Rate limiting can be injected to exercise the retry path.
 */
public class SimulatedCapabilities implements ImageGenerator, Animator, AudioMixer, Composer {

    private static final Logger log = LoggerFactory.getLogger(SimulatedCapabilities.class);

    public static final String RATE_LIMITED = "RATE_LIMITED";

    private final AssetStore assetStore;
    private final Duration latency;
    private final AtomicInteger pendingRateLimits = new AtomicInteger(0);

    public SimulatedCapabilities(AssetStore assetStore, Duration latency) {
        this.assetStore = assetStore;
        this.latency = latency;
    }

    /**
     * Make the next {@code count} image generations fail as rate limited (HTTP 429).
     */
    public void injectRateLimits(int count) {
        pendingRateLimits.set(count);
    }

    @Override
    public ImageAsset generateImage(ImageRequest request) throws CapabilityException {
        if (pendingRateLimits.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new TransientCapabilityException(RATE_LIMITED, "Image provider returned 429 Too Many Requests");
        }
        pause();
        String body = "SIMULATED-PNG\naspect: " + request.aspectRatio() + "\nprompt: " + request.prompt();
        String key = store(AssetKeys.Folder.IMAGES, body);
        log.info("Generated image {} for scene {}", key, request.sceneNumber());
        return new ImageAsset(key);
    }

    @Override
    public ClipAsset animate(ImageAsset image, AnimationRequest request) throws CapabilityException {
        if (request.durationSeconds() <= 0) {
            throw new PermanentCapabilityException("INVALID_DURATION", "Clip duration must be positive");
        }
        byte[] source = assetStore.get(image.key());
        pause();
        String body = "SIMULATED-MP4\nsource: " + image.key() + " (" + source.length + " bytes)"
            + "\nduration: " + request.durationSeconds() + "\naspect: " + request.aspectRatio();
        String key = store(AssetKeys.Folder.VIDEO, body);
        log.info("Animated {} into {} ({}s)", image.key(), key, request.durationSeconds());
        return new ClipAsset(key, request.durationSeconds());
    }

    @Override
    public ClipAsset mixAudio(ClipAsset clip, List<SoundEffectSpec> soundEffects) throws CapabilityException {
        assetStore.get(clip.key());
        pause();
        String effects = soundEffects.stream()
            .map(sfx -> sfx.type() + ":" + sfx.description())
            .collect(Collectors.joining("; "));
        String key = store(AssetKeys.Folder.VIDEO, "SIMULATED-MP4\nsource: " + clip.key() + "\nsfx: " + effects);
        log.info("Mixed {} sound effects into {}", soundEffects.size(), key);
        return new ClipAsset(key, clip.durationSeconds());
    }

    @Override
    public VideoAsset compose(CompositionRequest request) throws CapabilityException {
        if (request.clips().isEmpty()) {
            throw new PermanentCapabilityException("NO_CLIPS", "Nothing to compose for project " + request.projectId());
        }
        for (ClipAsset clip : request.clips()) {
            assetStore.get(clip.key());
        }
        pause();
        String body = "SIMULATED-MP4\ntitle: " + request.title()
            + "\nclips: " + request.clips().stream().map(ClipAsset::key).collect(Collectors.joining(","))
            + "\ntransitions: " + request.transitions();
        String key = store(AssetKeys.Folder.RENDERS, body);
        log.info("Composed {} clips into {} for project {}", request.clips().size(), key, request.projectId());
        return new VideoAsset(key, request.totalDurationSeconds());
    }

    // ========== Internal Methods ==========

    private String store(AssetKeys.Folder folder, String body) throws CapabilityException {
        return assetStore.put(AssetKeys.newKey(folder), body.getBytes(StandardCharsets.UTF_8), folder.contentType());
    }

    private void pause() throws TransientCapabilityException {
        if (latency.isZero() || latency.isNegative()) {
            return;
        }
        try {
            Thread.sleep(latency.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientCapabilityException("INTERRUPTED", "Simulated capability interrupted", e);
        }
    }
}
