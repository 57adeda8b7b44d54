package com.cinematic.engine.config;

import com.cinematic.core.model.CompositionPolicy;
import com.cinematic.core.model.Project;
import com.cinematic.core.model.ResourceClass;
import com.cinematic.core.model.RetryPolicy;
import com.cinematic.core.model.StageKind;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Engine settings, independent of how they are bound.
 *
 * Invariants:
 * - every resource class has at least one slot
 * - every stage kind has a positive timeout
 */
public record PipelineSettings(
    Map<ResourceClass, Integer> slots,
    RetryPolicy retryPolicy,
    Map<StageKind, Duration> stageTimeouts,
    CompositionPolicy compositionPolicy,
    boolean screenGeneratedImages,
    String defaultAspectRatio,
    Duration shutdownTimeout
) {
    public PipelineSettings {
        EnumMap<ResourceClass, Integer> slotMap = new EnumMap<>(ResourceClass.class);
        slotMap.putAll(defaultSlots());
        if (slots != null) {
            slotMap.putAll(slots);
        }
        slotMap.forEach((rc, n) -> {
            if (n == null || n < 1) {
                throw new IllegalArgumentException("Slot count for " + rc + " must be >= 1");
            }
        });
        slots = Map.copyOf(slotMap);

        EnumMap<StageKind, Duration> timeoutMap = new EnumMap<>(StageKind.class);
        timeoutMap.putAll(defaultTimeouts());
        if (stageTimeouts != null) {
            timeoutMap.putAll(stageTimeouts);
        }
        timeoutMap.forEach((kind, timeout) -> {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                throw new IllegalArgumentException("Timeout for " + kind + " must be positive");
            }
        });
        stageTimeouts = Map.copyOf(timeoutMap);

        retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
        compositionPolicy = compositionPolicy != null ? compositionPolicy : CompositionPolicy.REQUIRE_ALL_SCENES;
        defaultAspectRatio = defaultAspectRatio != null ? defaultAspectRatio : Project.DEFAULT_ASPECT_RATIO;
        shutdownTimeout = shutdownTimeout != null ? shutdownTimeout : Duration.ofSeconds(30);
    }

    public static PipelineSettings defaults() {
        return builder().build();
    }

    public int slots(ResourceClass resourceClass) {
        return slots.get(resourceClass);
    }

    public Duration timeout(StageKind kind) {
        return stageTimeouts.get(kind);
    }

    private static Map<ResourceClass, Integer> defaultSlots() {
        return Map.of(ResourceClass.GPU, 2, ResourceClass.CPU, 4);
    }

    private static Map<StageKind, Duration> defaultTimeouts() {
        return Map.of(
            StageKind.SAFETY_CHECK, Duration.ofSeconds(30),
            StageKind.IMAGE_GEN, Duration.ofMinutes(3),
            StageKind.ANIMATE, Duration.ofMinutes(10),
            StageKind.AUDIO_MIX, Duration.ofMinutes(2),
            StageKind.COMPOSITION, Duration.ofMinutes(5)
        );
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final EnumMap<ResourceClass, Integer> slots = new EnumMap<>(ResourceClass.class);
        private final EnumMap<StageKind, Duration> stageTimeouts = new EnumMap<>(StageKind.class);
        private RetryPolicy retryPolicy = RetryPolicy.defaultPolicy();
        private CompositionPolicy compositionPolicy = CompositionPolicy.REQUIRE_ALL_SCENES;
        private boolean screenGeneratedImages = false;
        private String defaultAspectRatio = Project.DEFAULT_ASPECT_RATIO;
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public Builder slots(ResourceClass resourceClass, int count) {
            this.slots.put(resourceClass, count);
            return this;
        }

        public Builder stageTimeout(StageKind kind, Duration timeout) {
            this.stageTimeouts.put(kind, timeout);
            return this;
        }

        public Builder stageTimeouts(Map<StageKind, Duration> timeouts) {
            this.stageTimeouts.putAll(timeouts);
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder compositionPolicy(CompositionPolicy compositionPolicy) {
            this.compositionPolicy = compositionPolicy;
            return this;
        }

        public Builder screenGeneratedImages(boolean screenGeneratedImages) {
            this.screenGeneratedImages = screenGeneratedImages;
            return this;
        }

        public Builder defaultAspectRatio(String defaultAspectRatio) {
            this.defaultAspectRatio = defaultAspectRatio;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public PipelineSettings build() {
            return new PipelineSettings(slots, retryPolicy, stageTimeouts, compositionPolicy,
                screenGeneratedImages, defaultAspectRatio, shutdownTimeout);
        }
    }
}
