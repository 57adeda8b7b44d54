package com.cinematic.api.config;

import com.cinematic.core.model.CompositionPolicy;
import com.cinematic.core.model.Project;
import com.cinematic.core.model.ResourceClass;
import com.cinematic.core.model.RetryPolicy;
import com.cinematic.core.model.StageKind;
import com.cinematic.engine.config.PipelineSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Pipeline settings bound from the {@code cinematic} prefix.
 */
@ConfigurationProperties(prefix = "cinematic")
public record PipelineProperties(
    Slots slots,
    Retry retry,
    Map<StageKind, Duration> stageTimeouts,
    CompositionPolicy compositionPolicy,
    boolean screenGeneratedImages,
    String defaultAspectRatio,
    Safety safety,
    Persistence persistence,
    Simulation simulation,
    Duration shutdownTimeout,
    Duration probeInterval
) {
    public enum Persistence { MEMORY, JDBC }

    public record Slots(Integer gpu, Integer cpu) {}

    public record Retry(
        Integer maxAttempts,
        Duration initialBackoff,
        Duration maxBackoff,
        Double multiplier,
        Double jitter
    ) {}

    public record Safety(List<String> blockedTerms) {}

    public record Simulation(Duration latency) {}

    public PipelineProperties {
        slots = slots != null ? slots : new Slots(null, null);
        retry = retry != null ? retry : new Retry(null, null, null, null, null);
        stageTimeouts = stageTimeouts != null ? stageTimeouts : Map.of();
        compositionPolicy = compositionPolicy != null ? compositionPolicy : CompositionPolicy.REQUIRE_ALL_SCENES;
        defaultAspectRatio = defaultAspectRatio != null ? defaultAspectRatio : Project.DEFAULT_ASPECT_RATIO;
        safety = safety != null && safety.blockedTerms() != null ? safety : new Safety(List.of());
        persistence = persistence != null ? persistence : Persistence.MEMORY;
        simulation = simulation != null && simulation.latency() != null ? simulation : new Simulation(Duration.ofMillis(200));
        shutdownTimeout = shutdownTimeout != null ? shutdownTimeout : Duration.ofSeconds(30);
        probeInterval = probeInterval != null ? probeInterval : Duration.ofSeconds(5);
    }

    /**
     * Engine settings; anything left unset keeps the engine default.
     */
    public PipelineSettings toSettings() {
        PipelineSettings.Builder builder = PipelineSettings.builder()
            .stageTimeouts(stageTimeouts)
            .compositionPolicy(compositionPolicy)
            .screenGeneratedImages(screenGeneratedImages)
            .defaultAspectRatio(defaultAspectRatio)
            .shutdownTimeout(shutdownTimeout)
            .retryPolicy(retryPolicy());
        if (slots.gpu() != null) {
            builder.slots(ResourceClass.GPU, slots.gpu());
        }
        if (slots.cpu() != null) {
            builder.slots(ResourceClass.CPU, slots.cpu());
        }
        return builder.build();
    }

    private RetryPolicy retryPolicy() {
        RetryPolicy defaults = RetryPolicy.defaultPolicy();
        return RetryPolicy.builder()
            .maxAttempts(retry.maxAttempts() != null ? retry.maxAttempts() : defaults.maxAttempts())
            .initialBackoff(retry.initialBackoff() != null ? retry.initialBackoff() : defaults.initialBackoff())
            .maxBackoff(retry.maxBackoff() != null ? retry.maxBackoff() : defaults.maxBackoff())
            .backoffMultiplier(retry.multiplier() != null ? retry.multiplier() : defaults.backoffMultiplier())
            .jitterFactor(retry.jitter() != null ? retry.jitter() : defaults.jitterFactor())
            .build();
    }
}
