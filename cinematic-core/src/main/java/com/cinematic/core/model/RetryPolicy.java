package com.cinematic.core.model;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Automatic retry behavior for transient stage failures.
 *
 * Invariants:
 * - maxAttempts >= 1 (counts the first attempt)
 * - initialBackoff >= 0
 * - maxBackoff >= initialBackoff
 * - backoffMultiplier >= 1.0
 * - jitterFactor in [0.0, 1.0]
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialBackoff,
    Duration maxBackoff,
    double backoffMultiplier,
    double jitterFactor
) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be >= 0");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be in [0.0, 1.0]");
        }
    }

    /**
     * Default policy: 3 attempts, exponential backoff starting at 2s, capped at 1 minute.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(3, Duration.ofSeconds(2), Duration.ofMinutes(1), 2.0, 0.1);
    }

    /**
     * Single attempt only.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0, 0.0);
    }

    /**
     * Backoff to wait before the given retry.
     *
     * @param retryNumber 1-indexed retry number
     */
    public Duration computeBackoff(int retryNumber) {
        if (retryNumber < 1) {
            throw new IllegalArgumentException("Retry number must be >= 1");
        }

        // initialBackoff * multiplier^(retry - 1), capped
        double baseMs = initialBackoff.toMillis() * Math.pow(backoffMultiplier, retryNumber - 1);
        double cappedMs = Math.min(baseMs, maxBackoff.toMillis());

        double jitterRange = cappedMs * jitterFactor;
        double jitteredMs = cappedMs - jitterRange
            + ThreadLocalRandom.current().nextDouble() * 2 * jitterRange;

        return Duration.ofMillis((long) jitteredMs);
    }

    /**
     * Whether another automatic attempt is allowed after {@code retriesSoFar} retries have been used.
     */
    public boolean allowsRetry(int retriesSoFar) {
        return retriesSoFar + 1 < maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(2);
        private Duration maxBackoff = Duration.ofMinutes(1);
        private double backoffMultiplier = 2.0;
        private double jitterFactor = 0.1;

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder initialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder jitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(maxAttempts, initialBackoff, maxBackoff, backoffMultiplier, jitterFactor);
        }
    }
}
