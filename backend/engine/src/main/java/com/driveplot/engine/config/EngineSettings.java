package com.driveplot.engine.config;

import java.time.Duration;
import java.util.Objects;

public record EngineSettings(
        int maxRounds,
        int firstRoundConcurrency,
        int retryConcurrency,
        int perTaskRetries,
        Duration baseDelay
) {
    public static final int DEFAULT_MAX_ROUNDS = 3;
    public static final int DEFAULT_FIRST_ROUND_CONCURRENCY = 30;
    public static final int DEFAULT_RETRY_CONCURRENCY = 10;
    public static final int DEFAULT_PER_TASK_RETRIES = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(500);

    public EngineSettings {
        Objects.requireNonNull(baseDelay, "baseDelay is required");
        if (maxRounds < 1) {
            throw new IllegalArgumentException("maxRounds must be at least 1");
        }
        if (firstRoundConcurrency < 1 || retryConcurrency < 1) {
            throw new IllegalArgumentException("Concurrency limits must be at least 1");
        }
        if (maxRounds > 1 && retryConcurrency >= firstRoundConcurrency) {
            throw new IllegalArgumentException("retryConcurrency (" + retryConcurrency
                    + ") must be lower than firstRoundConcurrency (" + firstRoundConcurrency + ")");
        }
        if (perTaskRetries < 1) {
            throw new IllegalArgumentException("perTaskRetries must be at least 1");
        }
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative");
        }
    }

    public static EngineSettings defaults() {
        return new EngineSettings(
                DEFAULT_MAX_ROUNDS,
                DEFAULT_FIRST_ROUND_CONCURRENCY,
                DEFAULT_RETRY_CONCURRENCY,
                DEFAULT_PER_TASK_RETRIES,
                DEFAULT_BASE_DELAY
        );
    }

    public int workersForRound(int round) {
        return round == 0 ? firstRoundConcurrency : retryConcurrency;
    }

    public Duration backoffAfterAttempt(int attemptIndex) {
        return baseDelay.multipliedBy(attemptIndex + 1L);
    }
}
