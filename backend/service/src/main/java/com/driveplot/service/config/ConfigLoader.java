package com.driveplot.service.config;

import com.driveplot.core.util.JsonUtils;
import com.driveplot.engine.config.EngineSettings;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

public final class ConfigLoader {
    private ConfigLoader() {
    }

    public static EngineSettings loadEngineSettings(Path path) {
        EngineSettingsFile file = read(path);
        try {
            return new EngineSettings(
                    orDefault(file.maxRounds(), EngineSettings.DEFAULT_MAX_ROUNDS),
                    orDefault(file.firstRoundConcurrency(), EngineSettings.DEFAULT_FIRST_ROUND_CONCURRENCY),
                    orDefault(file.retryConcurrency(), EngineSettings.DEFAULT_RETRY_CONCURRENCY),
                    orDefault(file.perTaskRetries(), EngineSettings.DEFAULT_PER_TASK_RETRIES),
                    file.baseDelayMillis() == null
                            ? EngineSettings.DEFAULT_BASE_DELAY
                            : Duration.ofMillis(file.baseDelayMillis())
            );
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid engine settings in " + path + ": " + e.getMessage(), e);
        }
    }

    private static EngineSettingsFile read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, EngineSettingsFile.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }

    private static int orDefault(Integer value, int fallback) {
        return value == null ? fallback : value;
    }

    private record EngineSettingsFile(
            Integer maxRounds,
            Integer firstRoundConcurrency,
            Integer retryConcurrency,
            Integer perTaskRetries,
            Long baseDelayMillis
    ) {
    }
}
