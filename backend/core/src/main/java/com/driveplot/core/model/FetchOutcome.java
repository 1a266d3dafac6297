package com.driveplot.core.model;

import java.util.Objects;

public record FetchOutcome(FetchTask task, Double minutes, String failureMessage) {
    public FetchOutcome {
        Objects.requireNonNull(task, "task is required");
        if ((minutes == null) == (failureMessage == null)) {
            throw new IllegalArgumentException("Outcome must carry either minutes or a failure message");
        }
        if (minutes != null && (minutes < 0 || minutes.isNaN())) {
            throw new IllegalArgumentException("Duration must be non-negative: " + minutes);
        }
    }

    public static FetchOutcome success(FetchTask task, double minutes) {
        return new FetchOutcome(task, minutes, null);
    }

    public static FetchOutcome failure(FetchTask task, String failureMessage) {
        return new FetchOutcome(task, null, failureMessage == null ? "unknown failure" : failureMessage);
    }

    public boolean succeeded() {
        return minutes != null;
    }
}
