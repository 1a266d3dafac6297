package com.driveplot.core.events;

import java.time.Instant;

public record FetchRoundCompleted(
        Instant timestamp,
        int round,
        int succeeded,
        int failed,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "FetchRoundCompleted";
    }
}
