package com.driveplot.core.events;

import java.time.Instant;

public record FetchRoundStarted(
        Instant timestamp,
        int round,
        int taskCount,
        int workers
) implements Event {
    @Override
    public String type() {
        return "FetchRoundStarted";
    }
}
