package com.driveplot.core.events;

import com.driveplot.core.model.TrafficModel;

import java.time.Instant;
import java.time.ZonedDateTime;

public record TaskFetched(
        Instant timestamp,
        int round,
        ZonedDateTime departure,
        TrafficModel model,
        boolean success,
        int attempts
) implements Event {
    @Override
    public String type() {
        return "TaskFetched";
    }
}
