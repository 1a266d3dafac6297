package com.driveplot.core.model;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public record FetchTask(Coordinate origin, Coordinate destination, ZonedDateTime departure, TrafficModel model) {
    public FetchTask {
        Objects.requireNonNull(origin, "origin is required");
        Objects.requireNonNull(destination, "destination is required");
        Objects.requireNonNull(departure, "departure is required");
        Objects.requireNonNull(model, "model is required");
    }

    public long departureEpochSeconds() {
        return departure.toEpochSecond();
    }

    public static List<FetchTask> forGrid(Coordinate origin, Coordinate destination, List<ZonedDateTime> grid) {
        List<FetchTask> tasks = new ArrayList<>(grid.size() * TrafficModel.SAMPLED.size());
        for (ZonedDateTime departure : grid) {
            for (TrafficModel model : TrafficModel.SAMPLED) {
                tasks.add(new FetchTask(origin, destination, departure, model));
            }
        }
        return List.copyOf(tasks);
    }
}
