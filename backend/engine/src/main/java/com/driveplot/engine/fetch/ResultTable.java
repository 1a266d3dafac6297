package com.driveplot.engine.fetch;

import com.driveplot.core.model.TrafficModel;

import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Durations keyed by departure instant and traffic model. Cells are write-once: a value recorded for a
 * departure and model is never replaced or removed.
 */
public final class ResultTable {
    public static final Comparator<ZonedDateTime> BY_INSTANT = Comparator.comparing(ZonedDateTime::toInstant);

    private final NavigableMap<ZonedDateTime, Map<TrafficModel, Double>> cells = new TreeMap<>(BY_INSTANT);

    public synchronized boolean record(ZonedDateTime departure, TrafficModel model, double minutes) {
        Map<TrafficModel, Double> row = cells.computeIfAbsent(departure, ignored -> new EnumMap<>(TrafficModel.class));
        return row.putIfAbsent(model, minutes) == null;
    }

    public synchronized Optional<Double> get(ZonedDateTime departure, TrafficModel model) {
        Map<TrafficModel, Double> row = cells.get(departure);
        return row == null ? Optional.empty() : Optional.ofNullable(row.get(model));
    }

    public synchronized int cellCount() {
        return cells.values().stream().mapToInt(Map::size).sum();
    }

    public synchronized boolean isEmpty() {
        return cells.isEmpty();
    }

    public synchronized NavigableMap<ZonedDateTime, Map<TrafficModel, Double>> snapshot() {
        NavigableMap<ZonedDateTime, Map<TrafficModel, Double>> copy = new TreeMap<>(BY_INSTANT);
        cells.forEach((departure, row) -> copy.put(departure, Collections.unmodifiableMap(new EnumMap<>(row))));
        return Collections.unmodifiableNavigableMap(copy);
    }
}
