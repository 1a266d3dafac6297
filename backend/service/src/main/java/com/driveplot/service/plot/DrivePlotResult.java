package com.driveplot.service.plot;

import com.driveplot.core.model.Insight;
import com.driveplot.core.model.SeriesPoint;

import java.util.List;
import java.util.Objects;

public record DrivePlotResult(
        int gridSize,
        List<SeriesPoint> series,
        Insight insight,
        String chart,
        int failedQueries,
        int roundsRun
) {
    public DrivePlotResult {
        series = List.copyOf(series);
        Objects.requireNonNull(insight, "insight is required");
        Objects.requireNonNull(chart, "chart is required");
    }

    public int skippedTimePoints() {
        return gridSize - series.size();
    }
}
