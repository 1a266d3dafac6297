package com.driveplot.engine.assemble;

import com.driveplot.core.model.Insight;
import com.driveplot.core.model.SeriesPoint;

import java.util.List;
import java.util.Objects;

public record AssembledResult(List<SeriesPoint> series, Insight insight) {
    public AssembledResult {
        series = List.copyOf(series);
        Objects.requireNonNull(insight, "insight is required");
    }
}
