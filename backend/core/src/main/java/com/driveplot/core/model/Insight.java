package com.driveplot.core.model;

import java.util.Objects;

public record Insight(SeriesPoint best, int bestIndex, SeriesPoint worst, int worstIndex, double differenceMin) {
    public Insight {
        Objects.requireNonNull(best, "best is required");
        Objects.requireNonNull(worst, "worst is required");
    }
}
