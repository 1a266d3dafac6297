package com.driveplot.engine.fetch;

import com.driveplot.core.model.FetchTask;

import java.util.List;
import java.util.Objects;

public record FetchReport(ResultTable table, List<FetchTask> unsatisfied, int roundsRun) {
    public FetchReport {
        Objects.requireNonNull(table, "table is required");
        unsatisfied = List.copyOf(unsatisfied);
    }

    public int failedCount() {
        return unsatisfied.size();
    }

    public boolean complete() {
        return unsatisfied.isEmpty();
    }
}
