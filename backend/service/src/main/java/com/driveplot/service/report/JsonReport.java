package com.driveplot.service.report;

import com.driveplot.core.model.Insight;
import com.driveplot.core.model.SeriesPoint;
import com.driveplot.core.util.JsonUtils;
import com.driveplot.service.plot.DrivePlotResult;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.time.format.DateTimeFormatter;
import java.util.List;

public record JsonReport(
        List<Row> series,
        Insights insights,
        @JsonProperty("failed_queries") int failedQueries,
        @JsonProperty("skipped_time_points") int skippedTimePoints
) {
    public static JsonReport from(DrivePlotResult result) {
        List<Row> rows = result.series().stream()
                .map(point -> new Row(
                        point.departure().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME),
                        point.optimisticMin(),
                        point.pessimisticMin(),
                        point.averageMin()
                ))
                .toList();
        Insight insight = result.insight();
        return new JsonReport(
                rows,
                new Insights(KeyTime.of(insight.best()), KeyTime.of(insight.worst()), insight.differenceMin()),
                result.failedQueries(),
                result.skippedTimePoints()
        );
    }

    public String toJson() {
        try {
            return JsonUtils.objectMapper().writerWithDefaultPrettyPrinter().writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize report", e);
        }
    }

    public record Row(
            String departure,
            @JsonProperty("optimistic_min") double optimisticMin,
            @JsonProperty("pessimistic_min") double pessimisticMin,
            @JsonProperty("average_min") double averageMin
    ) {
    }

    public record Insights(
            @JsonProperty("best_time") KeyTime bestTime,
            @JsonProperty("worst_time") KeyTime worstTime,
            @JsonProperty("time_difference_min") double timeDifferenceMin
    ) {
    }

    public record KeyTime(
            String departure,
            @JsonProperty("average_min") double averageMin,
            @JsonProperty("optimistic_min") double optimisticMin,
            @JsonProperty("pessimistic_min") double pessimisticMin
    ) {
        static KeyTime of(SeriesPoint point) {
            return new KeyTime(point.clockTime(), point.averageMin(), point.optimisticMin(), point.pessimisticMin());
        }
    }
}
