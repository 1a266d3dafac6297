package com.driveplot.service.report;

import com.driveplot.core.model.Insight;
import com.driveplot.core.model.SeriesPoint;
import com.driveplot.core.util.JsonUtils;
import com.driveplot.service.plot.DrivePlotResult;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.time.ZonedDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class JsonReportTest {
    private static final ZonedDateTime EIGHT = ZonedDateTime.parse("2026-03-10T08:00:00-07:00[America/Los_Angeles]");

    @Test
    void serialisesSeriesInsightsAndFailureCounts() throws Exception {
        List<SeriesPoint> series = List.of(
                new SeriesPoint(EIGHT, 10.0, 14.0, 12.0),
                new SeriesPoint(EIGHT.plusMinutes(30), 20.0, 24.0, 22.0)
        );
        Insight insight = new Insight(series.get(0), 0, series.get(1), 1, 10.0);
        DrivePlotResult result = new DrivePlotResult(3, series, insight, "chart", 2, 3);

        JsonNode root = JsonUtils.objectMapper().readTree(JsonReport.from(result).toJson());

        assertEquals(2, root.get("series").size());
        JsonNode first = root.get("series").get(0);
        assertEquals("2026-03-10T08:00:00-07:00", first.get("departure").asText());
        assertEquals(10.0, first.get("optimistic_min").asDouble());
        assertEquals(14.0, first.get("pessimistic_min").asDouble());
        assertEquals(12.0, first.get("average_min").asDouble());

        JsonNode insights = root.get("insights");
        assertEquals("08:00", insights.get("best_time").get("departure").asText());
        assertEquals(12.0, insights.get("best_time").get("average_min").asDouble());
        assertEquals("08:30", insights.get("worst_time").get("departure").asText());
        assertEquals(24.0, insights.get("worst_time").get("pessimistic_min").asDouble());
        assertEquals(10.0, insights.get("time_difference_min").asDouble());

        assertEquals(2, root.get("failed_queries").asInt());
        assertEquals(1, root.get("skipped_time_points").asInt());
        assertFalse(root.has("chart"));
    }
}
