package com.driveplot.engine.assemble;

import com.driveplot.core.model.Insight;
import com.driveplot.core.model.SeriesPoint;
import com.driveplot.core.model.TrafficModel;
import com.driveplot.core.util.Minutes;
import com.driveplot.engine.fetch.ResultTable;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;

public class ResultAssembler {

    public AssembledResult assemble(ResultTable table) {
        return assemble(table.snapshot());
    }

    /**
     * Keeps only departures where both sampled models succeeded, in ascending order. Best and worst are
     * the minimum and maximum average; on ties the earliest departure wins.
     *
     * @throws EmptySeriesException when no departure has both models
     */
    public AssembledResult assemble(NavigableMap<ZonedDateTime, Map<TrafficModel, Double>> rows) {
        List<SeriesPoint> series = new ArrayList<>();
        for (Map.Entry<ZonedDateTime, Map<TrafficModel, Double>> entry : rows.entrySet()) {
            Double optimistic = entry.getValue().get(TrafficModel.OPTIMISTIC);
            Double pessimistic = entry.getValue().get(TrafficModel.PESSIMISTIC);
            if (optimistic == null || pessimistic == null) {
                continue;
            }
            series.add(new SeriesPoint(
                    entry.getKey(),
                    optimistic,
                    pessimistic,
                    Minutes.average(optimistic, pessimistic)
            ));
        }
        if (series.isEmpty()) {
            throw new EmptySeriesException("No departure time has both optimistic and pessimistic durations");
        }

        int bestIndex = 0;
        int worstIndex = 0;
        for (int i = 1; i < series.size(); i++) {
            double average = series.get(i).averageMin();
            if (average < series.get(bestIndex).averageMin()) {
                bestIndex = i;
            }
            if (average > series.get(worstIndex).averageMin()) {
                worstIndex = i;
            }
        }
        SeriesPoint best = series.get(bestIndex);
        SeriesPoint worst = series.get(worstIndex);
        Insight insight = new Insight(
                best,
                bestIndex,
                worst,
                worstIndex,
                Minutes.difference(worst.averageMin(), best.averageMin())
        );
        return new AssembledResult(series, insight);
    }
}
