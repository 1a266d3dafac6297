package com.driveplot.engine.chart;

import com.driveplot.core.model.Insight;
import com.driveplot.core.model.SeriesPoint;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Plain-text plot of optimistic ({@code +}), pessimistic ({@code o}) and average ({@code *}) durations,
 * one column per departure, with {@code B}/{@code W} marking the best and worst average.
 */
public class TextChart {
    public static final int DEFAULT_HEIGHT = 20;

    static final char OPTIMISTIC = '+';
    static final char PESSIMISTIC = 'o';
    static final char AVERAGE = '*';
    static final char BEST = 'B';
    static final char WORST = 'W';

    // Width of "%3d min | ", the prefix of every value row.
    private static final int LABEL_WIDTH = 10;

    private final int height;

    public TextChart() {
        this(DEFAULT_HEIGHT);
    }

    public TextChart(int height) {
        if (height < 2) {
            throw new IllegalArgumentException("Chart height must be at least 2 rows");
        }
        this.height = height;
    }

    public String render(List<SeriesPoint> series, Insight insight, int intervalMinutes) {
        Objects.requireNonNull(insight, "insight is required");
        if (series.isEmpty()) {
            throw new IllegalArgumentException("Cannot chart an empty series");
        }

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (SeriesPoint point : series) {
            min = Math.min(min, Math.min(point.optimisticMin(), point.pessimisticMin()));
            max = Math.max(max, Math.max(point.optimisticMin(), point.pessimisticMin()));
        }
        Scale scale = new Scale(min, max, height);

        int width = series.size();
        char[][] grid = new char[height][width];
        for (char[] row : grid) {
            Arrays.fill(row, ' ');
        }

        for (int column = 0; column < width; column++) {
            SeriesPoint point = series.get(column);
            placeIfEmpty(grid, scale.row(point.pessimisticMin()), column, PESSIMISTIC);
            placeIfEmpty(grid, scale.row(point.optimisticMin()), column, OPTIMISTIC);
            grid[scale.row(point.averageMin())][column] = AVERAGE;
        }
        grid[scale.row(insight.best().averageMin())][insight.bestIndex()] = BEST;
        grid[scale.row(insight.worst().averageMin())][insight.worstIndex()] = WORST;

        StringBuilder out = new StringBuilder();
        for (int row = 0; row < height; row++) {
            out.append(String.format(Locale.ROOT, "%3d min | ", (int) scale.valueAt(row)))
                    .append(grid[row])
                    .append('\n');
        }
        out.append("        +").append("-".repeat(width)).append('\n');
        out.append(hourAxis(series)).append('\n');
        out.append(" ".repeat(LABEL_WIDTH)).append("Hour of Day\n");
        out.append('\n');
        out.append("LEGEND:\n");
        out.append("  + = Optimistic  |  o = Pessimistic  |  * = Average\n");
        out.append(String.format(
                Locale.ROOT,
                "  B = Best (%s, %.1f min)  |  W = Worst (%s, %.1f min)%n",
                insight.best().clockTime(),
                insight.best().averageMin(),
                insight.worst().clockTime(),
                insight.worst().averageMin()
        ));
        out.append("  One column per ").append(intervalMinutes).append(" min\n");
        return out.toString();
    }

    // Labels sit under their own column; one that would touch the previous label is left out.
    static String hourAxis(List<SeriesPoint> series) {
        StringBuilder axis = new StringBuilder(" ".repeat(LABEL_WIDTH));
        int nextFreeColumn = 0;
        for (int column = 0; column < series.size(); column++) {
            SeriesPoint point = series.get(column);
            if (point.departure().getMinute() != 0 || column < nextFreeColumn) {
                continue;
            }
            String label = Integer.toString(point.departure().getHour());
            axis.append(" ".repeat(LABEL_WIDTH + column - axis.length())).append(label);
            nextFreeColumn = column + label.length() + 1;
        }
        return axis.toString();
    }

    private static void placeIfEmpty(char[][] grid, int row, int column, char marker) {
        if (grid[row][column] == ' ') {
            grid[row][column] = marker;
        }
    }

    private record Scale(double min, double max, int height) {
        int row(double value) {
            double range = max - min;
            if (range <= 0) {
                return height - 1;
            }
            int scaled = (int) ((value - min) / range * (height - 1));
            scaled = Math.max(0, Math.min(height - 1, scaled));
            return height - 1 - scaled;
        }

        double valueAt(int row) {
            return max - ((double) row / (height - 1)) * (max - min);
        }
    }
}
