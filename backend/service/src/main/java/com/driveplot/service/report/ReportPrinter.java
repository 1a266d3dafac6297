package com.driveplot.service.report;

import com.driveplot.core.model.Insight;
import com.driveplot.core.model.Place;
import com.driveplot.core.model.SeriesPoint;

import java.util.List;
import java.util.Locale;

public final class ReportPrinter {
    private static final String[] HEADERS = {"Departure", "Optimistic (min)", "Pessimistic (min)", "Average (min)"};

    private ReportPrinter() {
    }

    public static String candidates(String label, List<Place> places) {
        StringBuilder out = new StringBuilder(label).append(" candidates:\n");
        for (int i = 0; i < places.size(); i++) {
            Place place = places.get(i);
            out.append(String.format(
                    Locale.ROOT,
                    "  %d. %s  (%s)%n",
                    i + 1,
                    place.formattedAddress(),
                    place.location().display()
            ));
        }
        return out.toString();
    }

    public static String table(List<SeriesPoint> series) {
        int[] widths = new int[HEADERS.length];
        for (int i = 0; i < HEADERS.length; i++) {
            widths[i] = HEADERS[i].length();
        }
        String[][] rows = new String[series.size()][];
        for (int r = 0; r < series.size(); r++) {
            SeriesPoint point = series.get(r);
            rows[r] = new String[]{
                    point.clockTime(),
                    oneDecimal(point.optimisticMin()),
                    oneDecimal(point.pessimisticMin()),
                    oneDecimal(point.averageMin())
            };
            for (int c = 0; c < widths.length; c++) {
                widths[c] = Math.max(widths[c], rows[r][c].length());
            }
        }

        StringBuilder out = new StringBuilder();
        appendRow(out, HEADERS, widths);
        StringBuilder rule = new StringBuilder();
        for (int c = 0; c < widths.length; c++) {
            rule.append(c == 0 ? "" : "-+-").append("-".repeat(widths[c]));
        }
        out.append(rule).append('\n');
        for (String[] row : rows) {
            appendRow(out, row, widths);
        }
        return out.toString();
    }

    public static String keyPoints(Insight insight) {
        return "Key Points (Average Drive Time):\n"
                + String.format(Locale.ROOT, "  Best time:    %s -> %.1f minutes%n",
                insight.best().clockTime(), insight.best().averageMin())
                + String.format(Locale.ROOT, "  Worst time:   %s -> %.1f minutes%n",
                insight.worst().clockTime(), insight.worst().averageMin())
                + String.format(Locale.ROOT, "  Difference:   %.1f minutes%n", insight.differenceMin());
    }

    static String oneDecimal(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    // Right-justified, like the numbers they hold.
    private static void appendRow(StringBuilder out, String[] cells, int[] widths) {
        for (int c = 0; c < cells.length; c++) {
            if (c > 0) {
                out.append(" | ");
            }
            out.append(" ".repeat(widths[c] - cells[c].length())).append(cells[c]);
        }
        out.append('\n');
    }
}
