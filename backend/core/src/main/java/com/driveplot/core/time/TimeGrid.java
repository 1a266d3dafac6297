package com.driveplot.core.time;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class TimeGrid {
    private TimeGrid() {
    }

    /**
     * Departure instants from {@code start} to the last step not after {@code end}, both wall-clock times
     * on {@code date} in {@code zone}. Steps advance on the absolute time line, so a DST shift inside the
     * window changes the wall-clock labels but never the spacing.
     */
    public static List<ZonedDateTime> build(
            LocalDate date,
            LocalTime start,
            LocalTime end,
            int intervalMinutes,
            ZoneId zone
    ) {
        Objects.requireNonNull(date, "date is required");
        Objects.requireNonNull(start, "start is required");
        Objects.requireNonNull(end, "end is required");
        Objects.requireNonNull(zone, "zone is required");
        if (intervalMinutes <= 0) {
            throw new IllegalArgumentException("Interval must be a positive number of minutes: " + intervalMinutes);
        }

        ZonedDateTime first = ZonedDateTime.of(date, start, zone);
        ZonedDateTime last = ZonedDateTime.of(date, end, zone);
        if (!last.toInstant().isAfter(first.toInstant())) {
            throw new InvalidRangeException("End " + end + " must be after start " + start + " on " + date + " in " + zone);
        }

        List<ZonedDateTime> out = new ArrayList<>();
        ZonedDateTime cursor = first;
        while (!cursor.toInstant().isAfter(last.toInstant())) {
            out.add(cursor);
            cursor = cursor.plusMinutes(intervalMinutes);
        }
        return List.copyOf(out);
    }
}
