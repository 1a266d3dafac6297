package com.driveplot.core.model;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

public record SeriesPoint(ZonedDateTime departure, double optimisticMin, double pessimisticMin, double averageMin) {
    private static final DateTimeFormatter CLOCK = DateTimeFormatter.ofPattern("HH:mm");

    public String clockTime() {
        return departure.format(CLOCK);
    }
}
