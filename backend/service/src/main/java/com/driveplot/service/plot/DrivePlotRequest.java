package com.driveplot.service.plot;

import com.driveplot.core.model.Coordinate;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Objects;

public record DrivePlotRequest(
        Coordinate origin,
        Coordinate destination,
        LocalDate date,
        LocalTime start,
        LocalTime end,
        int intervalMinutes,
        ZoneId zone
) {
    public static final int DEFAULT_INTERVAL_MINUTES = 15;
    public static final ZoneId DEFAULT_ZONE = ZoneId.of("America/Los_Angeles");

    public DrivePlotRequest {
        Objects.requireNonNull(origin, "origin is required");
        Objects.requireNonNull(destination, "destination is required");
        Objects.requireNonNull(date, "date is required");
        Objects.requireNonNull(start, "start is required");
        Objects.requireNonNull(end, "end is required");
        Objects.requireNonNull(zone, "zone is required");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Coordinate origin;
        private Coordinate destination;
        private LocalDate date;
        private LocalTime start;
        private LocalTime end;
        private int intervalMinutes = DEFAULT_INTERVAL_MINUTES;
        private ZoneId zone = DEFAULT_ZONE;

        private Builder() {
        }

        public Builder origin(Coordinate origin) {
            this.origin = origin;
            return this;
        }

        public Builder destination(Coordinate destination) {
            this.destination = destination;
            return this;
        }

        public Builder date(LocalDate date) {
            this.date = date;
            return this;
        }

        public Builder start(LocalTime start) {
            this.start = start;
            return this;
        }

        public Builder end(LocalTime end) {
            this.end = end;
            return this;
        }

        public Builder intervalMinutes(int intervalMinutes) {
            this.intervalMinutes = intervalMinutes;
            return this;
        }

        public Builder zone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public DrivePlotRequest build() {
            return new DrivePlotRequest(origin, destination, date, start, end, intervalMinutes, zone);
        }
    }
}
