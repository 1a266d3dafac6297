package com.driveplot.core.model;

import com.driveplot.core.events.AlertRaised;
import com.driveplot.core.events.FetchRoundCompleted;
import com.driveplot.core.events.FetchRoundStarted;
import com.driveplot.core.events.TaskFetched;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CoreModelsAndEventsTest {
    private static final Coordinate ORIGIN = new Coordinate(37.7749, -122.4194);
    private static final Coordinate DESTINATION = new Coordinate(37.3382, -121.8863);
    private static final ZonedDateTime EIGHT = ZonedDateTime.parse("2026-03-10T08:00:00-07:00[America/Los_Angeles]");

    @Test
    void coordinateParsesLatLngText() {
        assertEquals(Optional.of(ORIGIN), Coordinate.parse("37.7749,-122.4194"));
        assertEquals(Optional.of(new Coordinate(37.7, -122.4)), Coordinate.parse(" 37.7 , -122.4 "));
        assertEquals("37.7749,-122.4194", ORIGIN.asQueryValue());
        assertEquals("37.774900,-122.419400", ORIGIN.display());
    }

    @Test
    void coordinateParseRejectsAddressesAndOutOfRangeValues() {
        assertTrue(Coordinate.parse("San Francisco, CA").isEmpty());
        assertTrue(Coordinate.parse("91,0").isEmpty());
        assertTrue(Coordinate.parse("0,181").isEmpty());
        assertTrue(Coordinate.parse("1,2,3").isEmpty());
        assertTrue(Coordinate.parse("NaN,0").isEmpty());
        assertTrue(Coordinate.parse(null).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> new Coordinate(Double.NaN, 0));
    }

    @Test
    void coordinateParseAcceptsOnlyPlainDecimals() {
        assertTrue(Coordinate.parse("37d,-122f").isEmpty());
        assertTrue(Coordinate.parse("0x1p3,5").isEmpty());
        assertTrue(Coordinate.parse("3.7e1,-122").isEmpty());
        assertTrue(Coordinate.parse("+,5").isEmpty());
        assertEquals(Optional.of(new Coordinate(0.5, -12.0)), Coordinate.parse(".5,-12."));
        assertEquals(Optional.of(new Coordinate(37.0, 122.0)), Coordinate.parse("+37,+122"));
    }

    @Test
    void queryValueNeverUsesScientificNotation() {
        assertEquals("0.0005,-0.0004", new Coordinate(0.0005, -0.0004).asQueryValue());
        assertEquals("0.00000123,150", new Coordinate(1.23e-6, 150.0).asQueryValue());
        assertEquals("37,-122", new Coordinate(37.0, -122.0).asQueryValue());
        assertEquals("0,0", new Coordinate(-0.0, 0.0).asQueryValue());
    }

    @Test
    void forGridCreatesOptimisticAndPessimisticTaskPerDeparture() {
        List<ZonedDateTime> grid = List.of(EIGHT, EIGHT.plusMinutes(15), EIGHT.plusMinutes(30));

        List<FetchTask> tasks = FetchTask.forGrid(ORIGIN, DESTINATION, grid);

        assertEquals(6, tasks.size());
        assertEquals(TrafficModel.OPTIMISTIC, tasks.get(0).model());
        assertEquals(TrafficModel.PESSIMISTIC, tasks.get(1).model());
        assertEquals(EIGHT.plusMinutes(30), tasks.get(5).departure());
        assertEquals(EIGHT.toEpochSecond(), tasks.get(0).departureEpochSeconds());
        assertEquals(6, tasks.stream().distinct().count());
    }

    @Test
    void trafficModelsUseApiNames() {
        assertEquals("optimistic", TrafficModel.OPTIMISTIC.apiValue());
        assertEquals("pessimistic", TrafficModel.PESSIMISTIC.apiValue());
        assertEquals("best_guess", TrafficModel.BEST_GUESS.apiValue());
        assertFalse(TrafficModel.SAMPLED.contains(TrafficModel.BEST_GUESS));
    }

    @Test
    void fetchOutcomeCarriesExactlyOneOfMinutesOrFailure() {
        FetchTask task = new FetchTask(ORIGIN, DESTINATION, EIGHT, TrafficModel.OPTIMISTIC);

        assertTrue(FetchOutcome.success(task, 12.5).succeeded());
        FetchOutcome failed = FetchOutcome.failure(task, null);
        assertFalse(failed.succeeded());
        assertEquals("unknown failure", failed.failureMessage());
        assertThrows(IllegalArgumentException.class, () -> new FetchOutcome(task, 1.0, "both"));
        assertThrows(IllegalArgumentException.class, () -> new FetchOutcome(task, null, null));
        assertThrows(IllegalArgumentException.class, () -> FetchOutcome.success(task, -1.0));
    }

    @Test
    void placeFallsBackToQueryWhenAddressIsBlank() {
        Place place = new Place("sfo", " ", ORIGIN, null);

        assertEquals("sfo", place.formattedAddress());
        assertThrows(NullPointerException.class, () -> new Place("sfo", "SFO", null, null));
    }

    @Test
    void seriesPointFormatsLocalClockTime() {
        SeriesPoint point = new SeriesPoint(EIGHT.plusMinutes(5), 10.0, 14.0, 12.0);

        assertEquals("08:05", point.clockTime());
    }

    @Test
    void eventsExposeTypeNames() {
        Instant now = Instant.parse("2026-03-10T15:00:00Z");

        assertEquals("AlertRaised", new AlertRaised(now, "fetch", "msg", Map.of()).type());
        assertEquals("FetchRoundStarted", new FetchRoundStarted(now, 0, 8, 4).type());
        assertEquals("FetchRoundCompleted", new FetchRoundCompleted(now, 0, 8, 0, 10).type());
        assertEquals("TaskFetched", new TaskFetched(now, 0, EIGHT, TrafficModel.OPTIMISTIC, true, 1).type());
    }
}
