package com.driveplot.service.cli;

import com.driveplot.service.plot.DrivePlotRequest;
import org.apache.commons.cli.ParseException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandLineOptsTest {
    private static final String[] REQUIRED = {
            "--origin", "San Francisco, CA",
            "--destination", "37.3382,-121.8863",
            "--date", "2026-03-10",
            "--start", "7:05",
            "--end", "10:00"
    };

    @Test
    void parsesRequiredOptionsAndAppliesDefaults() throws Exception {
        CommandLineOpts opts = CommandLineOpts.parse(REQUIRED);

        assertEquals("San Francisco, CA", opts.origin());
        assertEquals("37.3382,-121.8863", opts.destination());
        assertEquals(LocalDate.of(2026, 3, 10), opts.date());
        assertEquals(LocalTime.of(7, 5), opts.start());
        assertEquals(LocalTime.of(10, 0), opts.end());
        assertEquals(DrivePlotRequest.DEFAULT_INTERVAL_MINUTES, opts.intervalMinutes());
        assertEquals(DrivePlotRequest.DEFAULT_ZONE, opts.zone());
        assertFalse(opts.ascii());
        assertFalse(opts.json());
        assertFalse(opts.assumeYes());
        assertEquals(Optional.empty(), opts.saveMap());
        assertEquals(Optional.empty(), opts.configFile());
    }

    @Test
    void parsesOptionalFlagsAndValues() throws Exception {
        CommandLineOpts opts = CommandLineOpts.parse(concat(REQUIRED,
                "--interval", "10", "--tz", "Europe/Berlin", "--ascii", "--json", "-y",
                "--save-map", "out/route.png", "--config", "engine.json"));

        assertEquals(10, opts.intervalMinutes());
        assertEquals(ZoneId.of("Europe/Berlin"), opts.zone());
        assertTrue(opts.ascii());
        assertTrue(opts.json());
        assertTrue(opts.assumeYes());
        assertEquals(Optional.of(Path.of("out/route.png")), opts.saveMap());
        assertEquals(Optional.of(Path.of("engine.json")), opts.configFile());
    }

    @Test
    void missingRequiredOptionOrStrayArgumentIsAParseError() {
        ParseException missing = assertThrows(ParseException.class,
                () -> CommandLineOpts.parse(new String[]{"--origin", "a", "--destination", "b"}));
        assertTrue(missing.getMessage().contains("--date"));

        assertThrows(ParseException.class, () -> CommandLineOpts.parse(concat(REQUIRED, "extra")));
        assertThrows(ParseException.class, () -> CommandLineOpts.parse(concat(REQUIRED, "--colour")));
    }

    @Test
    void helpNeedsNoOtherOptions() throws Exception {
        assertTrue(CommandLineOpts.parse(new String[]{"--help"}).helpRequested());
        assertTrue(CommandLineOpts.parse(new String[]{"-h"}).helpRequested());
    }

    @Test
    void malformedValuesAreRejected() throws Exception {
        assertThrows(IllegalArgumentException.class,
                () -> CommandLineOpts.parse(concat(REQUIRED, "--interval", "0")).intervalMinutes());
        assertThrows(IllegalArgumentException.class,
                () -> CommandLineOpts.parse(concat(REQUIRED, "--interval", "quarter")).intervalMinutes());
        assertThrows(IllegalArgumentException.class,
                () -> CommandLineOpts.parse(concat(REQUIRED, "--tz", "Mars/Olympus")).zone());

        CommandLineOpts badTimes = CommandLineOpts.parse(new String[]{
                "--origin", "a", "--destination", "b", "--date", "10/03/2026", "--start", "25:00", "--end", "9am"
        });
        assertThrows(IllegalArgumentException.class, badTimes::date);
        assertThrows(IllegalArgumentException.class, badTimes::start);
        assertThrows(IllegalArgumentException.class, badTimes::end);
    }

    private static String[] concat(String[] head, String... tail) {
        String[] out = new String[head.length + tail.length];
        System.arraycopy(head, 0, out, 0, head.length);
        System.arraycopy(tail, 0, out, head.length, tail.length);
        return out;
    }
}
