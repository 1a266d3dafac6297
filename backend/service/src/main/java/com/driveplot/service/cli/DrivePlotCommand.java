package com.driveplot.service.cli;

import com.driveplot.core.bus.EventBus;
import com.driveplot.core.model.Coordinate;
import com.driveplot.core.model.Place;
import com.driveplot.core.time.InvalidRangeException;
import com.driveplot.core.time.TimeGrid;
import com.driveplot.engine.api.RemoteCallException;
import com.driveplot.engine.assemble.EmptySeriesException;
import com.driveplot.engine.config.EngineSettings;
import com.driveplot.engine.fetch.BackoffSleeper;
import com.driveplot.engine.fetch.BatchFetchEngine;
import com.driveplot.service.config.ConfigLoader;
import com.driveplot.service.google.GoogleMaps;
import com.driveplot.service.plot.DrivePlotRequest;
import com.driveplot.service.plot.DrivePlotResult;
import com.driveplot.service.plot.DrivePlotService;
import com.driveplot.service.report.JsonReport;
import com.driveplot.service.report.ReportPrinter;
import org.apache.commons.cli.ParseException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class DrivePlotCommand {
    public static final int EXIT_OK = 0;
    public static final int EXIT_NO_DATA = 1;
    public static final int EXIT_DECLINED = 2;
    public static final int EXIT_USAGE = 3;
    public static final int EXIT_FAILURE = 4;

    private static final Logger LOGGER = Logger.getLogger(DrivePlotCommand.class.getName());

    private final Supplier<GoogleMaps> mapsSupplier;
    private final EventBus eventBus;
    private final Clock clock;
    private final BackoffSleeper sleeper;
    private final BufferedReader in;
    private final PrintStream out;
    private final PrintStream err;

    public DrivePlotCommand(
            Supplier<GoogleMaps> mapsSupplier,
            EventBus eventBus,
            Clock clock,
            BufferedReader in,
            PrintStream out,
            PrintStream err
    ) {
        this(mapsSupplier, eventBus, clock, BackoffSleeper.threadSleep(), in, out, err);
    }

    public DrivePlotCommand(
            Supplier<GoogleMaps> mapsSupplier,
            EventBus eventBus,
            Clock clock,
            BackoffSleeper sleeper,
            BufferedReader in,
            PrintStream out,
            PrintStream err
    ) {
        this.mapsSupplier = mapsSupplier;
        this.eventBus = eventBus;
        this.clock = clock;
        this.sleeper = sleeper;
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public int run(String[] args) {
        CommandLineOpts opts;
        DrivePlotRequest.Builder request;
        try {
            opts = CommandLineOpts.parse(args);
            if (opts.helpRequested()) {
                CommandLineOpts.printHelp(new PrintWriter(out, true, StandardCharsets.UTF_8));
                return EXIT_OK;
            }
            request = DrivePlotRequest.builder()
                    .date(opts.date())
                    .start(opts.start())
                    .end(opts.end())
                    .intervalMinutes(opts.intervalMinutes())
                    .zone(opts.zone());
            // fail on an empty window before any remote call is made
            TimeGrid.build(opts.date(), opts.start(), opts.end(), opts.intervalMinutes(), opts.zone());
        } catch (ParseException | IllegalArgumentException e) {
            err.println(e.getMessage());
            CommandLineOpts.printHelp(new PrintWriter(err, true, StandardCharsets.UTF_8));
            return EXIT_USAGE;
        }

        try {
            return execute(opts, request);
        } catch (IllegalStateException | RemoteCallException e) {
            LOGGER.log(Level.FINE, "driveplot failed", e);
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int execute(CommandLineOpts opts, DrivePlotRequest.Builder requestBuilder) {
        EngineSettings settings = opts.configFile()
                .map(ConfigLoader::loadEngineSettings)
                .orElseGet(EngineSettings::defaults);
        GoogleMaps maps = mapsSupplier.get();

        List<Place> origins = resolve(maps, opts.origin());
        List<Place> destinations = resolve(maps, opts.destination());
        if (origins.isEmpty() || destinations.isEmpty()) {
            err.println("Error: no geocoding results for " + (origins.isEmpty() ? opts.origin() : opts.destination()));
            return EXIT_FAILURE;
        }
        Place origin = origins.get(0);
        Place destination = destinations.get(0);

        PrintStream chatter = opts.json() ? err : out;
        chatter.print(ReportPrinter.candidates("Origin", origins));
        chatter.print(ReportPrinter.candidates("Destination", destinations));
        if (!opts.assumeYes() && !confirm(chatter, String.format(
                Locale.ROOT,
                "Proceed with%n  ORIGIN: %s (%s)%n  DEST:   %s (%s)",
                origin.formattedAddress(),
                origin.location().asQueryValue(),
                destination.formattedAddress(),
                destination.location().asQueryValue()
        ))) {
            chatter.println("Okay. Re-run with --origin/--destination set to lat,lng directly.");
            return EXIT_DECLINED;
        }

        opts.saveMap().ifPresent(path -> saveMap(maps, origin, destination, path, chatter));

        ProgressPrinter.attach(eventBus, err);
        DrivePlotService service = new DrivePlotService(
                new BatchFetchEngine(settings, eventBus, clock, sleeper),
                maps.routing()
        );
        DrivePlotResult result;
        try {
            result = service.plot(requestBuilder
                    .origin(origin.location())
                    .destination(destination.location())
                    .build());
        } catch (InvalidRangeException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (EmptySeriesException e) {
            err.println("Error: No valid data points retrieved. Please check your API key and network connection.");
            return EXIT_NO_DATA;
        }

        if (result.skippedTimePoints() > 0) {
            err.println("Note: " + result.skippedTimePoints() + " time points were skipped due to API failures");
        }
        if (opts.json()) {
            out.println(JsonReport.from(result).toJson());
            return EXIT_OK;
        }
        out.println();
        out.print(ReportPrinter.table(result.series()));
        if (opts.ascii()) {
            out.println();
            out.print(result.chart());
            out.println();
            out.print(ReportPrinter.keyPoints(result.insight()));
        }
        return EXIT_OK;
    }

    private List<Place> resolve(GoogleMaps maps, String text) {
        Optional<Coordinate> direct = Coordinate.parse(text);
        if (direct.isPresent()) {
            return List.of(new Place(text, text, direct.get(), null));
        }
        return maps.geocoder().resolve(text);
    }

    private boolean confirm(PrintStream prompts, String prompt) {
        prompts.print(prompt + " [y/N]: ");
        prompts.flush();
        try {
            String line = in.readLine();
            if (line == null) {
                return false;
            }
            String answer = line.trim().toLowerCase(Locale.ROOT);
            return answer.equals("y") || answer.equals("yes");
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read confirmation", e);
        }
    }

    private void saveMap(GoogleMaps maps, Place origin, Place destination, Path path, PrintStream chatter) {
        if (maps.staticMaps() == null) {
            err.println("Warning: static maps are not available");
            return;
        }
        try {
            maps.staticMaps().download(origin.location(), destination.location(), path);
            chatter.println("Saved static map -> " + path);
        } catch (RemoteCallException | IllegalStateException e) {
            LOGGER.log(Level.FINE, "Static map download failed", e);
            err.println("Warning: could not save static map: " + e.getMessage());
        }
    }
}
