package com.driveplot.service.cli;

import com.driveplot.service.plot.DrivePlotRequest;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

final class CommandLineOpts {
    static final String ORIGIN_OPT = "origin";
    static final String DESTINATION_OPT = "destination";
    static final String DATE_OPT = "date";
    static final String START_OPT = "start";
    static final String END_OPT = "end";
    static final String INTERVAL_OPT = "interval";
    static final String TZ_OPT = "tz";
    static final String ASCII_OPT = "ascii";
    static final String JSON_OPT = "json";
    static final String SAVE_MAP_OPT = "save-map";
    static final String CONFIG_OPT = "config";
    static final String YES_OPT = "yes";
    static final String HELP_OPT = "help";

    private static final DateTimeFormatter CLOCK = DateTimeFormatter.ofPattern("H:mm");

    private final CommandLine cmd;

    private CommandLineOpts(CommandLine cmd) {
        this.cmd = cmd;
    }

    static CommandLineOpts parse(String[] args) throws ParseException {
        CommandLine cmd = new DefaultParser().parse(options(), args, false);
        if (!cmd.getArgList().isEmpty()) {
            throw new ParseException("Unexpected argument(s): " + cmd.getArgList());
        }
        CommandLineOpts opts = new CommandLineOpts(cmd);
        if (!opts.helpRequested()) {
            for (String required : new String[]{ORIGIN_OPT, DESTINATION_OPT, DATE_OPT, START_OPT, END_OPT}) {
                if (!cmd.hasOption(required)) {
                    throw new ParseException("Missing required option: --" + required);
                }
            }
        }
        return opts;
    }

    static Options options() {
        Options options = new Options();
        options.addOption(valued(ORIGIN_OPT, "TEXT", "Origin address, place name or 'lat,lng'"));
        options.addOption(valued(DESTINATION_OPT, "TEXT", "Destination address, place name or 'lat,lng'"));
        options.addOption(valued(DATE_OPT, "YYYY-MM-DD", "Departure date, local to --tz"));
        options.addOption(valued(START_OPT, "HH:MM", "First departure time (24h)"));
        options.addOption(valued(END_OPT, "HH:MM", "Last departure time (24h)"));
        options.addOption(valued(INTERVAL_OPT, "MINUTES", "Minutes between samples (default 15)"));
        options.addOption(valued(TZ_OPT, "ZONE", "Time zone id (default America/Los_Angeles)"));
        options.addOption(valued(SAVE_MAP_OPT, "PNG_PATH", "Save a static map of origin and destination"));
        options.addOption(valued(CONFIG_OPT, "JSON_PATH", "Engine settings file (rounds, workers, retries)"));
        options.addOption(flag(ASCII_OPT, "Render the text chart and key points"));
        options.addOption(flag(JSON_OPT, "Print the result as JSON instead of a table"));
        options.addOption(Option.builder("y").longOpt(YES_OPT).desc("Skip interactive confirmation").build());
        options.addOption(Option.builder("h").longOpt(HELP_OPT).desc("Print all command line options, then exit").build());
        return options;
    }

    static void printHelp(PrintWriter writer) {
        new HelpFormatter().printHelp(
                writer,
                HelpFormatter.DEFAULT_WIDTH,
                "driveplot",
                "Plot driving time across a day",
                options(),
                HelpFormatter.DEFAULT_LEFT_PAD,
                HelpFormatter.DEFAULT_DESC_PAD,
                null,
                true
        );
        writer.flush();
    }

    boolean helpRequested() {
        return cmd.hasOption(HELP_OPT);
    }

    String origin() {
        return cmd.getOptionValue(ORIGIN_OPT).trim();
    }

    String destination() {
        return cmd.getOptionValue(DESTINATION_OPT).trim();
    }

    LocalDate date() {
        String raw = cmd.getOptionValue(DATE_OPT);
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("--date must be YYYY-MM-DD: " + raw, e);
        }
    }

    LocalTime start() {
        return clockTime(START_OPT);
    }

    LocalTime end() {
        return clockTime(END_OPT);
    }

    int intervalMinutes() {
        String raw = cmd.getOptionValue(INTERVAL_OPT);
        if (raw == null) {
            return DrivePlotRequest.DEFAULT_INTERVAL_MINUTES;
        }
        try {
            int interval = Integer.parseInt(raw.trim());
            if (interval <= 0) {
                throw new IllegalArgumentException("--interval must be positive: " + raw);
            }
            return interval;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--interval must be a whole number of minutes: " + raw, e);
        }
    }

    ZoneId zone() {
        String raw = cmd.getOptionValue(TZ_OPT);
        if (raw == null) {
            return DrivePlotRequest.DEFAULT_ZONE;
        }
        try {
            return ZoneId.of(raw.trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("--tz is not a known time zone: " + raw, e);
        }
    }

    boolean ascii() {
        return cmd.hasOption(ASCII_OPT);
    }

    boolean json() {
        return cmd.hasOption(JSON_OPT);
    }

    boolean assumeYes() {
        return cmd.hasOption(YES_OPT);
    }

    Optional<Path> saveMap() {
        return Optional.ofNullable(cmd.getOptionValue(SAVE_MAP_OPT)).map(Path::of);
    }

    Optional<Path> configFile() {
        return Optional.ofNullable(cmd.getOptionValue(CONFIG_OPT)).map(Path::of);
    }

    private LocalTime clockTime(String option) {
        String raw = cmd.getOptionValue(option);
        try {
            return LocalTime.parse(raw.trim(), CLOCK);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("--" + option + " must be HH:MM (24h): " + raw, e);
        }
    }

    private static Option valued(String longOpt, String argName, String description) {
        return Option.builder().longOpt(longOpt).hasArg().argName(argName).desc(description).build();
    }

    private static Option flag(String longOpt, String description) {
        return Option.builder().longOpt(longOpt).desc(description).build();
    }
}
