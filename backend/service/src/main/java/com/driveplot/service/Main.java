package com.driveplot.service;

import com.driveplot.core.bus.EventBus;
import com.driveplot.service.cli.DrivePlotCommand;
import com.driveplot.service.config.ServiceConfig;
import com.driveplot.service.google.GoogleMaps;
import com.driveplot.service.http.HttpClientFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Map;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());
    private static final String LOGGING_RESOURCE = "/driveplot-logging.properties";

    private Main() {
    }

    public static void main(String[] args) {
        configureLogging();
        Map<String, String> env = System.getenv();
        DrivePlotCommand command = new DrivePlotCommand(
                () -> {
                    ServiceConfig config = ServiceConfig.fromEnvironment(env);
                    return GoogleMaps.create(config, HttpClientFactory.create(config));
                },
                new EventBus(),
                Clock.systemDefaultZone(),
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                System.out,
                System.err
        );
        System.exit(command.run(args));
    }

    static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream(LOGGING_RESOURCE)) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.warning("Unable to load " + LOGGING_RESOURCE + ": " + e.getMessage());
        }
    }
}
