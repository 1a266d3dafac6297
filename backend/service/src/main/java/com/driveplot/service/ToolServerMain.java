package com.driveplot.service;

import com.driveplot.core.bus.EventBus;
import com.driveplot.core.util.JsonUtils;
import com.driveplot.engine.config.EngineSettings;
import com.driveplot.engine.fetch.BatchFetchEngine;
import com.driveplot.service.config.ConfigLoader;
import com.driveplot.service.config.ServiceConfig;
import com.driveplot.service.google.GoogleMaps;
import com.driveplot.service.http.HttpClientFactory;
import com.driveplot.service.mcp.DrivePlotTools;
import com.driveplot.service.mcp.ToolServer;
import com.driveplot.service.plot.DrivePlotService;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Logger;

/**
 * Serves the geocode, static_map and eta_series tools over stdio. Stdout carries the protocol, so all
 * logging goes to stderr. An optional single argument names an engine settings file.
 */
public final class ToolServerMain {
    private static final Logger LOGGER = Logger.getLogger(ToolServerMain.class.getName());

    private ToolServerMain() {
    }

    public static void main(String[] args) throws InterruptedException {
        Main.configureLogging();
        EngineSettings settings = args.length > 0
                ? ConfigLoader.loadEngineSettings(Path.of(args[0]))
                : EngineSettings.defaults();
        ServiceConfig config = ServiceConfig.fromEnvironment(System.getenv());
        GoogleMaps maps = GoogleMaps.create(config, HttpClientFactory.create(config));
        DrivePlotService plotService = new DrivePlotService(
                new BatchFetchEngine(settings, new EventBus(), Clock.systemDefaultZone()),
                maps.routing()
        );

        McpSyncServer server = ToolServer.start(
                new DrivePlotTools(maps, plotService),
                new StdioServerTransportProvider(JsonUtils.objectMapper())
        );
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Stopping tool server");
            server.closeGracefully();
            stopped.countDown();
        }, "tool-server-shutdown"));
        stopped.await();
    }
}
