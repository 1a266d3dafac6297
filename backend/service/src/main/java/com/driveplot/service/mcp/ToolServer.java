package com.driveplot.service.mcp;

import com.driveplot.core.util.JsonUtils;
import com.driveplot.engine.api.RemoteCallException;
import com.driveplot.engine.assemble.EmptySeriesException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpServerTransportProvider;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Publishes {@link DrivePlotTools} as Model Context Protocol tools.
 */
public final class ToolServer {
    private static final Logger LOGGER = Logger.getLogger(ToolServer.class.getName());

    public static final String SERVER_NAME = "DriveTime Plotter";
    public static final String SERVER_VERSION = "0.1.0";

    static final String GEOCODE_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "query": {"type": "string", "description": "Address or place name"}
              },
              "required": ["query"]
            }
            """;

    static final String STATIC_MAP_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "origin_lat": {"type": "number"},
                "origin_lng": {"type": "number"},
                "dest_lat": {"type": "number"},
                "dest_lng": {"type": "number"}
              },
              "required": ["origin_lat", "origin_lng", "dest_lat", "dest_lng"]
            }
            """;

    static final String ETA_SERIES_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "origin_lat": {"type": "number"},
                "origin_lng": {"type": "number"},
                "dest_lat": {"type": "number"},
                "dest_lng": {"type": "number"},
                "date": {"type": "string", "description": "YYYY-MM-DD"},
                "start": {"type": "string", "description": "HH:MM"},
                "end": {"type": "string", "description": "HH:MM"},
                "interval_minutes": {"type": "integer", "default": 15},
                "tz": {"type": "string", "default": "America/Los_Angeles"}
              },
              "required": ["origin_lat", "origin_lng", "dest_lat", "dest_lng", "date", "start", "end"]
            }
            """;

    private ToolServer() {
    }

    public static List<McpServerFeatures.SyncToolSpecification> specifications(DrivePlotTools tools) {
        return List.of(
                specification("geocode",
                        "Resolve an address or place name to up to five candidate coordinates.",
                        GEOCODE_SCHEMA, tools::geocode),
                specification("static_map",
                        "Build a Google Static Maps URL marking the start and end points.",
                        STATIC_MAP_SCHEMA, tools::staticMap),
                specification("eta_series",
                        "Fetch optimistic and pessimistic drive times for each departure in a window.",
                        ETA_SERIES_SCHEMA, tools::etaSeries)
        );
    }

    public static McpSyncServer start(DrivePlotTools tools, McpServerTransportProvider transport) {
        McpSyncServer server = McpServer.sync(transport)
                .serverInfo(SERVER_NAME, SERVER_VERSION)
                .capabilities(McpSchema.ServerCapabilities.builder().tools(true).build())
                .tools(specifications(tools))
                .build();
        LOGGER.info("Tool server '" + SERVER_NAME + "' ready");
        return server;
    }

    static McpSchema.CallToolResult call(String name, Function<Map<String, Object>, JsonNode> handler,
                                         Map<String, Object> args) {
        Map<String, Object> safeArgs = args == null ? Map.of() : args;
        try {
            return result(handler.apply(safeArgs), false);
        } catch (IllegalArgumentException | IllegalStateException | RemoteCallException | EmptySeriesException e) {
            LOGGER.log(Level.FINE, e, () -> "Tool " + name + " failed");
            LOGGER.info("Tool " + name + " failed: " + e.getMessage());
            return result(JsonUtils.objectMapper().createObjectNode().put("error", e.getMessage()), true);
        }
    }

    private static McpServerFeatures.SyncToolSpecification specification(
            String name,
            String description,
            String schema,
            Function<Map<String, Object>, JsonNode> handler
    ) {
        return new McpServerFeatures.SyncToolSpecification(
                new McpSchema.Tool(name, description, schema),
                (exchange, args) -> call(name, handler, args)
        );
    }

    private static McpSchema.CallToolResult result(JsonNode payload, boolean error) {
        try {
            String text = JsonUtils.objectMapper().writeValueAsString(payload);
            return new McpSchema.CallToolResult(List.of(new McpSchema.TextContent(text)), error);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize tool result", e);
        }
    }
}
