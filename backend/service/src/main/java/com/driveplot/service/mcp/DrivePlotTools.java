package com.driveplot.service.mcp;

import com.driveplot.core.model.Coordinate;
import com.driveplot.core.model.Place;
import com.driveplot.core.util.JsonUtils;
import com.driveplot.engine.api.RemoteCallException;
import com.driveplot.service.google.GoogleMaps;
import com.driveplot.service.plot.DrivePlotRequest;
import com.driveplot.service.plot.DrivePlotService;
import com.driveplot.service.report.JsonReport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * The three operations offered to tool-calling clients. Each takes the raw argument map of a tool call
 * and answers with a JSON document; bad arguments raise {@link IllegalArgumentException}.
 */
public class DrivePlotTools {
    private static final Logger LOGGER = Logger.getLogger(DrivePlotTools.class.getName());

    private final GoogleMaps maps;
    private final DrivePlotService plotService;

    public DrivePlotTools(GoogleMaps maps, DrivePlotService plotService) {
        this.maps = Objects.requireNonNull(maps, "maps is required");
        this.plotService = Objects.requireNonNull(plotService, "plotService is required");
    }

    /**
     * Resolves free text into up to five candidates. A rejected lookup answers {@code {"error": ...}}
     * instead of failing the call.
     */
    public JsonNode geocode(Map<String, Object> args) {
        String query = text(args, "query");
        ObjectNode result = JsonUtils.objectMapper().createObjectNode();
        List<Place> places;
        try {
            places = maps.geocoder().resolve(query);
        } catch (RemoteCallException e) {
            LOGGER.info("Geocoding failed for '" + query + "': " + e.getMessage());
            result.put("error", e.getMessage());
            return result;
        }
        ArrayNode candidates = result.putArray("candidates");
        for (Place place : places) {
            ObjectNode candidate = candidates.addObject();
            candidate.put("formatted_address", place.formattedAddress());
            candidate.put("lat", place.location().lat());
            candidate.put("lng", place.location().lng());
            candidate.put("place_id", place.placeId());
        }
        return result;
    }

    public JsonNode staticMap(Map<String, Object> args) {
        if (maps.staticMaps() == null) {
            throw new IllegalStateException("Static maps are not configured");
        }
        Coordinate origin = coordinate(args, "origin_lat", "origin_lng");
        Coordinate destination = coordinate(args, "dest_lat", "dest_lng");
        ObjectNode result = JsonUtils.objectMapper().createObjectNode();
        result.put("url", maps.staticMaps().buildUrl(origin, destination));
        return result;
    }

    /**
     * @throws com.driveplot.core.time.InvalidRangeException when the window is empty
     * @throws com.driveplot.engine.assemble.EmptySeriesException when no departure has complete data
     */
    public JsonNode etaSeries(Map<String, Object> args) {
        DrivePlotRequest request;
        try {
            request = DrivePlotRequest.builder()
                    .origin(coordinate(args, "origin_lat", "origin_lng"))
                    .destination(coordinate(args, "dest_lat", "dest_lng"))
                    .date(LocalDate.parse(text(args, "date")))
                    .start(LocalTime.parse(text(args, "start")))
                    .end(LocalTime.parse(text(args, "end")))
                    .intervalMinutes(integer(args, "interval_minutes", DrivePlotRequest.DEFAULT_INTERVAL_MINUTES))
                    .zone(zone(args))
                    .build();
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid date, time or zone: " + e.getMessage(), e);
        }
        return JsonUtils.objectMapper().valueToTree(JsonReport.from(plotService.plot(request)));
    }

    private static Coordinate coordinate(Map<String, Object> args, String latName, String lngName) {
        double lat = number(args, latName);
        double lng = number(args, lngName);
        if (!Double.isFinite(lat) || Math.abs(lat) > 90) {
            throw new IllegalArgumentException(latName + " must be between -90 and 90: " + lat);
        }
        if (!Double.isFinite(lng) || Math.abs(lng) > 180) {
            throw new IllegalArgumentException(lngName + " must be between -180 and 180: " + lng);
        }
        return new Coordinate(lat, lng);
    }

    private static ZoneId zone(Map<String, Object> args) {
        Object value = args.get("tz");
        if (value == null || value.toString().isBlank()) {
            return DrivePlotRequest.DEFAULT_ZONE;
        }
        return ZoneId.of(value.toString().trim());
    }

    private static String text(Map<String, Object> args, String name) {
        Object value = args.get(name);
        if (value == null || value.toString().isBlank()) {
            throw new IllegalArgumentException("Missing argument: " + name);
        }
        return value.toString().trim();
    }

    private static double number(Map<String, Object> args, String name) {
        Object value = args.get(name);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(text(args, name));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number: " + value, e);
        }
    }

    private static int integer(Map<String, Object> args, String name, int fallback) {
        Object value = args.get(name);
        if (value == null) {
            return fallback;
        }
        double number = number(args, name);
        if (number != Math.rint(number)) {
            throw new IllegalArgumentException(name + " must be a whole number: " + value);
        }
        return (int) number;
    }
}
