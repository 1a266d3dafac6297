package com.driveplot.service.google;

import com.driveplot.core.model.Coordinate;
import com.driveplot.core.model.TrafficModel;
import com.driveplot.engine.api.RoutingClient;
import com.driveplot.service.config.ServiceConfig;
import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.LinkedHashMap;
import java.util.Map;

public final class GoogleDirectionsClient implements RoutingClient {
    private static final String PATH = "/maps/api/directions/json";

    private final HttpClient httpClient;
    private final ServiceConfig config;
    private final String apiKey;

    public GoogleDirectionsClient(HttpClient httpClient, ServiceConfig config) {
        this.httpClient = httpClient;
        this.config = config;
        this.apiKey = config.requireApiKey();
    }

    @Override
    public long fetchDurationSeconds(
            Coordinate origin,
            Coordinate destination,
            long departureEpochSeconds,
            TrafficModel model
    ) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("origin", origin.asQueryValue());
        params.put("destination", destination.asQueryValue());
        params.put("mode", "driving");
        params.put("departure_time", Long.toString(departureEpochSeconds));
        params.put("traffic_model", model.apiValue());
        params.put("key", apiKey);
        URI uri = URI.create(config.endpoint(PATH) + "?" + GoogleHttp.query(params));

        JsonNode root = GoogleHttp.getJson(httpClient, uri, config.requestTimeout(), "Directions");
        String status = root.path("status").asText("");
        if (!"OK".equals(status)) {
            throw new GoogleMapsException("Directions failed: " + status + " - " + root.path("error_message").asText(""));
        }
        JsonNode leg = root.path("routes").path(0).path("legs").path(0);
        JsonNode value = leg.path("duration_in_traffic").path("value");
        if (!value.isNumber()) {
            value = leg.path("duration").path("value");
        }
        if (!value.isNumber()) {
            throw new GoogleMapsException("Directions response missing duration");
        }
        return value.asLong();
    }
}
