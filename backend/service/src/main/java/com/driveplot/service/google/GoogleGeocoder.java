package com.driveplot.service.google;

import com.driveplot.core.model.Coordinate;
import com.driveplot.core.model.Place;
import com.driveplot.engine.api.Geocoder;
import com.driveplot.service.config.ServiceConfig;
import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class GoogleGeocoder implements Geocoder {
    private static final String PATH = "/maps/api/geocode/json";

    private final HttpClient httpClient;
    private final ServiceConfig config;
    private final String apiKey;

    public GoogleGeocoder(HttpClient httpClient, ServiceConfig config) {
        this.httpClient = httpClient;
        this.config = config;
        this.apiKey = config.requireApiKey();
    }

    @Override
    public List<Place> resolve(String query) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("address", query);
        params.put("key", apiKey);
        URI uri = URI.create(config.endpoint(PATH) + "?" + GoogleHttp.query(params));

        JsonNode root = GoogleHttp.getJson(httpClient, uri, config.requestTimeout(), "Geocoding");
        String status = root.path("status").asText("");
        if (!"OK".equals(status) && !"ZERO_RESULTS".equals(status)) {
            throw new GoogleMapsException("Geocoding failed: " + status);
        }

        List<Place> places = new ArrayList<>();
        for (JsonNode result : root.path("results")) {
            if (places.size() == MAX_CANDIDATES) {
                break;
            }
            JsonNode location = result.path("geometry").path("location");
            if (!location.path("lat").isNumber() || !location.path("lng").isNumber()) {
                continue;
            }
            String placeId = result.path("place_id").asText("");
            places.add(new Place(
                    query,
                    result.path("formatted_address").asText(""),
                    new Coordinate(location.path("lat").asDouble(), location.path("lng").asDouble()),
                    placeId.isBlank() ? null : placeId
            ));
        }
        return List.copyOf(places);
    }
}
