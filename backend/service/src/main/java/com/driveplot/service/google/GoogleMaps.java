package com.driveplot.service.google;

import com.driveplot.engine.api.Geocoder;
import com.driveplot.engine.api.RoutingClient;
import com.driveplot.service.config.ServiceConfig;

import java.net.http.HttpClient;
import java.util.Objects;

public record GoogleMaps(Geocoder geocoder, RoutingClient routing, StaticMapClient staticMaps) {
    public GoogleMaps {
        Objects.requireNonNull(geocoder, "geocoder is required");
        Objects.requireNonNull(routing, "routing is required");
    }

    public static GoogleMaps create(ServiceConfig config, HttpClient httpClient) {
        return new GoogleMaps(
                new GoogleGeocoder(httpClient, config),
                new GoogleDirectionsClient(httpClient, config),
                new StaticMapClient(httpClient, config)
        );
    }
}
