package com.driveplot.service.google;

import com.driveplot.core.model.Coordinate;
import com.driveplot.service.config.ServiceConfig;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public final class StaticMapClient {
    private static final String PATH = "/maps/api/staticmap";
    private static final String SIZE = "640x400";
    private static final int SCALE = 2;
    private static final String MAP_TYPE = "roadmap";

    private final HttpClient httpClient;
    private final ServiceConfig config;
    private final String apiKey;

    public StaticMapClient(HttpClient httpClient, ServiceConfig config) {
        this.httpClient = httpClient;
        this.config = config;
        this.apiKey = config.requireApiKey();
    }

    public String buildUrl(Coordinate origin, Coordinate destination) {
        // markers repeats, so the query is assembled by hand instead of from a map
        String query = "size=" + SIZE
                + "&scale=" + SCALE
                + "&maptype=" + MAP_TYPE
                + "&markers=" + encode("color:green|label:S|" + origin.asQueryValue())
                + "&markers=" + encode("color:red|label:E|" + destination.asQueryValue())
                + "&key=" + encode(apiKey);
        return config.endpoint(PATH) + "?" + query;
    }

    public Path download(Coordinate origin, Coordinate destination, Path target) {
        byte[] image = GoogleHttp.getBytes(
                httpClient,
                URI.create(buildUrl(origin, destination)),
                config.requestTimeout(),
                "Static map"
        );
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            return Files.write(target, image);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to write static map to " + target, e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
