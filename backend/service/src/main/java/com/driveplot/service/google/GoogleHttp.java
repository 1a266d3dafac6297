package com.driveplot.service.google;

import com.driveplot.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;

// Request URIs carry the API key, so they are kept out of exception messages.
final class GoogleHttp {
    private GoogleHttp() {
    }

    static String query(Map<String, String> params) {
        StringJoiner joiner = new StringJoiner("&");
        params.forEach((name, value) -> joiner.add(name + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8)));
        return joiner.toString();
    }

    static JsonNode getJson(HttpClient httpClient, URI uri, Duration timeout, String api) {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(timeout)
                .header("Accept", "application/json")
                .build();
        HttpResponse<String> response = send(httpClient, request, HttpResponse.BodyHandlers.ofString(), api);
        try {
            return JsonUtils.objectMapper().readTree(response.body());
        } catch (IOException e) {
            throw new GoogleMapsException(api + " response was not valid JSON", e);
        }
    }

    static byte[] getBytes(HttpClient httpClient, URI uri, Duration timeout, String api) {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(timeout)
                .build();
        return send(httpClient, request, HttpResponse.BodyHandlers.ofByteArray(), api).body();
    }

    private static <T> HttpResponse<T> send(
            HttpClient httpClient,
            HttpRequest request,
            HttpResponse.BodyHandler<T> handler,
            String api
    ) {
        try {
            HttpResponse<T> response = httpClient.send(request, handler);
            if (response.statusCode() / 100 != 2) {
                throw new GoogleMapsException(api + " request failed with status " + response.statusCode());
            }
            return response;
        } catch (IOException e) {
            throw new GoogleMapsException(api + " request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GoogleMapsException(api + " request interrupted", e);
        }
    }
}
