package com.driveplot.service.config;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

public record ServiceConfig(
        String apiKey,
        URI googleBaseUrl,
        Duration connectTimeout,
        Duration requestTimeout,
        String truststorePath,
        String truststorePassword
) {
    public static final String API_KEY_ENV = "GOOGLE_MAPS_API_KEY";
    public static final String BASE_URL_ENV = "DRIVEPLOT_GOOGLE_BASE_URL";
    public static final String REQUEST_TIMEOUT_ENV = "DRIVEPLOT_REQUEST_TIMEOUT_SECONDS";
    public static final String TRUSTSTORE_PATH_ENV = "TRUSTSTORE_PATH";
    public static final String TRUSTSTORE_PASSWORD_ENV = "TRUSTSTORE_PASSWORD";
    public static final URI DEFAULT_BASE_URL = URI.create("https://maps.googleapis.com");

    public ServiceConfig {
        apiKey = apiKey == null ? "" : apiKey.trim();
        Objects.requireNonNull(googleBaseUrl, "googleBaseUrl is required");
        Objects.requireNonNull(connectTimeout, "connectTimeout is required");
        Objects.requireNonNull(requestTimeout, "requestTimeout is required");
    }

    public static ServiceConfig fromEnvironment(Map<String, String> env) {
        String baseUrl = env.getOrDefault(BASE_URL_ENV, "").trim();
        return new ServiceConfig(
                env.get(API_KEY_ENV),
                baseUrl.isEmpty() ? DEFAULT_BASE_URL : parseBaseUrl(baseUrl),
                Duration.ofSeconds(10),
                Duration.ofSeconds(positiveSeconds(env, REQUEST_TIMEOUT_ENV, 30)),
                env.get(TRUSTSTORE_PATH_ENV),
                env.get(TRUSTSTORE_PASSWORD_ENV)
        );
    }

    public String requireApiKey() {
        if (apiKey.isBlank()) {
            throw new IllegalStateException("Missing " + API_KEY_ENV + " env var");
        }
        return apiKey;
    }

    public URI endpoint(String path) {
        String base = googleBaseUrl.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + path);
    }

    private static URI parseBaseUrl(String value) {
        try {
            URI uri = URI.create(value);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalStateException(BASE_URL_ENV + " must be an absolute URL: " + value);
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(BASE_URL_ENV + " is not a valid URL: " + value, e);
        }
    }

    private static long positiveSeconds(Map<String, String> env, String key, long fallback) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            long value = Long.parseLong(raw.trim());
            if (value <= 0) {
                throw new IllegalStateException(key + " must be positive: " + raw);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalStateException(key + " must be a whole number of seconds: " + raw, e);
        }
    }
}
