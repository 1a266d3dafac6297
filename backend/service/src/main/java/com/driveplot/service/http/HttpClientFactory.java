package com.driveplot.service.http;

import com.driveplot.service.config.ServiceConfig;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.util.Locale;

public final class HttpClientFactory {
    private HttpClientFactory() {
    }

    // Static map downloads are redirected to a CDN, so redirects are followed.
    public static HttpClient create(ServiceConfig config) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(config.connectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL);
        String truststorePath = config.truststorePath();
        if (truststorePath != null && !truststorePath.isBlank()) {
            builder.sslContext(sslContext(Path.of(truststorePath), config.truststorePassword()));
        }
        return builder.build();
    }

    private static SSLContext sslContext(Path path, String password) {
        if (password == null) {
            throw new IllegalStateException(ServiceConfig.TRUSTSTORE_PASSWORD_ENV + " must be set when "
                    + ServiceConfig.TRUSTSTORE_PATH_ENV + " is configured");
        }
        if (!Files.exists(path)) {
            throw new IllegalStateException("Truststore file does not exist: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            KeyStore trustStore = KeyStore.getInstance(truststoreType(path));
            trustStore.load(in, password.toCharArray());

            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(trustStore);

            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, tmf.getTrustManagers(), new SecureRandom());
            return sslContext;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build SSL context from truststore " + path, e);
        }
    }

    private static String truststoreType(Path path) {
        String lower = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (lower.endsWith(".p12") || lower.endsWith(".pfx") || lower.endsWith(".pkcs12")) {
            return "PKCS12";
        }
        return "JKS";
    }
}
