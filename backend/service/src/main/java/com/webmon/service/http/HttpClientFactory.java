package com.webmon.service.http;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

public final class HttpClientFactory {
    private static final Logger LOGGER = Logger.getLogger(HttpClientFactory.class.getName());
    static final String TRUSTSTORE_PATH = "WEBMON_TRUSTSTORE_PATH";
    static final String TRUSTSTORE_PASSWORD = "WEBMON_TRUSTSTORE_PASSWORD";

    private HttpClientFactory() {
    }

    public static HttpClient create(Duration connectTimeout) {
        return create(connectTimeout, System.getenv());
    }

    static HttpClient create(Duration connectTimeout, Map<String, String> environment) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        TruststoreSettings.fromEnvironment(environment)
                .map(HttpClientFactory::sslContext)
                .ifPresent(builder::sslContext);
        return builder.build();
    }

    private static SSLContext sslContext(TruststoreSettings settings) {
        Path path = settings.path();
        if (!Files.exists(path)) {
            throw new IllegalStateException("Truststore file does not exist: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            KeyStore trustStore = KeyStore.getInstance(settings.type());
            trustStore.load(in, settings.password().toCharArray());

            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(trustStore);

            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, tmf.getTrustManagers(), new SecureRandom());
            LOGGER.info("Using truststore " + path + " (" + settings.type() + ") for probes");
            return sslContext;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build SSL context from truststore " + path, e);
        }
    }

    record TruststoreSettings(Path path, String password, String type) {
        static Optional<TruststoreSettings> fromEnvironment(Map<String, String> environment) {
            String truststorePath = environment.get(TRUSTSTORE_PATH);
            if (truststorePath == null || truststorePath.isBlank()) {
                return Optional.empty();
            }
            String password = environment.get(TRUSTSTORE_PASSWORD);
            if (password == null) {
                throw new IllegalStateException(TRUSTSTORE_PASSWORD + " must be set when " + TRUSTSTORE_PATH + " is configured");
            }
            Path path = Path.of(truststorePath);
            return Optional.of(new TruststoreSettings(path, password, inferType(path)));
        }

        private static String inferType(Path path) {
            String lower = path.getFileName().toString().toLowerCase(Locale.ROOT);
            if (lower.endsWith(".p12") || lower.endsWith(".pfx") || lower.endsWith(".pkcs12")) {
                return "PKCS12";
            }
            return "JKS";
        }
    }
}
