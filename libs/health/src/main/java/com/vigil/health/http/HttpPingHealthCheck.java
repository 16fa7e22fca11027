package com.vigil.health.http;

import com.vigil.health.CheckResult;
import com.vigil.health.HealthCheck;
import com.vigil.health.HealthStatus;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Probes an HTTP API through its {@code /health/ping} endpoint.
 * <p>
 * 200 is OK; any other status is ERROR. A connect or request timeout is reported as WARNING, a
 * refused or failed connection as ERROR. Without an endpoint the check reports UNKNOWN.
 */
public final class HttpPingHealthCheck implements HealthCheck {

    public static final String PING_PATH = "/health/ping";

    private final String name;
    private final HttpClient client;
    private final URI endpoint;
    private final String token;
    private final Duration timeout;

    /**
     * @param name     label used in result messages (e.g., "MCP API")
     * @param client   the HTTP client
     * @param endpoint base URI of the API, or null when not configured
     * @param token    bearer token, or null to send no Authorization header
     * @param timeout  request timeout
     */
    public HttpPingHealthCheck(String name, HttpClient client, URI endpoint, String token, Duration timeout) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (client == null) {
            throw new IllegalArgumentException("client must not be null");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.name = name;
        this.client = client;
        this.endpoint = endpoint;
        this.token = token;
        this.timeout = timeout;
    }

    @Override
    public CheckResult check() throws InterruptedException {
        if (endpoint == null) {
            return CheckResult.unknown(name + " endpoint not configured");
        }
        HttpRequest.Builder request = HttpRequest.newBuilder(pingUri())
                .timeout(timeout)
                .GET();
        if (token != null && !token.isBlank()) {
            request.header("Authorization", "Bearer " + token);
        }

        long started = System.nanoTime();
        try {
            HttpResponse<Void> response = client.send(request.build(), HttpResponse.BodyHandlers.discarding());
            long latencyMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
            if (response.statusCode() == 200) {
                return new CheckResult(HealthStatus.OK, name + " is healthy", Instant.now(), latencyMs, Map.of());
            }
            return new CheckResult(HealthStatus.ERROR, name + " returned status " + response.statusCode(),
                    Instant.now(), latencyMs, Map.of());
        } catch (HttpTimeoutException e) {
            return CheckResult.warning(name + " timeout");
        } catch (ConnectException e) {
            return CheckResult.error(name + " connection error");
        } catch (IOException e) {
            return CheckResult.error(name + " check error: " + e.getMessage());
        }
    }

    URI pingUri() {
        String base = endpoint.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + PING_PATH);
    }
}
