package com.vigil.health.http;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vigil.health.CheckResult;
import com.vigil.health.HealthCheck;
import com.vigil.health.HealthStatus;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Checks GitHub API availability through the rate-limit endpoint, which does not count against
 * the quota. Reports WARNING when the remaining core quota drops below a threshold and exposes
 * the {@code rate} object under {@code extra.rate_limit}.
 */
public final class GitHubRateLimitHealthCheck implements HealthCheck {

    public static final URI DEFAULT_API_BASE = URI.create("https://api.github.com");
    public static final int DEFAULT_LOW_THRESHOLD = 100;
    public static final String EXTRA_RATE_LIMIT = "rate_limit";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final HttpClient client;
    private final URI apiBase;
    private final String token;
    private final Duration timeout;
    private final int lowThreshold;

    public GitHubRateLimitHealthCheck(HttpClient client, String token, Duration timeout) {
        this(client, DEFAULT_API_BASE, token, timeout, DEFAULT_LOW_THRESHOLD);
    }

    public GitHubRateLimitHealthCheck(HttpClient client, URI apiBase, String token, Duration timeout,
                                      int lowThreshold) {
        if (client == null) {
            throw new IllegalArgumentException("client must not be null");
        }
        if (apiBase == null) {
            throw new IllegalArgumentException("apiBase must not be null");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (lowThreshold < 0) {
            throw new IllegalArgumentException("lowThreshold must not be negative");
        }
        this.client = client;
        this.apiBase = apiBase;
        this.token = token;
        this.timeout = timeout;
        this.lowThreshold = lowThreshold;
    }

    @Override
    public CheckResult check() throws InterruptedException {
        if (token == null || token.isBlank()) {
            return CheckResult.unknown("GitHub token not configured");
        }
        HttpRequest request = HttpRequest.newBuilder(rateLimitUri())
                .timeout(timeout)
                .header("Authorization", "token " + token)
                .header("Accept", "application/vnd.github.v3+json")
                .GET()
                .build();

        long started = System.nanoTime();
        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            long latencyMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
            if (response.statusCode() != 200) {
                return new CheckResult(HealthStatus.ERROR, "GitHub API returned status " + response.statusCode(),
                        Instant.now(), latencyMs, Map.of());
            }
            JsonNode rate = MAPPER.readTree(response.body()).path("rate");
            if (!rate.has("remaining")) {
                return CheckResult.error("GitHub API check error: rate limit response has no remaining count");
            }
            int remaining = rate.get("remaining").asInt();
            Map<String, Object> extra = Map.of(EXTRA_RATE_LIMIT, MAPPER.convertValue(rate, MAP_TYPE));
            if (remaining < lowThreshold) {
                return new CheckResult(HealthStatus.WARNING, "GitHub API rate limit low: " + remaining + " remaining",
                        Instant.now(), latencyMs, extra);
            }
            return new CheckResult(HealthStatus.OK, "GitHub API healthy: " + remaining + " requests remaining",
                    Instant.now(), latencyMs, extra);
        } catch (IOException e) {
            return CheckResult.error("GitHub API check error: " + e.getMessage());
        }
    }

    URI rateLimitUri() {
        String base = apiBase.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + "/rate_limit");
    }
}
