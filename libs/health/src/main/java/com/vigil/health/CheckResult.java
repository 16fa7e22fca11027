package com.vigil.health;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one health check invocation.
 *
 * @param status    health status reported by the check
 * @param message   human-readable detail, never null
 * @param timestamp when the result was produced
 * @param latencyMs round-trip time of the probe in milliseconds, or null when not measured
 * @param extra     check-specific structured data (for example rate-limit counters)
 */
public record CheckResult(
        HealthStatus status,
        String message,
        Instant timestamp,
        Long latencyMs,
        Map<String, Object> extra
) {

    public CheckResult {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
        if (latencyMs != null && latencyMs < 0) {
            throw new IllegalArgumentException("latencyMs must not be negative");
        }
        message = message == null ? "" : message;
        extra = extra == null || extra.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    /** Creates a result without latency or extra data. */
    public static CheckResult of(HealthStatus status, String message, Instant timestamp) {
        return new CheckResult(status, message, timestamp, null, Map.of());
    }

    /** Creates an OK result stamped now. */
    public static CheckResult ok(String message) {
        return of(HealthStatus.OK, message, Instant.now());
    }

    /** Creates an OK result with measured latency, stamped now. */
    public static CheckResult ok(String message, long latencyMs) {
        return new CheckResult(HealthStatus.OK, message, Instant.now(), latencyMs, Map.of());
    }

    /** Creates a WARNING result stamped now. */
    public static CheckResult warning(String message) {
        return of(HealthStatus.WARNING, message, Instant.now());
    }

    /** Creates an ERROR result stamped now. */
    public static CheckResult error(String message) {
        return of(HealthStatus.ERROR, message, Instant.now());
    }

    /** Creates an UNKNOWN result stamped now. */
    public static CheckResult unknown(String message) {
        return of(HealthStatus.UNKNOWN, message, Instant.now());
    }

    /**
     * Converts a failed or timed-out invocation into an ERROR result carrying the failure message.
     */
    public static CheckResult fromFailure(HealthCheckException failure, Instant timestamp) {
        Throwable cause = failure.getCause() != null ? failure.getCause() : failure;
        return new CheckResult(HealthStatus.ERROR, failure.getMessage(), timestamp, null,
                Map.of("error", cause.getClass().getSimpleName()));
    }
}
