package com.vigil.resilience;

import java.net.http.HttpHeaders;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Classifies HTTP outcomes for retry purposes and reads server-supplied retry hints.
 */
public final class HttpRetryClassifier {

    /** Header carrying the server's requested wait, in seconds or as an HTTP date. */
    public static final String RETRY_AFTER = "Retry-After";

    /** Too Many Requests plus the transient 5xx family. */
    public static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 500, 502, 503, 504);

    private HttpRetryClassifier() {
        // utility class
    }

    /**
     * Returns true when the status is absent (a network-level failure with no response) or is one
     * of {@link #RETRYABLE_STATUSES}.
     */
    public static boolean isRetryableStatus(Integer statusCode) {
        return statusCode == null || RETRYABLE_STATUSES.contains(statusCode);
    }

    /**
     * Reads {@code Retry-After} as a number of seconds.
     * <p>
     * Returns {@code min(parsed, capSeconds)} when the header parses as a finite, non-negative
     * number; otherwise (absent, HTTP-date form, garbage) returns {@code defaultSeconds}.
     *
     * @param headers        response headers, names matched case-insensitively
     * @param defaultSeconds value used when no usable hint is present
     * @param capSeconds     upper bound for a parsed hint
     */
    public static double retryAfterSeconds(Map<String, List<String>> headers, double defaultSeconds,
                                           double capSeconds) {
        return firstHeader(headers, RETRY_AFTER)
                .flatMap(HttpRetryClassifier::parseSeconds)
                .map(seconds -> Math.min(seconds, capSeconds))
                .orElse(defaultSeconds);
    }

    /**
     * {@link Duration} variant of {@link #retryAfterSeconds(Map, double, double)} for JDK responses.
     */
    public static Duration retryAfter(HttpHeaders headers, Duration defaultDelay, Duration cap) {
        return retryAfter(headers, cap).orElse(defaultDelay);
    }

    /**
     * Returns the capped {@code Retry-After} hint, or empty when the header is missing or not numeric.
     */
    public static Optional<Duration> retryAfter(HttpHeaders headers, Duration cap) {
        return headers.firstValue(RETRY_AFTER)
                .flatMap(HttpRetryClassifier::parseSeconds)
                .map(seconds -> Duration.ofMillis(Math.round(seconds * 1000)))
                .map(hint -> hint.compareTo(cap) > 0 ? cap : hint);
    }

    private static Optional<String> firstHeader(Map<String, List<String>> headers, String name) {
        if (headers == null) {
            return Optional.empty();
        }
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (name.equalsIgnoreCase(entry.getKey()) && entry.getValue() != null && !entry.getValue().isEmpty()) {
                return Optional.ofNullable(entry.getValue().get(0));
            }
        }
        return Optional.empty();
    }

    private static Optional<Double> parseSeconds(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            double seconds = Double.parseDouble(value.trim());
            if (Double.isFinite(seconds) && seconds >= 0) {
                return Optional.of(seconds);
            }
            return Optional.empty();
        } catch (NumberFormatException e) {
            // HTTP-date form; callers fall back to their default
            return Optional.empty();
        }
    }
}
