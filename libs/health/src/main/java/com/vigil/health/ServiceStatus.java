package com.vigil.health;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Point-in-time view of one service: its latest result plus a summary of retained history.
 *
 * @param serviceId      service key
 * @param displayName    human-readable name, null for unregistered ids
 * @param serviceUrl     location of the dependency, may be null
 * @param status         status of the latest result, UNKNOWN when there is none
 * @param message        message of the latest result or an explanation
 * @param timestamp      timestamp of the latest result, or of the query when there is none
 * @param latencyMs      latency of the latest result, may be null
 * @param extra          extra data of the latest result
 * @param historySummary number of retained results per status; every status is present
 * @param historySize    number of retained results
 */
public record ServiceStatus(
        String serviceId,
        String displayName,
        String serviceUrl,
        HealthStatus status,
        String message,
        Instant timestamp,
        Long latencyMs,
        Map<String, Object> extra,
        Map<HealthStatus, Integer> historySummary,
        int historySize
) {

    public ServiceStatus {
        extra = extra == null ? Map.of() : extra;
        EnumMap<HealthStatus, Integer> summary = emptySummary();
        if (historySummary != null) {
            summary.putAll(historySummary);
        }
        historySummary = Collections.unmodifiableMap(summary);
    }

    /**
     * Placeholder for a service that is unregistered or has not been checked yet.
     */
    public static ServiceStatus unknown(String serviceId, String displayName, String serviceUrl,
                                        String message, Instant now) {
        return new ServiceStatus(serviceId, displayName, serviceUrl, HealthStatus.UNKNOWN, message, now,
                null, Map.of(), emptySummary(), 0);
    }

    /**
     * Builds the view from a registration and its non-empty history.
     */
    static ServiceStatus from(ServiceRegistration registration, BoundedHistory<CheckResult> history) {
        CheckResult latest = history.latest()
                .orElseThrow(() -> new IllegalArgumentException("history must not be empty"));
        EnumMap<HealthStatus, Integer> summary = emptySummary();
        history.newestFirst().forEachRemaining(result -> summary.merge(result.status(), 1, Integer::sum));
        return new ServiceStatus(registration.serviceId(), registration.displayName(), registration.serviceUrl(),
                latest.status(), latest.message(), latest.timestamp(), latest.latencyMs(), latest.extra(),
                summary, history.size());
    }

    private static EnumMap<HealthStatus, Integer> emptySummary() {
        EnumMap<HealthStatus, Integer> summary = new EnumMap<>(HealthStatus.class);
        for (HealthStatus status : HealthStatus.values()) {
            summary.put(status, 0);
        }
        return summary;
    }
}
