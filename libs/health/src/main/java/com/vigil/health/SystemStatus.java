package com.vigil.health;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate view over every registered service.
 *
 * @param status       worst individual status (see {@link HealthStatus#worstOf})
 * @param timestamp    when the snapshot was taken
 * @param services     per-service views keyed by service id, in registration order
 * @param serviceCount number of registered services
 */
public record SystemStatus(
        HealthStatus status,
        Instant timestamp,
        Map<String, ServiceStatus> services,
        int serviceCount
) {

    public SystemStatus {
        services = Collections.unmodifiableMap(new LinkedHashMap<>(services));
    }
}
