package com.vigil.health;

/**
 * A monitored dependency.
 *
 * @param serviceId   unique key (e.g., "github-api")
 * @param check       the probe
 * @param displayName human-readable name used in statuses and alerts
 * @param serviceUrl  optional location of the dependency, may be null
 */
public record ServiceRegistration(String serviceId, HealthCheck check, String displayName, String serviceUrl) {

    public ServiceRegistration {
        if (serviceId == null || serviceId.isBlank()) {
            throw new IllegalArgumentException("serviceId must not be null or blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = serviceId;
        }
    }
}
