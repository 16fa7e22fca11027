package com.vigil.health;

/**
 * Payload delivered to {@link AlertHandler}s when a service keeps failing.
 *
 * @param serviceId    the failing service
 * @param displayName  its human-readable name
 * @param status       status of the result that triggered the alert
 * @param message      message of that result
 * @param failureCount length of the current run of failing results in history
 * @param lastCheck    the triggering result
 */
public record Alert(
        String serviceId,
        String displayName,
        HealthStatus status,
        String message,
        int failureCount,
        CheckResult lastCheck
) {
}
