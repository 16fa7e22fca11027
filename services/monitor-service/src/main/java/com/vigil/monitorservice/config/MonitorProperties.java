package com.vigil.monitorservice.config;

import com.vigil.health.MonitorConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Monitor configuration bound from the {@code vigil.monitor.*} prefix.
 *
 * <pre>
 * vigil:
 *   monitor:
 *     check-interval: 5m
 *     cache-ttl: 60s
 *     services:
 *       - id: github-api
 *         display-name: GitHub API
 *         type: GITHUB_RATE_LIMIT
 *         token: ${GITHUB_TOKEN:}
 * </pre>
 *
 * <p>Unset values fall back to the {@link MonitorConfig} defaults in the compact constructor,
 * which runs before Bean Validation.
 *
 * @param checkInterval   cadence of background passes
 * @param historySize     results retained per service
 * @param alertThreshold  consecutive failures that raise an alert
 * @param cacheTtl        result reuse window, {@code 0s} disables caching
 * @param workerPoolSize  concurrent check threads
 * @param checkTimeout    bound on one check
 * @param shutdownTimeout bound on stopping the scheduler
 * @param requestTimeout  HTTP request timeout used by the probes
 * @param autoStart       whether monitoring starts with the application
 * @param services        monitored dependencies
 */
@ConfigurationProperties(prefix = "vigil.monitor")
@Validated
public record MonitorProperties(
        Duration checkInterval,
        int historySize,
        int alertThreshold,
        Duration cacheTtl,
        int workerPoolSize,
        Duration checkTimeout,
        Duration shutdownTimeout,
        Duration requestTimeout,
        Boolean autoStart,
        @Valid List<ServiceTarget> services) {

    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(5);

    public MonitorProperties {
        if (checkInterval == null) {
            checkInterval = MonitorConfig.DEFAULT_CHECK_INTERVAL;
        }
        if (historySize <= 0) {
            historySize = MonitorConfig.DEFAULT_HISTORY_SIZE;
        }
        if (alertThreshold <= 0) {
            alertThreshold = MonitorConfig.DEFAULT_ALERT_THRESHOLD;
        }
        if (cacheTtl == null) {
            cacheTtl = MonitorConfig.DEFAULT_CACHE_TTL;
        }
        if (workerPoolSize <= 0) {
            workerPoolSize = MonitorConfig.DEFAULT_WORKER_POOL_SIZE;
        }
        if (checkTimeout == null) {
            checkTimeout = MonitorConfig.DEFAULT_CHECK_TIMEOUT;
        }
        if (shutdownTimeout == null) {
            shutdownTimeout = MonitorConfig.DEFAULT_SHUTDOWN_TIMEOUT;
        }
        if (requestTimeout == null) {
            requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        }
        if (autoStart == null) {
            autoStart = Boolean.TRUE;
        }
        services = services == null ? List.of() : List.copyOf(services);
    }

    /**
     * Converts to the library configuration; invalid durations are rejected there.
     */
    public MonitorConfig toMonitorConfig() {
        return MonitorConfig.builder()
                .checkInterval(checkInterval)
                .historySize(historySize)
                .alertThreshold(alertThreshold)
                .cacheTtl(cacheTtl)
                .workerPoolSize(workerPoolSize)
                .checkTimeout(checkTimeout)
                .shutdownTimeout(shutdownTimeout)
                .build();
    }

    /** Kind of probe used for a dependency. */
    public enum CheckType {
        /** GET {@code <url>/health/ping} with an optional bearer token. */
        HTTP_PING,
        /** GitHub {@code /rate_limit}; {@code url} overrides the API base. */
        GITHUB_RATE_LIMIT
    }

    /**
     * One monitored dependency.
     *
     * @param id          service id
     * @param displayName human-readable name, defaults to the id
     * @param url         endpoint or API base, may be empty
     * @param type        probe kind
     * @param token       credential, may be empty
     */
    public record ServiceTarget(
            @NotBlank String id, String displayName, String url, @NotNull CheckType type, String token) {

        public ServiceTarget {
            if (displayName == null || displayName.isBlank()) {
                displayName = id;
            }
        }
    }
}
