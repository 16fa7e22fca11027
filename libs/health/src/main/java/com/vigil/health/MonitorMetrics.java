package com.vigil.health;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Micrometer meters published by a {@link ServiceMonitor}.
 * <p>
 * Every meter carries a {@code service} tag naming the monitored dependency, except the
 * registered-services gauge which describes the monitor as a whole.
 */
public final class MonitorMetrics {

    public static final String CHECKS = "vigil.health.checks";
    public static final String CHECK_DURATION = "vigil.health.check.duration";
    public static final String ALERTS = "vigil.health.alerts";
    public static final String CACHED = "vigil.health.cached";
    public static final String SERVICES = "vigil.health.services";

    public static final String TAG_SERVICE = "service";
    public static final String TAG_STATUS = "status";

    private final MeterRegistry registry;

    public MonitorMetrics(MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    /**
     * Registers the gauge reporting how many services are registered.
     */
    public void bindServiceCount(Supplier<Number> serviceCount) {
        Gauge.builder(SERVICES, serviceCount)
                .description("Number of registered services")
                .register(registry);
    }

    /**
     * Counts a freshly computed result and records how long the check took.
     */
    public void recordCheck(String serviceId, HealthStatus status, Duration elapsed) {
        Counter.builder(CHECKS)
                .description("Health check results by service and status")
                .tags(TAG_SERVICE, serviceId, TAG_STATUS, status.toString())
                .register(registry)
                .increment();
        Timer.builder(CHECK_DURATION)
                .description("Health check execution time")
                .tags(TAG_SERVICE, serviceId)
                .register(registry)
                .record(elapsed);
    }

    public void recordCached(String serviceId) {
        Counter.builder(CACHED)
                .description("Health check results served from cache")
                .tags(TAG_SERVICE, serviceId)
                .register(registry)
                .increment();
    }

    public void recordAlert(String serviceId) {
        Counter.builder(ALERTS)
                .description("Alerts raised for failing services")
                .tags(TAG_SERVICE, serviceId)
                .register(registry)
                .increment();
    }

    public MeterRegistry registry() {
        return registry;
    }
}
