package com.vigil.health;

import java.time.Duration;

/**
 * Tuning for a {@link ServiceMonitor}.
 *
 * @param checkInterval   cadence of background passes
 * @param historySize     results retained per service
 * @param alertThreshold  consecutive failing results that trigger an alert
 * @param cacheTtl        reuse window for fresh results; zero disables caching
 * @param workerPoolSize  threads running checks concurrently
 * @param checkTimeout    bound on a single check, measured from submission, so time spent queued
 *                        for a worker counts against it
 * @param shutdownTimeout how long {@link ServiceMonitor#stopMonitoring()} waits for the scheduler
 */
public record MonitorConfig(
        Duration checkInterval,
        int historySize,
        int alertThreshold,
        Duration cacheTtl,
        int workerPoolSize,
        Duration checkTimeout,
        Duration shutdownTimeout
) {

    public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofMinutes(5);
    public static final int DEFAULT_HISTORY_SIZE = 100;
    public static final int DEFAULT_ALERT_THRESHOLD = 3;
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(60);
    public static final int DEFAULT_WORKER_POOL_SIZE = 5;
    public static final Duration DEFAULT_CHECK_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    public MonitorConfig {
        requirePositive(checkInterval, "checkInterval");
        requirePositive(checkTimeout, "checkTimeout");
        requirePositive(shutdownTimeout, "shutdownTimeout");
        if (cacheTtl == null || cacheTtl.isNegative()) {
            throw new IllegalArgumentException("cacheTtl must not be null or negative");
        }
        if (historySize <= 0) {
            throw new IllegalArgumentException("historySize must be positive");
        }
        if (alertThreshold <= 0) {
            throw new IllegalArgumentException("alertThreshold must be positive");
        }
        if (workerPoolSize <= 0) {
            throw new IllegalArgumentException("workerPoolSize must be positive");
        }
    }

    public static MonitorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    /**
     * Builder starting from the defaults.
     */
    public static final class Builder {

        private Duration checkInterval = DEFAULT_CHECK_INTERVAL;
        private int historySize = DEFAULT_HISTORY_SIZE;
        private int alertThreshold = DEFAULT_ALERT_THRESHOLD;
        private Duration cacheTtl = DEFAULT_CACHE_TTL;
        private int workerPoolSize = DEFAULT_WORKER_POOL_SIZE;
        private Duration checkTimeout = DEFAULT_CHECK_TIMEOUT;
        private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;

        private Builder() {
        }

        public Builder checkInterval(Duration checkInterval) {
            this.checkInterval = checkInterval;
            return this;
        }

        public Builder historySize(int historySize) {
            this.historySize = historySize;
            return this;
        }

        public Builder alertThreshold(int alertThreshold) {
            this.alertThreshold = alertThreshold;
            return this;
        }

        public Builder cacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
            return this;
        }

        public Builder workerPoolSize(int workerPoolSize) {
            this.workerPoolSize = workerPoolSize;
            return this;
        }

        public Builder checkTimeout(Duration checkTimeout) {
            this.checkTimeout = checkTimeout;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public MonitorConfig build() {
            return new MonitorConfig(checkInterval, historySize, alertThreshold, cacheTtl,
                    workerPoolSize, checkTimeout, shutdownTimeout);
        }
    }
}
