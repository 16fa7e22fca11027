package com.vigil.resilience;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.time.Duration;

/**
 * Records retry activity as Micrometer counters tagged by operation name.
 */
public final class MeterRegistryRetryListener implements RetryListener {

    public static final String RETRY_ATTEMPTS = "vigil.retry.attempts";
    public static final String RETRY_EXHAUSTED = "vigil.retry.exhausted";
    public static final String TAG_OPERATION = "operation";

    private final MeterRegistry registry;

    public MeterRegistryRetryListener(MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    @Override
    public void onRetry(String operation, Throwable error, int attempt, Duration delay) {
        Counter.builder(RETRY_ATTEMPTS)
                .description("Retries scheduled after a transient failure")
                .tag(TAG_OPERATION, operation)
                .register(registry)
                .increment();
    }

    @Override
    public void onExhausted(String operation, Throwable lastError, int attempts) {
        Counter.builder(RETRY_EXHAUSTED)
                .description("Operations that failed on every allowed attempt")
                .tag(TAG_OPERATION, operation)
                .register(registry)
                .increment();
    }
}
