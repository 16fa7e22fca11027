package com.vigil.health.testing;

import com.vigil.health.CheckResult;
import com.vigil.health.HealthCheck;
import com.vigil.health.HealthStatus;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A controllable health check for testing monitor behavior.
 * <p>
 * Tests can set the reported status, make the check throw, or block it until released to simulate
 * a hung dependency. Placed in {@code src/main/java} for cross-module test use.
 */
public final class InMemoryHealthCheck implements HealthCheck {

    private final AtomicReference<HealthStatus> status = new AtomicReference<>(HealthStatus.OK);
    private final AtomicReference<String> message = new AtomicReference<>("healthy");
    private final AtomicReference<Long> latencyMs = new AtomicReference<>(null);
    private final AtomicReference<RuntimeException> failure = new AtomicReference<>();
    private final AtomicReference<CountDownLatch> gate = new AtomicReference<>();
    private final AtomicInteger invocations = new AtomicInteger();

    @Override
    public CheckResult check() throws InterruptedException {
        invocations.incrementAndGet();
        CountDownLatch latch = gate.get();
        if (latch != null) {
            latch.await();
        }
        RuntimeException error = failure.get();
        if (error != null) {
            throw error;
        }
        return new CheckResult(status.get(), message.get(), Instant.now(), latencyMs.get(), Map.of());
    }

    /**
     * Reports OK from now on.
     */
    public InMemoryHealthCheck setOk() {
        return setStatus(HealthStatus.OK, "healthy");
    }

    /**
     * Reports WARNING with the given message.
     */
    public InMemoryHealthCheck setWarning(String message) {
        return setStatus(HealthStatus.WARNING, message);
    }

    /**
     * Reports ERROR with the given message.
     */
    public InMemoryHealthCheck setError(String message) {
        return setStatus(HealthStatus.ERROR, message);
    }

    public InMemoryHealthCheck setStatus(HealthStatus status, String message) {
        this.status.set(status);
        this.message.set(message);
        this.failure.set(null);
        return this;
    }

    public InMemoryHealthCheck setLatencyMs(Long latencyMs) {
        this.latencyMs.set(latencyMs);
        return this;
    }

    /**
     * Makes every subsequent invocation throw the given exception.
     */
    public InMemoryHealthCheck failWith(RuntimeException error) {
        this.failure.set(error);
        return this;
    }

    /**
     * Makes subsequent invocations block until {@link #release()} or interruption.
     */
    public InMemoryHealthCheck block() {
        gate.set(new CountDownLatch(1));
        return this;
    }

    /**
     * Unblocks invocations held by {@link #block()}.
     */
    public InMemoryHealthCheck release() {
        CountDownLatch latch = gate.getAndSet(null);
        if (latch != null) {
            latch.countDown();
        }
        return this;
    }

    /**
     * Number of times {@link #check()} was entered.
     */
    public int invocations() {
        return invocations.get();
    }
}
