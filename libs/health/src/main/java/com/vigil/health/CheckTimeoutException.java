package com.vigil.health;

import java.time.Duration;

/**
 * A check did not complete within the per-check timeout, either because it ran too long or
 * because it never got a worker thread.
 */
public class CheckTimeoutException extends HealthCheckException {

    private final Duration timeout;

    public CheckTimeoutException(String serviceId, Duration timeout) {
        this(serviceId, timeout, "Health check timed out after " + timeout.toMillis() + " ms");
    }

    private CheckTimeoutException(String serviceId, Duration timeout, String message) {
        super(serviceId, message, null);
        this.timeout = timeout;
    }

    /** The check was still queued when its deadline passed and never ran. */
    public static CheckTimeoutException notStarted(String serviceId, Duration timeout) {
        return new CheckTimeoutException(serviceId, timeout,
                "Health check not started within " + timeout.toMillis() + " ms");
    }

    public Duration timeout() {
        return timeout;
    }
}
