package com.vigil.resilience;

import java.time.Duration;
import java.util.Optional;

/**
 * Failure that a {@link RetryExecutor} may retry under the default {@link RetryPolicy}.
 * <p>
 * May carry a server-suggested delay (for example from a {@code Retry-After} header). When
 * present, the executor sleeps for that delay, capped at the policy's maximum, instead of the
 * computed backoff.
 */
public class RetryableException extends RuntimeException {

    private final Duration retryAfter;

    public RetryableException(String message) {
        this(message, null, null);
    }

    public RetryableException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public RetryableException(String message, Throwable cause, Duration retryAfter) {
        super(message, cause);
        if (retryAfter != null && retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter must not be negative");
        }
        this.retryAfter = retryAfter;
    }

    /**
     * Returns the delay the remote side asked for, if any.
     */
    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
