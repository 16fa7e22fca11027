package com.vigil.resilience;

/**
 * Failure that must never be retried, even when its type also matches a policy's retryable set.
 * The {@link RetryExecutor} rethrows it on the first occurrence.
 */
public class NonRetryableException extends RuntimeException {

    public NonRetryableException(String message) {
        super(message);
    }

    public NonRetryableException(String message, Throwable cause) {
        super(message, cause);
    }
}
