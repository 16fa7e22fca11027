package com.vigil.resilience;

/**
 * Thrown by {@link RetryExecutor} when every attempt failed with a retryable error.
 * The cause is the last failure observed.
 */
public class RetryExhaustedException extends RuntimeException {

    private final String operation;
    private final int attempts;

    public RetryExhaustedException(String operation, int attempts, Throwable lastFailure) {
        super("Operation '" + operation + "' failed after " + attempts + " attempt(s): "
                + lastFailure.getMessage(), lastFailure);
        this.operation = operation;
        this.attempts = attempts;
    }

    /** Name of the operation that was retried. */
    public String operation() {
        return operation;
    }

    /** Total number of invocations, including the first. */
    public int attempts() {
        return attempts;
    }
}
