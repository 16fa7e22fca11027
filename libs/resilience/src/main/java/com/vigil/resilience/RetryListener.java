package com.vigil.resilience;

import java.time.Duration;

/**
 * Callback notified by {@link RetryExecutor} about retry progress.
 */
public interface RetryListener {

    /**
     * Called after a retryable failure, before sleeping.
     *
     * @param operation name of the operation being retried
     * @param error     the failure that triggered the retry
     * @param attempt   the attempt that just failed, starting at 1
     * @param delay     how long the executor is about to sleep
     */
    default void onRetry(String operation, Throwable error, int attempt, Duration delay) {
    }

    /**
     * Called once when all attempts are used up.
     */
    default void onExhausted(String operation, Throwable lastError, int attempts) {
    }
}
