package com.vigil.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Runs a fallible operation under a {@link RetryPolicy}.
 * <p>
 * The operation is invoked up to {@code maxRetries + 1} times. A failure the policy considers
 * retryable is followed by a backoff sleep and another attempt; when the last attempt fails the
 * executor throws {@link RetryExhaustedException} wrapping that failure. Any other failure is
 * rethrown untouched on the spot, without sleeping.
 * <p>
 * The executor does not care what the operation does, so the same instance serves local calls and
 * outbound HTTP alike. Instances are stateless apart from their collaborators and safe to share.
 */
public final class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    /** Name used in logs and metrics when the caller does not supply one. */
    public static final String DEFAULT_OPERATION = "operation";

    private final Sleeper sleeper;
    private final DoubleSupplier random;
    private final List<RetryListener> listeners;

    /**
     * Creates an executor that really sleeps and draws jitter from {@link ThreadLocalRandom}.
     */
    public RetryExecutor() {
        this(Sleeper.system(), () -> ThreadLocalRandom.current().nextDouble(), List.of());
    }

    /**
     * Creates an executor that notifies the given listeners.
     */
    public RetryExecutor(List<RetryListener> listeners) {
        this(Sleeper.system(), () -> ThreadLocalRandom.current().nextDouble(), listeners);
    }

    /**
     * Creates an executor with explicit collaborators.
     *
     * @param sleeper   pause between attempts
     * @param random    source of uniform values in {@code [0, 1)} for jitter
     * @param listeners callbacks notified on every retry and on exhaustion
     */
    public RetryExecutor(Sleeper sleeper, DoubleSupplier random, List<RetryListener> listeners) {
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper must not be null");
        }
        if (random == null) {
            throw new IllegalArgumentException("random must not be null");
        }
        if (listeners == null) {
            throw new IllegalArgumentException("listeners must not be null");
        }
        this.sleeper = sleeper;
        this.random = random;
        this.listeners = List.copyOf(listeners);
    }

    /**
     * Executes an operation under the policy, using {@link #DEFAULT_OPERATION} as its name.
     *
     * @see #execute(String, Callable, RetryPolicy)
     */
    public <T> T execute(Callable<T> operation, RetryPolicy policy) throws Exception {
        return execute(DEFAULT_OPERATION, operation, policy);
    }

    /**
     * Executes an operation under the policy.
     *
     * @param name      operation name for logs and metrics
     * @param operation the work to attempt
     * @param policy    retry configuration
     * @param <T>       result type
     * @return the first successful result
     * @throws RetryExhaustedException if every attempt failed with a retryable error
     * @throws InterruptedException    if interrupted during a backoff sleep
     * @throws Exception               any non-retryable failure, unchanged
     */
    public <T> T execute(String name, Callable<T> operation, RetryPolicy policy) throws Exception {
        if (operation == null) {
            throw new IllegalArgumentException("operation must not be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy must not be null");
        }
        List<Duration> schedule = BackoffPolicy.schedule(policy);
        int maxAttempts = policy.maxAttempts();

        for (int attempt = 1; ; attempt++) {
            try {
                return operation.call();
            } catch (Exception e) {
                if (!policy.isRetryable(e)) {
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    log.error("Operation '{}' failed after {} attempt(s): {}", name, attempt, e.getMessage());
                    listeners.forEach(listener -> notifyExhausted(listener, name, e, maxAttempts));
                    throw new RetryExhaustedException(name, attempt, e);
                }

                Duration delay = delayBefore(attempt, e, schedule, policy);
                log.warn("Attempt {}/{} of '{}' failed: {}. Retrying in {} ms",
                        attempt, maxAttempts, name, e.getMessage(), delay.toMillis());
                int failedAttempt = attempt;
                listeners.forEach(listener -> notifyRetry(listener, name, e, failedAttempt, delay));

                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw interrupted;
                }
            }
        }
    }

    /**
     * Runs a void action under the policy. Checked failures other than exhaustion are wrapped.
     */
    public void run(String name, Runnable action, RetryPolicy policy) {
        try {
            execute(name, () -> {
                action.run();
                return null;
            }, policy);
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while retrying '" + name + "'", e);
        } catch (Exception e) {
            throw new IllegalStateException("Unexpected checked exception while retrying '" + name + "'", e);
        }
    }

    private Duration delayBefore(int attempt, Exception error, List<Duration> schedule, RetryPolicy policy) {
        if (error instanceof RetryableException retryable && retryable.retryAfter().isPresent()) {
            Duration hint = retryable.retryAfter().get();
            return hint.compareTo(policy.maxDelay()) > 0 ? policy.maxDelay() : hint;
        }
        Duration delay = schedule.get(attempt - 1);
        return policy.jitterEnabled()
                ? BackoffPolicy.applyJitter(delay, policy.jitterFactor(), random)
                : delay;
    }

    private static void notifyRetry(RetryListener listener, String name, Throwable error, int attempt,
                                    Duration delay) {
        try {
            listener.onRetry(name, error, attempt, delay);
        } catch (RuntimeException e) {
            log.error("Retry listener {} failed for '{}'", listener.getClass().getName(), name, e);
        }
    }

    private static void notifyExhausted(RetryListener listener, String name, Throwable error, int attempts) {
        try {
            listener.onExhausted(name, error, attempts);
        } catch (RuntimeException e) {
            log.error("Retry listener {} failed for '{}'", listener.getClass().getName(), name, e);
        }
    }
}
