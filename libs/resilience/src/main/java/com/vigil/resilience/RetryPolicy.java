package com.vigil.resilience;

import java.time.Duration;
import java.util.Set;

/**
 * Immutable retry configuration passed to {@link RetryExecutor} at call time.
 *
 * @param maxRetries          retries after the first attempt (total attempts = maxRetries + 1)
 * @param baseDelay           delay before the first retry
 * @param backoffMultiplier   growth factor per retry, at least 1.0
 * @param maxDelay            cap on any single computed delay
 * @param jitterEnabled       whether sleeps are drawn uniformly from {@code [0, delay * (1 + jitterFactor)]}
 * @param jitterFactor        widening of the jitter window, between 0.0 and 1.0
 * @param retryableExceptions exception types that trigger a retry (subtypes included)
 */
public record RetryPolicy(
        int maxRetries,
        Duration baseDelay,
        double backoffMultiplier,
        Duration maxDelay,
        boolean jitterEnabled,
        double jitterFactor,
        Set<Class<? extends Throwable>> retryableExceptions
) {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);
    public static final double DEFAULT_JITTER_FACTOR = 0.1;

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be null or negative");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be null or shorter than baseDelay");
        }
        if (Double.isNaN(backoffMultiplier) || backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (Double.isNaN(jitterFactor) || jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0");
        }
        if (retryableExceptions == null || retryableExceptions.isEmpty()) {
            throw new IllegalArgumentException("retryableExceptions must not be null or empty");
        }
        retryableExceptions = Set.copyOf(retryableExceptions);
    }

    /**
     * Returns the default policy: 3 retries, 1s base delay doubling up to 60s, jitter on,
     * retrying only {@link RetryableException}.
     */
    public static RetryPolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the total number of invocations this policy allows.
     */
    public int maxAttempts() {
        return maxRetries + 1;
    }

    /**
     * Decides whether a failure should be retried under this policy.
     * {@link NonRetryableException} is never retried.
     */
    public boolean isRetryable(Throwable error) {
        if (error == null || error instanceof NonRetryableException) {
            return false;
        }
        for (Class<? extends Throwable> type : retryableExceptions) {
            if (type.isInstance(error)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Fluent builder starting from the defaults.
     */
    public static final class Builder {

        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration baseDelay = DEFAULT_BASE_DELAY;
        private double backoffMultiplier = DEFAULT_MULTIPLIER;
        private Duration maxDelay = DEFAULT_MAX_DELAY;
        private boolean jitterEnabled = true;
        private double jitterFactor = DEFAULT_JITTER_FACTOR;
        private Set<Class<? extends Throwable>> retryableExceptions = Set.of(RetryableException.class);

        private Builder() {
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder jitter(boolean enabled) {
            this.jitterEnabled = enabled;
            return this;
        }

        public Builder jitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
            return this;
        }

        @SafeVarargs
        public final Builder retryOn(Class<? extends Throwable>... types) {
            this.retryableExceptions = Set.of(types);
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(maxRetries, baseDelay, backoffMultiplier, maxDelay,
                    jitterEnabled, jitterFactor, retryableExceptions);
        }
    }
}
