package com.vigil.resilience;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.DoubleSupplier;

/**
 * Pure functions computing exponential backoff delays.
 * <p>
 * The delay before retry {@code n} (1-based) is
 * {@code min(maxDelay, baseDelay * multiplier^(n-1))}. Each delay is computed directly from the
 * attempt number rather than by repeated multiplication, so a whole schedule can be computed up
 * front without accumulating floating point error.
 * <p>
 * With jitter enabled the actual sleep is drawn uniformly from
 * {@code [0, delay * (1 + jitterFactor)]} (full jitter), spreading out clients that fail together.
 */
public final class BackoffPolicy {

    private static final double MAX_NANOS = (double) Long.MAX_VALUE;

    private BackoffPolicy() {
        // utility class
    }

    /**
     * Computes the capped delay for the given retry attempt.
     *
     * @param attempt    retry number, starting at 1
     * @param baseDelay  delay for the first retry
     * @param multiplier growth factor per attempt
     * @param maxDelay   upper bound for the result
     * @return the delay, never greater than {@code maxDelay}
     */
    public static Duration computeDelay(int attempt, Duration baseDelay, double multiplier, Duration maxDelay) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        double nanos = baseDelay.toNanos() * Math.pow(multiplier, attempt - 1);
        double capNanos = maxDelay.toNanos();
        if (Double.isNaN(nanos) || nanos >= capNanos) {
            return maxDelay;
        }
        return Duration.ofNanos((long) Math.min(nanos, MAX_NANOS));
    }

    /**
     * Computes the un-jittered delay for every retry the policy allows, in order.
     * Element {@code i} is the delay before retry {@code i + 1}.
     */
    public static List<Duration> schedule(RetryPolicy policy) {
        List<Duration> delays = new ArrayList<>(policy.maxRetries());
        for (int attempt = 1; attempt <= policy.maxRetries(); attempt++) {
            delays.add(computeDelay(attempt, policy.baseDelay(), policy.backoffMultiplier(), policy.maxDelay()));
        }
        return Collections.unmodifiableList(delays);
    }

    /**
     * Draws a full-jitter sleep for a computed delay.
     *
     * @param delay        the computed delay
     * @param jitterFactor widening of the upper bound
     * @param random       source of uniform values in {@code [0, 1)}
     * @return a duration in {@code [0, delay * (1 + jitterFactor)]}
     */
    public static Duration applyJitter(Duration delay, double jitterFactor, DoubleSupplier random) {
        double upper = delay.toNanos() * (1.0 + jitterFactor);
        double sample = random.getAsDouble();
        if (sample < 0.0) {
            sample = 0.0;
        } else if (sample > 1.0) {
            sample = 1.0;
        }
        return Duration.ofNanos((long) Math.min(upper * sample, MAX_NANOS));
    }

    /**
     * Returns the sleep to use before the given retry under the policy, jittered when enabled.
     */
    public static Duration sleepFor(int attempt, RetryPolicy policy, DoubleSupplier random) {
        Duration delay = computeDelay(attempt, policy.baseDelay(), policy.backoffMultiplier(), policy.maxDelay());
        return policy.jitterEnabled() ? applyJitter(delay, policy.jitterFactor(), random) : delay;
    }
}
