package com.vigil.resilience;

import java.time.Duration;

/**
 * Blocking pause between retry attempts. Replaced in tests to record delays without sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    /**
     * Returns a sleeper backed by {@link Thread#sleep(long, int)}.
     */
    static Sleeper system() {
        return duration -> {
            if (!duration.isZero() && !duration.isNegative()) {
                Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
            }
        };
    }
}
