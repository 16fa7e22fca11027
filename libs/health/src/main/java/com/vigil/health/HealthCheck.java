package com.vigil.health;

/**
 * Probe that determines one dependency's current health.
 * <p>
 * Implementations may block on network I/O and may throw; the {@link ServiceMonitor} runs them on
 * its worker pool under a timeout and turns any failure into an {@link HealthStatus#ERROR} result.
 * <p>
 * Example usage:
 * <pre>{@code
 * HealthCheck postgres = () -> {
 *     long start = System.nanoTime();
 *     try (Connection c = dataSource.getConnection()) {
 *         boolean valid = c.isValid(2);
 *         long ms = (System.nanoTime() - start) / 1_000_000;
 *         return valid ? CheckResult.ok("postgres reachable", ms) : CheckResult.error("connection invalid");
 *     }
 * };
 * }</pre>
 */
@FunctionalInterface
public interface HealthCheck {

    /**
     * Performs the probe.
     *
     * @return the result, never null
     * @throws Exception if the probe could not be carried out
     */
    CheckResult check() throws Exception;
}
