package com.vigil.health;

/**
 * Receives alerts raised by the {@link AlertRuleEngine}.
 * <p>
 * Alerts are level-triggered: a handler is called on every evaluation while a service stays at or
 * above the threshold, so implementations should be idempotent. Exceptions thrown here are logged
 * and never reach the monitor.
 */
@FunctionalInterface
public interface AlertHandler {

    void onAlert(String serviceId, Alert alert);
}
