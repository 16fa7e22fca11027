package com.vigil.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default alert handler: writes each alert to the log at WARN.
 */
public final class LoggingAlertHandler implements AlertHandler {

    private static final Logger log = LoggerFactory.getLogger(LoggingAlertHandler.class);

    @Override
    public void onAlert(String serviceId, Alert alert) {
        log.warn("HEALTH ALERT: {} ({}) is {} - {} [{} consecutive failures]",
                alert.displayName(), serviceId, alert.status(), alert.message(), alert.failureCount());
    }

    @Override
    public String toString() {
        return "LoggingAlertHandler";
    }
}
