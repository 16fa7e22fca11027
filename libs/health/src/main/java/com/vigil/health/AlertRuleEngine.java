package com.vigil.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Raises alerts when a service accumulates consecutive failing results.
 * <p>
 * Failing means {@link HealthStatus#ERROR} or {@link HealthStatus#WARNING}. The failure count is
 * derived from history on every evaluation by walking back from the newest entry until the first
 * non-failing one, so there is no alert state to drift out of sync. Firing is level-triggered:
 * every evaluation at or above the threshold produces an alert.
 * <p>
 * {@link #evaluate} is pure and meant to run under the monitor's state lock; {@link #dispatch}
 * calls handlers and is meant to run outside it. Handlers are stored in a copy-on-write list so
 * registration and dispatch may overlap.
 */
public final class AlertRuleEngine {

    private static final Logger log = LoggerFactory.getLogger(AlertRuleEngine.class);

    private final int threshold;
    private final List<AlertHandler> handlers = new CopyOnWriteArrayList<>();

    public AlertRuleEngine(int threshold) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be positive");
        }
        this.threshold = threshold;
    }

    /**
     * Appends a handler; handlers are invoked in registration order.
     */
    public void addHandler(AlertHandler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        handlers.add(handler);
    }

    /**
     * Decides whether the latest result for a service warrants an alert.
     *
     * @param serviceId   the service
     * @param displayName its display name
     * @param result      the result just observed
     * @param history     the service's history, newest entry last
     * @return the alert to dispatch, or empty
     */
    public Optional<Alert> evaluate(String serviceId, String displayName, CheckResult result,
                                    BoundedHistory<CheckResult> history) {
        if (!result.status().isFailing()) {
            return Optional.empty();
        }
        int failures = consecutiveFailures(history);
        if (failures < threshold) {
            return Optional.empty();
        }
        return Optional.of(new Alert(serviceId, displayName, result.status(), result.message(), failures, result));
    }

    /**
     * Delivers an alert to every handler. A handler that throws is logged and skipped.
     */
    public void dispatch(Alert alert) {
        log.warn("Service health alert: {} - {}", alert.serviceId(), alert.message());
        for (AlertHandler handler : handlers) {
            try {
                handler.onAlert(alert.serviceId(), alert);
            } catch (RuntimeException e) {
                log.error("Error in alert handler {} for {}", handler, alert.serviceId(), e);
            }
        }
    }

    /**
     * Counts the run of failing results at the newest end of the history.
     */
    public static int consecutiveFailures(BoundedHistory<CheckResult> history) {
        int count = 0;
        Iterator<CheckResult> it = history.newestFirst();
        while (it.hasNext() && it.next().status().isFailing()) {
            count++;
        }
        return count;
    }

    public int threshold() {
        return threshold;
    }

    public int handlerCount() {
        return handlers.size();
    }
}
