package com.vigil.health;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One {@link BoundedHistory} of check results per service.
 * <p>
 * Not thread-safe: {@link ServiceMonitor} guards it with its state lock.
 */
public final class HistoryStore {

    private final int capacity;
    private final Map<String, BoundedHistory<CheckResult>> histories = new HashMap<>();

    public HistoryStore(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    /**
     * Starts an empty history for the service, discarding any previous one.
     */
    public void reset(String serviceId) {
        histories.put(serviceId, new BoundedHistory<>(capacity));
    }

    /**
     * Appends a result to the service's history, creating the history on first use.
     */
    public BoundedHistory<CheckResult> append(String serviceId, CheckResult result) {
        BoundedHistory<CheckResult> history = histories.computeIfAbsent(serviceId, id -> new BoundedHistory<>(capacity));
        history.append(result);
        return history;
    }

    public Optional<BoundedHistory<CheckResult>> history(String serviceId) {
        return Optional.ofNullable(histories.get(serviceId));
    }

    public int capacity() {
        return capacity;
    }
}
