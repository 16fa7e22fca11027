package com.vigil.health;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Last freshly computed result per service, reused while younger than the TTL.
 * <p>
 * A zero TTL disables caching. Not thread-safe: {@link ServiceMonitor} guards it with its state lock.
 */
public final class ResultCache {

    private record Entry(Instant capturedAt, CheckResult result) {
    }

    private final Duration ttl;
    private final Map<String, Entry> entries = new HashMap<>();

    public ResultCache(Duration ttl) {
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be null or negative");
        }
        this.ttl = ttl;
    }

    /**
     * Returns the cached result if its age at {@code now} is below the TTL. Stale entries are dropped.
     */
    public Optional<CheckResult> getFresh(String serviceId, Instant now) {
        Entry entry = entries.get(serviceId);
        if (entry == null) {
            return Optional.empty();
        }
        Duration age = Duration.between(entry.capturedAt(), now);
        if (age.isNegative() || age.compareTo(ttl) >= 0) {
            entries.remove(serviceId);
            return Optional.empty();
        }
        return Optional.of(entry.result());
    }

    /**
     * Stores a freshly computed result. Ignored when caching is disabled.
     */
    public void put(String serviceId, CheckResult result, Instant capturedAt) {
        if (isEnabled()) {
            entries.put(serviceId, new Entry(capturedAt, result));
        }
    }

    public void invalidate(String serviceId) {
        entries.remove(serviceId);
    }

    public boolean isEnabled() {
        return !ttl.isZero();
    }

    public Duration ttl() {
        return ttl;
    }
}
