package com.vigil.health;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registered services keyed by id, enumerated in first-registration order.
 * <p>
 * Registration is idempotent: registering an existing id replaces its entry in place.
 * Not thread-safe: {@link ServiceMonitor} guards it with its state lock.
 */
public final class HealthCheckRegistry {

    private final Map<String, ServiceRegistration> registrations = new LinkedHashMap<>();

    /**
     * Adds or replaces a registration.
     *
     * @return the registration that was replaced, if any
     */
    public Optional<ServiceRegistration> register(ServiceRegistration registration) {
        if (registration == null) {
            throw new IllegalArgumentException("registration must not be null");
        }
        return Optional.ofNullable(registrations.put(registration.serviceId(), registration));
    }

    public Optional<ServiceRegistration> get(String serviceId) {
        return Optional.ofNullable(registrations.get(serviceId));
    }

    public boolean contains(String serviceId) {
        return registrations.containsKey(serviceId);
    }

    /** Snapshot of all registrations. */
    public List<ServiceRegistration> all() {
        return List.copyOf(registrations.values());
    }

    public int size() {
        return registrations.size();
    }
}
