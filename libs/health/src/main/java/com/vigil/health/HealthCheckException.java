package com.vigil.health;

/**
 * Base type for failures of a single health check invocation.
 */
public abstract class HealthCheckException extends RuntimeException {

    private final String serviceId;

    protected HealthCheckException(String serviceId, String message, Throwable cause) {
        super(message, cause);
        this.serviceId = serviceId;
    }

    public String serviceId() {
        return serviceId;
    }
}
