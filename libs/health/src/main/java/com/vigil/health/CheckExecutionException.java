package com.vigil.health;

/**
 * A check threw, returned nothing, or could not be scheduled. Wraps the underlying failure.
 */
public class CheckExecutionException extends HealthCheckException {

    public CheckExecutionException(String serviceId, Throwable cause) {
        super(serviceId, "Health check error: " + describe(cause), cause);
    }

    public CheckExecutionException(String serviceId, String message) {
        super(serviceId, "Health check error: " + message, null);
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
