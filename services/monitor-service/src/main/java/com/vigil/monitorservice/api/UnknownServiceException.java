package com.vigil.monitorservice.api;

/**
 * Raised when a request names a service id the monitor does not know.
 */
public class UnknownServiceException extends RuntimeException {

    private final String serviceId;

    public UnknownServiceException(String serviceId) {
        super("Unknown service: " + serviceId);
        this.serviceId = serviceId;
    }

    public String serviceId() {
        return serviceId;
    }
}
