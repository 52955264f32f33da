package com.kg.core.service.lifecycle;

/**
 * Exception thrown when an update is published while the coordinator is degraded.
 */
public class ServiceDegradedException extends RuntimeException {

    public static final String SERVICE_DEGRADED = "SERVICE_DEGRADED";

    private final String updateId;

    public ServiceDegradedException(String updateId) {
        super("Knowledge graph service is in degraded mode");
        this.updateId = updateId;
    }

    public String getUpdateId() {
        return updateId;
    }

    public String getErrorCode() {
        return SERVICE_DEGRADED;
    }
}
