package com.libragraph.datasink.core.service;

/**
 * Thrown when a caller reaches a {@link ManagedService} that is not RUNNING.
 */
public class ServiceUnavailableException extends IllegalStateException {

    private final String serviceId;
    private final ManagedService.State state;

    public ServiceUnavailableException(String serviceId, ManagedService.State state) {
        super("Service '" + serviceId + "' is not running (state=" + state + ")");
        this.serviceId = serviceId;
        this.state = state;
    }

    public String serviceId() {
        return serviceId;
    }

    public ManagedService.State state() {
        return state;
    }
}
