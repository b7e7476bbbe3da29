package com.libragraph.datasink.core.service;

import java.time.Instant;

/**
 * Fired whenever a {@link ManagedService} changes state. {@code reason} carries the
 * failure message for transitions into FAILED and is null otherwise.
 */
public record ServiceStateChangedEvent(
        String serviceId,
        ManagedService.State oldState,
        ManagedService.State newState,
        String reason,
        Instant timestamp
) {
    public boolean isFailure() {
        return newState == ManagedService.State.FAILED;
    }
}
