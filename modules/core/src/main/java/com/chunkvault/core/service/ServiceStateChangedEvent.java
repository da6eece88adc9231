package com.chunkvault.core.service;

import java.time.Instant;

/**
 * Fired via CDI whenever a {@link ManagedService} transitions between states.
 *
 * @param cause message of the failure behind a transition to {@code FAILED}, otherwise null
 */
public record ServiceStateChangedEvent(
        String serviceId,
        ManagedService.State oldState,
        ManagedService.State newState,
        Instant timestamp,
        String cause
) {

    public boolean isFailure() {
        return newState == ManagedService.State.FAILED;
    }
}
