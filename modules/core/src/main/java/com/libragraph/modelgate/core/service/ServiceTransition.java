package com.libragraph.modelgate.core.service;

import java.time.Instant;

/**
 * CDI event for one state change of a {@link ManagedService}.
 *
 * @param reason failure message, recovery note, or null for ordinary lifecycle steps
 */
public record ServiceTransition(
        String serviceId,
        ManagedService.State from,
        ManagedService.State to,
        String reason,
        Instant at
) {
    public boolean isFailure() {
        return to == ManagedService.State.FAILED;
    }

    /** FAILED straight back to RUNNING, as done by {@link ManagedService#recover()}. */
    public boolean isRecovery() {
        return from == ManagedService.State.FAILED && to == ManagedService.State.RUNNING;
    }
}
