package com.platform.releasecontroller.controller;

import java.time.Instant;

/**
 * Point-in-time view of the controller for the status endpoint.
 */
public record ControllerStatus(
    ReleaseController.Phase phase,
    boolean cacheSynced,
    int workers,
    int queueLength,
    long reconciled,
    long failed,
    long dropped,
    Instant startedAt,
    Instant lastSweep
) {
    
    /**
     * Running with at least one live worker.
     */
    public boolean isReady() {
        return phase == ReleaseController.Phase.RUNNING && workers > 0;
    }
}
