package com.siteguard.application;

import com.siteguard.domain.service.SecurityPosture;

import java.util.UUID;

/**
 * Committed result of one site synchronization.
 *
 * @param patchRunId id of the appended patch run, null when nothing changed
 */
public record SynchronizationOutcome(
    UUID siteId,
    SyncResult result,
    SecurityPosture posture,
    UUID patchRunId
) {
}
