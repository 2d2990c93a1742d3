package com.siteguard.application;

/**
 * Outcome of synchronizing one manifest into a site's inventory.
 *
 * @param changed                any row was added, removed, moved, re-enabled/disabled or re-flagged
 * @param modulesProcessed       number of module reports in the manifest
 * @param modulesAdded           modules newly installed on the site
 * @param modulesRemoved         modules no longer reported
 * @param modulesUpdated         installed modules whose version changed
 * @param securityPatchesApplied version changes that moved past a security release
 */
public record SyncResult(
    boolean changed,
    int modulesProcessed,
    int modulesAdded,
    int modulesRemoved,
    int modulesUpdated,
    int securityPatchesApplied
) {
}
