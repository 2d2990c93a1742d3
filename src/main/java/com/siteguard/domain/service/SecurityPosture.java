package com.siteguard.domain.service;

/**
 * Aggregate security state of a site.
 */
public record SecurityPosture(
    int totalModules,
    int securityUpdates,
    int nonSecurityUpdates,
    int score
) {
}
