package com.siteguard.domain.service;

import com.siteguard.domain.model.ModuleVersion;

/**
 * Update status of one installed module version against the catalog.
 *
 * @param updateAvailable         a strictly newer eligible version exists
 * @param securityUpdateAvailable a strictly newer eligible version is flagged as a security release
 * @param latestVersion           highest eligible version, null when up to date
 * @param latestSecurityVersion   highest eligible security release, null when none
 */
public record UpdateAssessment(
    boolean updateAvailable,
    boolean securityUpdateAvailable,
    ModuleVersion latestVersion,
    ModuleVersion latestSecurityVersion
) {

    private static final UpdateAssessment UP_TO_DATE = new UpdateAssessment(false, false, null, null);

    public static UpdateAssessment upToDate() {
        return UP_TO_DATE;
    }
}
