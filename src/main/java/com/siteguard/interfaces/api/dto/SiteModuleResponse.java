package com.siteguard.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Installed module of a site with its update status.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SiteModuleResponse {

    private String machineName;
    private String displayName;
    private String category;
    private String currentVersion;
    private String latestVersion;
    private boolean currentVersionSecurityUpdate;
    private boolean enabled;
    private boolean updateAvailable;
    private boolean securityUpdateAvailable;
    private Instant versionUpdatedAt;
}
