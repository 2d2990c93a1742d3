package com.siteguard.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Aggregate security state of a site as of its last synchronization.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SecuritySummaryResponse {

    private UUID siteId;
    private String name;
    private String url;
    private String coreVersion;
    private String runtimeVersion;
    private int securityScore;
    private int totalModulesCount;
    private int securityUpdatesCount;
    private int nonSecurityUpdatesCount;
    private Instant lastDataPush;
}
