package com.siteguard.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Catalog entry of one module for the reporting layer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModuleSummaryResponse {

    private UUID id;
    private String machineName;
    private String displayName;
    private String category;
    private String link;
    private int versionCount;
    private String latestVersion;
    private String latestSecurityVersion;
    private boolean hasSecurityUpdate;
    private long installCount;
}
