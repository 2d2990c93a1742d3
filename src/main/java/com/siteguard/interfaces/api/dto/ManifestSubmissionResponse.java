package com.siteguard.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Response DTO for an accepted manifest.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManifestSubmissionResponse {

    private UUID siteId;
    private boolean changed;
    private int modulesProcessed;
    private int modulesAdded;
    private int modulesRemoved;
    private int modulesUpdated;
    private int securityPatchesApplied;
    private int securityScore;
    private int totalModulesCount;
    private int securityUpdatesCount;
    private int nonSecurityUpdatesCount;
    private UUID patchRunId; // null when nothing changed
}
