package com.siteguard.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatchRunResponse {

    private UUID id;
    private Instant runAt;
    private int modulesUpdated;
    private int securityPatchesApplied;
    private int modulesAdded;
    private int modulesRemoved;
    private int securityScore;
}
