package com.siteguard.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModuleVersionResponse {

    private UUID id;
    private String version;
    private String branchKey; // null for unparseable version strings
    private boolean preRelease;
    private LocalDate releaseDate;
    private boolean securityUpdate;
}
