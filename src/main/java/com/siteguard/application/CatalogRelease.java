package com.siteguard.application;

import com.siteguard.domain.model.ModuleMetadata;

import java.time.LocalDate;

/**
 * One authoritative release published by the catalog feed.
 */
public record CatalogRelease(
    String machineName,
    ModuleMetadata metadata,
    String version,
    LocalDate releaseDate,
    boolean securityUpdate
) {
}
