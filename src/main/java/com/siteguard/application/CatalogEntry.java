package com.siteguard.application;

import com.siteguard.domain.model.Module;
import com.siteguard.domain.model.ModuleVersion;

/**
 * Result of reconciling one module/version pair against the catalog.
 */
public record CatalogEntry(
    Module module,
    ModuleVersion version,
    boolean moduleCreated,
    boolean versionCreated,
    boolean versionPromoted
) {
}
