package com.siteguard.application;

import java.util.List;
import java.util.UUID;

/**
 * A site's complete module report together with its platform metadata.
 *
 * <p>Site URL and name are owned by site management and are not taken from manifests.
 */
public record Manifest(
    UUID siteId,
    String coreVersion,
    String runtimeVersion,
    List<ModuleReport> modules
) {

    public Manifest {
        modules = modules == null ? List.of() : List.copyOf(modules);
    }

    public boolean assertsSecurityUpdates() {
        return modules.stream().anyMatch(ModuleReport::assertsSecurityUpdate);
    }
}
