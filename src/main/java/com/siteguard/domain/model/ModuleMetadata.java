package com.siteguard.domain.model;

/**
 * Descriptive module fields as reported by a submitter. Any field may be null.
 */
public record ModuleMetadata(
    String displayName,
    ModuleCategory category,
    String link
) {

    public static ModuleMetadata empty() {
        return new ModuleMetadata(null, null, null);
    }
}
