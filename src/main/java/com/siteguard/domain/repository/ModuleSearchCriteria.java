package com.siteguard.domain.repository;

import com.siteguard.domain.model.ModuleCategory;

/**
 * Filters for the module catalog listing. Null fields do not filter.
 *
 * @param category          module category
 * @param hasSecurityUpdate whether the module has at least one non-deleted security release
 */
public record ModuleSearchCriteria(ModuleCategory category, Boolean hasSecurityUpdate) {

    public static ModuleSearchCriteria any() {
        return new ModuleSearchCriteria(null, null);
    }
}
