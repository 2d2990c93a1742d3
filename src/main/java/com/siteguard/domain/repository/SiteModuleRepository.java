package com.siteguard.domain.repository;

import com.siteguard.domain.model.Module;
import com.siteguard.domain.model.Site;
import com.siteguard.domain.model.SiteModule;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.UUID;

/**
 * Port for the current per-site module inventory. (site, module) is unique.
 */
public interface SiteModuleRepository {

    List<SiteModule> findBySite(Site site);

    List<SiteModule> findByModule(Module module);

    /**
     * Distinct ids of sites that currently have the module installed.
     */
    List<UUID> findSiteIdsByModule(Module module);

    void save(SiteModule siteModule);

    void delete(SiteModule siteModule);

    long countByModule(Module module);

    /**
     * Page through a site's inventory. Null flags do not filter.
     */
    Page<SiteModule> findBySite(UUID siteId, Boolean updateAvailable, Boolean securityUpdateAvailable,
                                Pageable pageable);
}
