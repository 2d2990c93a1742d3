package com.siteguard.domain.repository;

import com.siteguard.domain.model.Site;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Port for sites. Site identity is owned by the site management layer; the engine only
 * reads sites and writes their aggregates.
 */
public interface SiteRepository {

    Optional<Site> findById(UUID siteId);

    /**
     * Acquire the per-site mutual-exclusion lock for the rest of the current transaction.
     *
     * @param siteId      site to lock
     * @param lockTimeout maximum time to wait for a concurrent synchronization of the same site
     * @return the locked site, freshly read
     */
    Optional<Site> lockForSynchronization(UUID siteId, Duration lockTimeout);

    void save(Site site);
}
