package com.siteguard.infrastructure.persistence;

import com.siteguard.domain.model.Site;
import com.siteguard.domain.repository.SiteRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import jakarta.persistence.PersistenceContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Adapter implementing the site port.
 *
 * <p>The per-site lock is a {@code SELECT ... FOR UPDATE} on the site row, bounded by a
 * transaction-local {@code lock_timeout}. The row is refreshed under the lock so aggregates
 * written afterwards never rest on state read before a concurrent synchronization committed.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class SiteRepositoryAdapter implements SiteRepository {

    private static final String LOCK_TIMEOUT_HINT = "jakarta.persistence.lock.timeout";

    private final SpringDataSiteRepository springDataRepository;

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public Optional<Site> findById(UUID siteId) {
        return springDataRepository.findById(siteId);
    }

    @Override
    public Optional<Site> lockForSynchronization(UUID siteId, Duration lockTimeout) {
        PostgresSessionUtil.applyLockTimeout(entityManager, lockTimeout);

        Site site = entityManager.find(Site.class, siteId);
        if (site == null) {
            return Optional.empty();
        }
        entityManager.refresh(site, LockModeType.PESSIMISTIC_WRITE, Map.of(LOCK_TIMEOUT_HINT, lockTimeout.toMillis()));

        if (log.isDebugEnabled()) {
            log.debug("Acquired synchronization lock: siteId={}", siteId);
        }
        return Optional.of(site);
    }

    @Override
    public void save(Site site) {
        if (!entityManager.contains(site)) {
            entityManager.persist(site);
        }
    }
}
