package com.siteguard.infrastructure.persistence;

import com.siteguard.domain.model.Module;
import com.siteguard.domain.model.Site;
import com.siteguard.domain.model.SiteModule;
import com.siteguard.domain.repository.SiteModuleRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Adapter implementing the site inventory port. New rows are persisted directly so the
 * caller keeps working with the managed instance.
 */
@Repository
@RequiredArgsConstructor
public class SiteModuleRepositoryAdapter implements SiteModuleRepository {

    private final SpringDataSiteModuleRepository springDataRepository;

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<SiteModule> findBySite(Site site) {
        return springDataRepository.findBySiteId(site.getId());
    }

    @Override
    public List<SiteModule> findByModule(Module module) {
        return springDataRepository.findByModuleId(module.getId());
    }

    @Override
    public List<UUID> findSiteIdsByModule(Module module) {
        return springDataRepository.findSiteIdsByModuleId(module.getId());
    }

    @Override
    public void save(SiteModule siteModule) {
        if (!entityManager.contains(siteModule)) {
            entityManager.persist(siteModule);
        }
    }

    @Override
    public void delete(SiteModule siteModule) {
        springDataRepository.delete(siteModule);
    }

    @Override
    public long countByModule(Module module) {
        return springDataRepository.countByModuleId(module.getId());
    }

    @Override
    public Page<SiteModule> findBySite(UUID siteId, Boolean updateAvailable, Boolean securityUpdateAvailable,
                                       Pageable pageable) {
        return springDataRepository.findPageBySiteId(siteId, updateAvailable, securityUpdateAvailable, pageable);
    }
}
