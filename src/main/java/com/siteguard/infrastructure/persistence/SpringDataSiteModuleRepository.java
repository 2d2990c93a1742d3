package com.siteguard.infrastructure.persistence;

import com.siteguard.domain.model.SiteModule;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SpringDataSiteModuleRepository extends JpaRepository<SiteModule, UUID> {

    @Query("SELECT sm FROM SiteModule sm "
        + "JOIN FETCH sm.module "
        + "JOIN FETCH sm.currentVersion "
        + "WHERE sm.site.id = :siteId")
    List<SiteModule> findBySiteId(@Param("siteId") UUID siteId);

    @Query("SELECT sm FROM SiteModule sm JOIN FETCH sm.currentVersion WHERE sm.module.id = :moduleId")
    List<SiteModule> findByModuleId(@Param("moduleId") UUID moduleId);

    @Query("SELECT DISTINCT sm.site.id FROM SiteModule sm WHERE sm.module.id = :moduleId")
    List<UUID> findSiteIdsByModuleId(@Param("moduleId") UUID moduleId);

    long countByModuleId(UUID moduleId);

    @Query(value = "SELECT sm FROM SiteModule sm "
        + "JOIN FETCH sm.module m "
        + "JOIN FETCH sm.currentVersion "
        + "LEFT JOIN FETCH sm.latestVersion "
        + "WHERE sm.site.id = :siteId "
        + "AND (:updateAvailable IS NULL OR sm.updateAvailable = :updateAvailable) "
        + "AND (:securityUpdateAvailable IS NULL OR sm.securityUpdateAvailable = :securityUpdateAvailable)",
        countQuery = "SELECT COUNT(sm) FROM SiteModule sm "
        + "WHERE sm.site.id = :siteId "
        + "AND (:updateAvailable IS NULL OR sm.updateAvailable = :updateAvailable) "
        + "AND (:securityUpdateAvailable IS NULL OR sm.securityUpdateAvailable = :securityUpdateAvailable)")
    Page<SiteModule> findPageBySiteId(@Param("siteId") UUID siteId,
                                      @Param("updateAvailable") Boolean updateAvailable,
                                      @Param("securityUpdateAvailable") Boolean securityUpdateAvailable,
                                      Pageable pageable);
}
