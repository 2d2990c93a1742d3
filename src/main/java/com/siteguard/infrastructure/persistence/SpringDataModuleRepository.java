package com.siteguard.infrastructure.persistence;

import com.siteguard.domain.model.Module;
import com.siteguard.domain.model.ModuleCategory;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Spring Data JPA repository for modules.
 */
@Repository
public interface SpringDataModuleRepository extends JpaRepository<Module, UUID> {

    /**
     * Module id for a machine name. Cached: machine names are immutable and modules are never
     * hard-deleted, so a resolved id never goes stale. Misses are not cached.
     */
    @Cacheable(value = "moduleIdsByMachineName", unless = "#result == null")
    @Query("SELECT m.id FROM Module m WHERE m.machineName = :machineName")
    UUID findIdByMachineName(@Param("machineName") String machineName);

    @Query("SELECT m FROM Module m WHERE m.deleted = false "
        + "AND (:category IS NULL OR m.category = :category)")
    Page<Module> search(@Param("category") ModuleCategory category, Pageable pageable);

    @Query("SELECT m FROM Module m WHERE m.deleted = false "
        + "AND (:category IS NULL OR m.category = :category) "
        + "AND EXISTS (SELECT v.id FROM ModuleVersion v "
        + "            WHERE v.module = m AND v.securityUpdate = true AND v.deleted = false)")
    Page<Module> searchWithSecurityReleases(@Param("category") ModuleCategory category, Pageable pageable);

    @Query("SELECT m FROM Module m WHERE m.deleted = false "
        + "AND (:category IS NULL OR m.category = :category) "
        + "AND NOT EXISTS (SELECT v.id FROM ModuleVersion v "
        + "                WHERE v.module = m AND v.securityUpdate = true AND v.deleted = false)")
    Page<Module> searchWithoutSecurityReleases(@Param("category") ModuleCategory category, Pageable pageable);

    Optional<Module> findByMachineName(String machineName);
}
