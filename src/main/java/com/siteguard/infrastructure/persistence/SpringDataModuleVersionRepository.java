package com.siteguard.infrastructure.persistence;

import com.siteguard.domain.model.ModuleVersion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SpringDataModuleVersionRepository extends JpaRepository<ModuleVersion, UUID> {

    @Query("SELECT v FROM ModuleVersion v WHERE v.module.id = :moduleId AND v.versionString = :versionString")
    Optional<ModuleVersion> findByModuleAndVersion(@Param("moduleId") UUID moduleId,
                                                   @Param("versionString") String versionString);

    @Query("SELECT v FROM ModuleVersion v WHERE v.module.id = :moduleId ORDER BY v.sortKey")
    List<ModuleVersion> findByModuleId(@Param("moduleId") UUID moduleId);
}
