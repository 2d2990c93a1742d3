package com.siteguard.infrastructure.persistence;

import com.siteguard.domain.model.PatchRun;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface SpringDataPatchRunRepository extends JpaRepository<PatchRun, UUID> {

    @Query(value = "SELECT p FROM PatchRun p WHERE p.site.id = :siteId ORDER BY p.runAt DESC",
        countQuery = "SELECT COUNT(p) FROM PatchRun p WHERE p.site.id = :siteId")
    Page<PatchRun> findBySiteId(@Param("siteId") UUID siteId, Pageable pageable);
}
