package com.siteguard.domain.repository;

import com.siteguard.domain.model.PatchRun;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.UUID;

/**
 * Append-only store of patch runs.
 */
public interface PatchRunRepository {

    PatchRun append(PatchRun patchRun);

    /**
     * Patch runs of a site, newest first.
     */
    Page<PatchRun> findBySite(UUID siteId, Pageable pageable);
}
