package com.siteguard.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only snapshot of one synchronization that changed a site's inventory.
 *
 * <p>Never updated or deleted under normal operation.
 */
@Entity
@Immutable
@Table(
    name = "patch_runs",
    indexes = @Index(name = "idx_patch_run_site_time", columnList = "site_id, run_at")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PatchRun {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "site_id", nullable = false, updatable = false)
    private Site site;

    @Column(name = "run_at", nullable = false, updatable = false)
    private Instant runAt;

    @Column(name = "modules_updated", nullable = false, updatable = false)
    private int modulesUpdated;

    @Column(name = "security_patches_applied", nullable = false, updatable = false)
    private int securityPatchesApplied;

    @Column(name = "modules_added", nullable = false, updatable = false)
    private int modulesAdded;

    @Column(name = "modules_removed", nullable = false, updatable = false)
    private int modulesRemoved;

    @Column(name = "security_score", nullable = false, updatable = false)
    private int securityScore;

    private PatchRun(UUID id, Site site, Instant runAt, int modulesUpdated, int securityPatchesApplied,
                     int modulesAdded, int modulesRemoved, int securityScore) {
        this.id = id;
        this.site = site;
        this.runAt = runAt;
        this.modulesUpdated = modulesUpdated;
        this.securityPatchesApplied = securityPatchesApplied;
        this.modulesAdded = modulesAdded;
        this.modulesRemoved = modulesRemoved;
        this.securityScore = securityScore;
    }

    public static PatchRun capture(Site site, Instant runAt, int modulesUpdated, int securityPatchesApplied,
                                  int modulesAdded, int modulesRemoved) {
        return new PatchRun(UUID.randomUUID(), site, runAt, modulesUpdated, securityPatchesApplied,
            modulesAdded, modulesRemoved, site.getSecurityScore());
    }
}
