package com.siteguard.domain.model;

import com.siteguard.domain.service.UpdateAssessment;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Current installed state of one {@link Module} on one {@link Site}.
 *
 * <p>(site, module) is unique. The row only holds the present state; history lives in
 * {@link PatchRun}s.
 */
@Entity
@Table(
    name = "site_modules",
    uniqueConstraints = @UniqueConstraint(name = "uq_site_module", columnNames = {"site_id", "module_id"}),
    indexes = {
        @Index(name = "idx_site_module_flags", columnList = "site_id, update_available, security_update_available"),
        @Index(name = "idx_site_module_module", columnList = "module_id")
    }
)
@Getter
@DynamicUpdate
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SiteModule {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "site_id", nullable = false, updatable = false)
    private Site site;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "module_id", nullable = false, updatable = false)
    private Module module;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "current_version_id", nullable = false)
    private ModuleVersion currentVersion;

    /**
     * Highest-precedence upgrade candidate, null when up to date.
     */
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "latest_version_id")
    private ModuleVersion latestVersion;

    @Column(name = "enabled", nullable = false)
    private boolean enabled;

    @Column(name = "update_available", nullable = false)
    private boolean updateAvailable;

    @Column(name = "security_update_available", nullable = false)
    private boolean securityUpdateAvailable;

    @Column(name = "version_updated_at", nullable = false)
    private Instant versionUpdatedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    private SiteModule(UUID id, Site site, Module module, ModuleVersion currentVersion,
                       boolean enabled, Instant now) {
        this.id = id;
        this.site = site;
        this.module = module;
        this.currentVersion = currentVersion;
        this.enabled = enabled;
        this.versionUpdatedAt = now;
        this.createdAt = now;
        this.updatedAt = now;
    }

    public static SiteModule install(Site site, Module module, ModuleVersion version, boolean enabled, Instant now) {
        return new SiteModule(UUID.randomUUID(), site, module, version, enabled, now);
    }

    /**
     * Point this row at the reported version and enabled state.
     *
     * @return true if either differs from the stored state
     */
    public boolean moveTo(ModuleVersion version, boolean enabled, Instant now) {
        boolean versionChanged = !sameVersion(currentVersion, version);
        boolean enabledChanged = this.enabled != enabled;

        if (versionChanged) {
            currentVersion = version;
            versionUpdatedAt = now;
        }
        this.enabled = enabled;
        if (versionChanged || enabledChanged) {
            updatedAt = now;
        }
        return versionChanged || enabledChanged;
    }

    /**
     * Store the outcome of update detection.
     *
     * @return true if either flag changed
     */
    public boolean applyAssessment(UpdateAssessment assessment, Instant now) {
        boolean flagsChanged = updateAvailable != assessment.updateAvailable()
            || securityUpdateAvailable != assessment.securityUpdateAvailable();
        boolean latestChanged = !sameVersion(latestVersion, assessment.latestVersion());

        updateAvailable = assessment.updateAvailable();
        securityUpdateAvailable = assessment.securityUpdateAvailable();
        latestVersion = assessment.latestVersion();
        if (flagsChanged || latestChanged) {
            updatedAt = now;
        }
        return flagsChanged;
    }

    /**
     * Update available that is not security relevant.
     */
    public boolean isNonSecurityUpdateAvailable() {
        return updateAvailable && !securityUpdateAvailable;
    }

    public Snapshot snapshot() {
        return new Snapshot(currentVersion.getId(), enabled, updateAvailable, securityUpdateAvailable);
    }

    private static boolean sameVersion(ModuleVersion left, ModuleVersion right) {
        if (left == null || right == null) {
            return left == right;
        }
        return Objects.equals(left.getId(), right.getId());
    }

    /**
     * State of a row before a synchronization, used to decide whether anything changed.
     */
    public record Snapshot(
        UUID versionId,
        boolean enabled,
        boolean updateAvailable,
        boolean securityUpdateAvailable
    ) {
    }
}
