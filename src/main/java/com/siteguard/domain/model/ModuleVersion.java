package com.siteguard.domain.model;

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
import java.time.LocalDate;
import java.util.UUID;

/**
 * One released version of a {@link Module}.
 *
 * <p>(module, version string) is unique. The security flag is explicit catalog data and
 * may only move from {@code false} to {@code true}, and only through the authoritative
 * catalog feed, which re-evaluates every dependent site afterwards.
 */
@Entity
@Table(
    name = "module_versions",
    uniqueConstraints = @UniqueConstraint(name = "uq_module_version", columnNames = {"module_id", "version_string"}),
    indexes = {
        @Index(name = "idx_module_version_security", columnList = "module_id, security_update"),
        @Index(name = "idx_module_version_sort", columnList = "module_id, sort_key")
    }
)
@Getter
@DynamicUpdate
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ModuleVersion {

    public static final int MAX_VERSION_LENGTH = 100;

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "module_id", nullable = false, updatable = false)
    private Module module;

    @Column(name = "version_string", nullable = false, updatable = false, length = MAX_VERSION_LENGTH)
    private String versionString;

    @Column(name = "sort_key", nullable = false, updatable = false, length = 200)
    private String sortKey;

    @Column(name = "release_date")
    private LocalDate releaseDate;

    @Column(name = "security_update", nullable = false)
    private boolean securityUpdate;

    @Column(name = "deleted", nullable = false)
    private boolean deleted;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    private ModuleVersion(UUID id, Module module, String versionString, String sortKey,
                          LocalDate releaseDate, boolean securityUpdate, Instant createdAt) {
        this.id = id;
        this.module = module;
        this.versionString = versionString;
        this.sortKey = sortKey;
        this.releaseDate = releaseDate;
        this.securityUpdate = securityUpdate;
        this.createdAt = createdAt;
    }

    public static ModuleVersion create(Module module, String versionString, String sortKey,
                                       LocalDate releaseDate, boolean securityUpdate, Instant now) {
        return new ModuleVersion(UUID.randomUUID(), module, versionString, sortKey,
            releaseDate, securityUpdate, now);
    }

    /**
     * Mark this version as a security release.
     *
     * @return true if the flag changed
     */
    public boolean promoteToSecurityUpdate() {
        if (securityUpdate) {
            return false;
        }
        securityUpdate = true;
        return true;
    }

    /**
     * Record the release date if it was unknown.
     *
     * @return true if the date changed
     */
    public boolean recordReleaseDate(LocalDate date) {
        if (releaseDate != null || date == null) {
            return false;
        }
        releaseDate = date;
        return true;
    }
}
