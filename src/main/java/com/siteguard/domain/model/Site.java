package com.siteguard.domain.model;

import com.siteguard.domain.service.SecurityPosture;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;
import java.util.UUID;

/**
 * A monitored installation, owned by exactly one organization.
 *
 * <p>Identity, URL and name belong to the site management layer. The ingestion engine is the
 * sole writer of the platform metadata, the aggregate counters and the security score.
 */
@Entity
@Table(name = "sites")
@Getter
@DynamicUpdate
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
public class Site {

    public static final int MAX_SCORE = 100;

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "organization_id", nullable = false, updatable = false)
    private UUID organizationId;

    @Column(name = "url", nullable = false, length = 500)
    private String url;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "core_version", length = 100)
    private String coreVersion;

    @Column(name = "runtime_version", length = 100)
    private String runtimeVersion;

    @Column(name = "total_modules_count", nullable = false)
    private int totalModulesCount;

    @Column(name = "security_updates_count", nullable = false)
    private int securityUpdatesCount;

    @Column(name = "non_security_updates_count", nullable = false)
    private int nonSecurityUpdatesCount;

    @Column(name = "security_score", nullable = false)
    private int securityScore = MAX_SCORE;

    @Column(name = "last_data_push")
    private Instant lastDataPush;

    @Column(name = "deleted", nullable = false)
    private boolean deleted;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    private Site(UUID id, UUID organizationId, String url, String name, Instant createdAt) {
        this.id = id;
        this.organizationId = organizationId;
        this.url = url;
        this.name = name;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    /**
     * Register a site. Normally done by the site management layer; used here for seeding and tests.
     */
    public static Site register(UUID id, UUID organizationId, String url, String name, Instant now) {
        return new Site(id, organizationId, url, name, now);
    }

    /**
     * Record a received manifest push with the platform metadata it carried.
     * Null metadata leaves the stored value unchanged.
     */
    public void recordPush(String coreVersion, String runtimeVersion, Instant pushedAt) {
        if (coreVersion != null && !coreVersion.isBlank()) {
            this.coreVersion = coreVersion.trim();
        }
        if (runtimeVersion != null && !runtimeVersion.isBlank()) {
            this.runtimeVersion = runtimeVersion.trim();
        }
        this.lastDataPush = pushedAt;
        this.updatedAt = pushedAt;
    }

    /**
     * Overwrite aggregate counters and score with a freshly computed posture.
     *
     * @return true if any counter or the score changed
     */
    public boolean applySecurityPosture(SecurityPosture posture, Instant now) {
        boolean changed = totalModulesCount != posture.totalModules()
            || securityUpdatesCount != posture.securityUpdates()
            || nonSecurityUpdatesCount != posture.nonSecurityUpdates()
            || securityScore != posture.score();

        totalModulesCount = posture.totalModules();
        securityUpdatesCount = posture.securityUpdates();
        nonSecurityUpdatesCount = posture.nonSecurityUpdates();
        securityScore = posture.score();
        if (changed) {
            updatedAt = now;
        }
        return changed;
    }

    public SecurityPosture currentPosture() {
        return new SecurityPosture(totalModulesCount, securityUpdatesCount, nonSecurityUpdatesCount, securityScore);
    }
}
