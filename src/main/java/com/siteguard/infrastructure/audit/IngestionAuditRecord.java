package com.siteguard.infrastructure.audit;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only record of a raw inbound submission and how it was processed, kept for replay
 * and diagnosis.
 */
@Entity
@Immutable
@Table(
    name = "ingestion_audit_log",
    indexes = {
        @Index(name = "idx_audit_site_time", columnList = "site_id, received_at"),
        @Index(name = "idx_audit_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class IngestionAuditRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "request_id", nullable = false, updatable = false)
    private UUID requestId;

    @Column(name = "site_id", updatable = false)
    private UUID siteId;

    @Column(name = "principal_id", updatable = false)
    private String principalId;

    @Column(name = "principal_type", length = 20, updatable = false)
    private String principalType;

    @Column(name = "source_ip", length = 64, updatable = false)
    private String sourceIp;

    @Column(name = "submission_type", nullable = false, length = 30, updatable = false)
    private String submissionType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20, updatable = false)
    private AuditStatus status;

    @Column(name = "modules_reported", updatable = false)
    private Integer modulesReported;

    @Column(name = "payload", columnDefinition = "text", updatable = false)
    private String payload;

    @Column(name = "detail", length = 2000, updatable = false)
    private String detail;

    @Column(name = "received_at", nullable = false, updatable = false)
    private Instant receivedAt;
}
