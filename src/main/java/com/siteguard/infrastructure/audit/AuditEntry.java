package com.siteguard.infrastructure.audit;

import com.siteguard.infrastructure.security.SecurityContext;

import java.util.UUID;

/**
 * What to audit about one submission.
 *
 * @param submissionType  {@code MANIFEST} or {@code CATALOG_RELEASES}
 * @param modulesReported number of entries in the payload, null if it could not be parsed
 * @param payload         raw request body as received
 * @param detail          outcome summary or error message, never a stack trace
 */
public record AuditEntry(
    SecurityContext context,
    UUID siteId,
    String submissionType,
    AuditStatus status,
    Integer modulesReported,
    String payload,
    String detail
) {
}
