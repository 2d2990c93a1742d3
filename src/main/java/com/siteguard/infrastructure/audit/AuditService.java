package com.siteguard.infrastructure.audit;

/**
 * Records inbound submissions in the audit log.
 *
 * <p>Entries are written in their own transaction, so a submission whose synchronization rolled
 * back is still recorded. Audit persistence failures are logged and never fail the submission.
 */
public interface AuditService {

    void record(AuditEntry entry);
}
