package com.siteguard.infrastructure.audit;

/**
 * Processing outcome of one inbound submission.
 */
public enum AuditStatus {
    SUCCESS,
    VALIDATION_ERROR,
    /** Authorization failure or unknown site. */
    REJECTED,
    /** Transient storage failure, conflict or unexpected error. */
    FAILED
}
