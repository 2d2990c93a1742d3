package com.siteguard.domain.service;

/**
 * Penalties subtracted from the perfect score of 100.
 *
 * @param securityPenalty points per module with a security update available
 * @param updatePenalty   points per module with only a non-security update available
 */
public record ScoringPolicy(int securityPenalty, int updatePenalty) {

    public static final ScoringPolicy DEFAULT = new ScoringPolicy(10, 2);

    public ScoringPolicy {
        if (securityPenalty < 0 || updatePenalty < 0) {
            throw new IllegalArgumentException("Penalties must not be negative");
        }
        // both zero disables scoring; otherwise a security update must weigh strictly more
        if (securityPenalty > 0 ? updatePenalty >= securityPenalty : updatePenalty > 0) {
            throw new IllegalArgumentException("Update penalty must be smaller than the security penalty");
        }
    }
}
