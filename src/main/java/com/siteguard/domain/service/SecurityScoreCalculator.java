package com.siteguard.domain.service;

import com.siteguard.domain.model.Site;
import com.siteguard.domain.model.SiteModule;

import java.util.Collection;
import java.util.Objects;

/**
 * Derives a site's counters and 0-100 security score from its current module rows.
 *
 * <p>{@code score = clamp(100 - securityPenalty * securityUpdates - updatePenalty * nonSecurityUpdates, 0, 100)}.
 * A module with a security update is counted once, under the security penalty only.
 */
public class SecurityScoreCalculator {

    private final ScoringPolicy policy;

    public SecurityScoreCalculator(ScoringPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public SecurityPosture evaluate(Collection<SiteModule> siteModules) {
        int securityUpdates = 0;
        int nonSecurityUpdates = 0;
        for (SiteModule siteModule : siteModules) {
            if (siteModule.isSecurityUpdateAvailable()) {
                securityUpdates++;
            } else if (siteModule.isUpdateAvailable()) {
                nonSecurityUpdates++;
            }
        }
        return new SecurityPosture(siteModules.size(), securityUpdates, nonSecurityUpdates,
            score(securityUpdates, nonSecurityUpdates));
    }

    public int score(int securityUpdates, int nonSecurityUpdates) {
        long penalty = (long) policy.securityPenalty() * securityUpdates
            + (long) policy.updatePenalty() * nonSecurityUpdates;
        long score = Site.MAX_SCORE - penalty;
        return (int) Math.max(0, Math.min(Site.MAX_SCORE, score));
    }

    public ScoringPolicy getPolicy() {
        return policy;
    }
}
