package com.siteguard.domain.service;

import com.siteguard.domain.model.ModuleVersion;
import com.siteguard.domain.version.BranchPolicy;
import com.siteguard.domain.version.ParsedVersion;
import com.siteguard.domain.version.VersionComparator;
import com.siteguard.domain.version.VersionOrdering;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Computes update flags for an installed version from the versions known for its module.
 *
 * <p>An eligible candidate is a non-deleted catalog version that is strictly greater than the
 * current one and permitted by the {@link BranchPolicy}. When pre-releases are excluded, a
 * pre-release candidate only qualifies if the current version is itself a pre-release of the
 * same numeric line (a site on {@code 2.0.0-beta1} is offered {@code 2.0.0-beta2}).
 *
 * <p>{@code securityUpdateAvailable} implies {@code updateAvailable}. Pure and thread-safe.
 */
public class UpdateDetector {

    private final VersionComparator comparator;
    private final BranchPolicy branchPolicy;
    private final boolean includePrereleases;

    public UpdateDetector(VersionComparator comparator, BranchPolicy branchPolicy, boolean includePrereleases) {
        this.comparator = Objects.requireNonNull(comparator, "comparator");
        this.branchPolicy = Objects.requireNonNull(branchPolicy, "branchPolicy");
        this.includePrereleases = includePrereleases;
    }

    public UpdateAssessment assess(ModuleVersion current, Collection<ModuleVersion> knownVersions) {
        Optional<ParsedVersion> parsedCurrent = comparator.parse(current.getVersionString());
        if (parsedCurrent.isEmpty()) {
            return UpdateAssessment.upToDate();
        }

        List<ModuleVersion> candidates = knownVersions.stream()
            .filter(candidate -> !candidate.isDeleted())
            .filter(candidate -> comparator.isUpgrade(current.getVersionString(), candidate.getVersionString(), branchPolicy))
            .filter(candidate -> prereleaseEligible(parsedCurrent.get(), candidate))
            .collect(Collectors.toList());

        if (candidates.isEmpty()) {
            return UpdateAssessment.upToDate();
        }

        Comparator<ModuleVersion> order = comparator.catalogOrder();
        ModuleVersion latest = candidates.stream().max(order).orElseThrow();
        ModuleVersion latestSecurity = candidates.stream()
            .filter(ModuleVersion::isSecurityUpdate)
            .max(order)
            .orElse(null);

        return new UpdateAssessment(true, latestSecurity != null, latest, latestSecurity);
    }

    /**
     * Whether moving from {@code from} to {@code to} crossed a security release, i.e. some
     * eligible security version lies in {@code (from, to]}. Moves to an older or equal version
     * never count.
     */
    public boolean securityPatchApplied(ModuleVersion from, ModuleVersion to, Collection<ModuleVersion> knownVersions) {
        if (!comparator.isUpgrade(from.getVersionString(), to.getVersionString(), branchPolicy)) {
            return false;
        }
        return knownVersions.stream()
            .filter(candidate -> comparator.isSecuritySuccessor(from, candidate, branchPolicy))
            .anyMatch(candidate -> comparator.order(candidate.getVersionString(), to.getVersionString())
                != VersionOrdering.GREATER);
    }

    public BranchPolicy getBranchPolicy() {
        return branchPolicy;
    }

    private boolean prereleaseEligible(ParsedVersion current, ModuleVersion candidate) {
        if (includePrereleases) {
            return true;
        }
        Optional<ParsedVersion> parsedCandidate = comparator.parse(candidate.getVersionString());
        if (parsedCandidate.isEmpty() || !parsedCandidate.get().isPreRelease()) {
            return true;
        }
        return current.isPreRelease()
            && Objects.equals(current.branch(), parsedCandidate.get().branch())
            && current.sameNumericLine(parsedCandidate.get());
    }
}
