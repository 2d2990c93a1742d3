package com.siteguard.application;

import java.time.LocalDate;

/**
 * What a submitter says about a version, and how far the catalog may trust it.
 *
 * @param releaseDate     release date, null when unknown
 * @param securityUpdate  whether the version is a security release
 * @param promoteExisting whether an already catalogued version may be promoted to a security
 *                        release and have its release date filled in
 */
public record VersionMetadata(LocalDate releaseDate, boolean securityUpdate, boolean promoteExisting) {

    private static final VersionMetadata REPORTED = new VersionMetadata(null, false, false);

    /**
     * A bare site report: never marks anything as a security release.
     */
    public static VersionMetadata reported() {
        return REPORTED;
    }

    /**
     * A trusted manifest assertion: applies only when the version is first catalogued.
     */
    public static VersionMetadata asserted(boolean securityUpdate) {
        return new VersionMetadata(null, securityUpdate, false);
    }

    /**
     * An authoritative catalog publication.
     */
    public static VersionMetadata published(LocalDate releaseDate, boolean securityUpdate) {
        return new VersionMetadata(releaseDate, securityUpdate, true);
    }
}
