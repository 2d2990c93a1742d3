package com.siteguard.domain.version;

import java.util.Locale;

/**
 * Release channel of a version, ordered by precedence (lowest first).
 *
 * <p>Anything carrying a suffix is a pre-release and sorts below {@link #STABLE}.
 * Suffix labels that are not one of the well-known channels are grouped under
 * {@link #OTHER} and ordered among themselves by label.
 */
public enum ReleaseType {
    DEV,
    ALPHA,
    BETA,
    RC,
    OTHER,
    STABLE;

    public boolean isPreRelease() {
        return this != STABLE;
    }

    static ReleaseType fromLabel(String label) {
        if (label == null || label.isEmpty()) {
            return STABLE;
        }
        switch (label.toLowerCase(Locale.ROOT)) {
            case "dev":
            case "snapshot":
                return DEV;
            case "alpha":
            case "a":
                return ALPHA;
            case "beta":
            case "b":
                return BETA;
            case "rc":
                return RC;
            default:
                return OTHER;
        }
    }
}
