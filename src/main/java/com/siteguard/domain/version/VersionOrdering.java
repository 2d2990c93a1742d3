package com.siteguard.domain.version;

/**
 * Outcome of comparing two versions by precedence.
 */
public enum VersionOrdering {
    LESS,
    EQUAL,
    GREATER;

    public static VersionOrdering of(int comparison) {
        if (comparison < 0) {
            return LESS;
        }
        return comparison == 0 ? EQUAL : GREATER;
    }

    public VersionOrdering reverse() {
        switch (this) {
            case LESS:
                return GREATER;
            case GREATER:
                return LESS;
            default:
                return EQUAL;
        }
    }
}
