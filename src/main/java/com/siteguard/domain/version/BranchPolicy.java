package com.siteguard.domain.version;

import java.util.Objects;

/**
 * Decides which catalog versions are eligible upgrade targets for an installed version.
 *
 * <p>Versions of different compatibility branches (for example {@code 7.x-2.1} and
 * {@code 8.x-2.1}) are never interchangeable under {@link #SAME_BRANCH}.
 */
public enum BranchPolicy {

    /** Candidate must carry the same branch qualifier (or none, if the current has none). */
    SAME_BRANCH,

    /** Same branch qualifier and same major version. */
    SAME_MAJOR,

    /** Any parseable version is a candidate. */
    ANY_BRANCH;

    public boolean permits(ParsedVersion current, ParsedVersion candidate) {
        switch (this) {
            case SAME_BRANCH:
                return Objects.equals(current.branch(), candidate.branch());
            case SAME_MAJOR:
                return Objects.equals(current.branch(), candidate.branch())
                    && current.major() == candidate.major();
            default:
                return true;
        }
    }
}
