package com.siteguard.domain.version;

import com.siteguard.domain.model.ModuleVersion;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Orders module version strings.
 *
 * <p>Precedence rules:
 * <ol>
 *   <li>Unparseable strings sort below every parseable version and among themselves lexicographically.</li>
 *   <li>Unqualified versions sort below branch-qualified ones; branches order by their numeric prefix.</li>
 *   <li>Within a branch: major, minor, patch numerically, missing components count as 0.</li>
 *   <li>Pre-releases sort below the same numeric version without suffix
 *       (dev &lt; alpha &lt; beta &lt; rc &lt; other labels &lt; stable), then by release number.</li>
 * </ol>
 * Build metadata ({@code +...}) never affects precedence.
 *
 * <p>{@link #order(String, String)} may report {@code EQUAL} for distinct strings such as
 * {@code 1.0} and {@code 1.0.0}; {@link #compare(String, String)} breaks such ties on the raw
 * string so it is a total order suitable for sorting.
 *
 * <p>Stateless apart from the parse function, and safe for concurrent use.
 */
public class VersionComparator implements Comparator<String> {

    private static final String UNPARSEABLE_KEY_PREFIX = "0:";

    private final Function<String, Optional<ParsedVersion>> parser;

    public VersionComparator() {
        this(VersionParser::parse);
    }

    /**
     * @param parser parse function, typically {@link VersionParser#parse} behind a cache
     */
    public VersionComparator(Function<String, Optional<ParsedVersion>> parser) {
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    public Optional<ParsedVersion> parse(String version) {
        if (version == null) {
            return Optional.empty();
        }
        return parser.apply(version);
    }

    /**
     * Precedence ordering of {@code left} relative to {@code right}.
     */
    public VersionOrdering order(String left, String right) {
        Optional<ParsedVersion> parsedLeft = parse(left);
        Optional<ParsedVersion> parsedRight = parse(right);

        if (parsedLeft.isEmpty() && parsedRight.isEmpty()) {
            return VersionOrdering.of(nullSafe(left).compareTo(nullSafe(right)));
        }
        if (parsedLeft.isEmpty()) {
            return VersionOrdering.LESS;
        }
        if (parsedRight.isEmpty()) {
            return VersionOrdering.GREATER;
        }
        return VersionOrdering.of(comparePrecedence(parsedLeft.get(), parsedRight.get()));
    }

    @Override
    public int compare(String left, String right) {
        int precedence = order(left, right).ordinal() - VersionOrdering.EQUAL.ordinal();
        if (precedence != 0) {
            return precedence;
        }
        return nullSafe(left).compareTo(nullSafe(right));
    }

    public boolean sameBranch(String left, String right) {
        Optional<ParsedVersion> parsedLeft = parse(left);
        Optional<ParsedVersion> parsedRight = parse(right);
        return parsedLeft.isPresent() && parsedRight.isPresent()
            && Objects.equals(parsedLeft.get().branch(), parsedRight.get().branch());
    }

    /**
     * Whether {@code candidate} is strictly newer than {@code current} and an eligible
     * upgrade target under {@code policy}. Unparseable versions are never upgrades and
     * never have upgrades.
     */
    public boolean isUpgrade(String current, String candidate, BranchPolicy policy) {
        Optional<ParsedVersion> parsedCurrent = parse(current);
        Optional<ParsedVersion> parsedCandidate = parse(candidate);
        if (parsedCurrent.isEmpty() || parsedCandidate.isEmpty()) {
            return false;
        }
        return policy.permits(parsedCurrent.get(), parsedCandidate.get())
            && comparePrecedence(parsedCandidate.get(), parsedCurrent.get()) > 0;
    }

    /**
     * Whether {@code candidate} is a security-relevant successor of {@code baseline}.
     * Security relevance comes from the catalog flag, never from the version string.
     */
    public boolean isSecuritySuccessor(ModuleVersion baseline, ModuleVersion candidate, BranchPolicy policy) {
        return candidate.isSecurityUpdate()
            && !candidate.isDeleted()
            && isUpgrade(baseline.getVersionString(), candidate.getVersionString(), policy);
    }

    /**
     * Catalog ordering: precedence first, then a security release above a non-security
     * release of equal precedence, then the raw string.
     */
    public Comparator<ModuleVersion> catalogOrder() {
        return (left, right) -> {
            VersionOrdering ordering = order(left.getVersionString(), right.getVersionString());
            if (ordering != VersionOrdering.EQUAL) {
                return ordering == VersionOrdering.LESS ? -1 : 1;
            }
            int security = Boolean.compare(left.isSecurityUpdate(), right.isSecurityUpdate());
            if (security != 0) {
                return security;
            }
            return left.getVersionString().compareTo(right.getVersionString());
        };
    }

    public String sortKey(String version) {
        return parse(version)
            .map(ParsedVersion::sortKey)
            .orElseGet(() -> UNPARSEABLE_KEY_PREFIX + nullSafe(version).trim());
    }

    public Optional<String> branchKey(String version) {
        return parse(version).map(ParsedVersion::branchKey);
    }

    static int comparePrecedence(ParsedVersion left, ParsedVersion right) {
        int result = compareBranches(left.branch(), right.branch());
        if (result != 0) {
            return result;
        }
        result = Integer.compare(left.major(), right.major());
        if (result != 0) {
            return result;
        }
        result = Integer.compare(left.minor(), right.minor());
        if (result != 0) {
            return result;
        }
        result = Integer.compare(left.patch(), right.patch());
        if (result != 0) {
            return result;
        }
        result = left.releaseType().compareTo(right.releaseType());
        if (result != 0) {
            return result;
        }
        if (left.releaseType() == ReleaseType.OTHER) {
            result = left.releaseLabel().compareTo(right.releaseLabel());
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(left.releaseNumber(), right.releaseNumber());
    }

    private static int compareBranches(String left, String right) {
        if (Objects.equals(left, right)) {
            return 0;
        }
        if (left == null) {
            return -1;
        }
        if (right == null) {
            return 1;
        }
        return Integer.compare(branchNumber(left), branchNumber(right));
    }

    private static int branchNumber(String branch) {
        return Integer.parseInt(branch.substring(0, branch.indexOf('.')));
    }

    private static String nullSafe(String value) {
        return value == null ? "" : value;
    }
}
