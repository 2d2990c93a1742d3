package com.siteguard.domain.version;

/**
 * Structured form of a module version string.
 *
 * @param raw           version string as reported, trimmed
 * @param branch        compatibility branch qualifier such as {@code 8.x}, or {@code null}
 * @param major         major component
 * @param minor         minor component, 0 when missing or wildcard
 * @param patch         patch component, 0 when missing or wildcard
 * @param releaseType   release channel derived from the suffix
 * @param releaseLabel  lower-cased suffix label, empty for stable releases
 * @param releaseNumber numeric part of the suffix ({@code beta2} has 2), 0 when absent
 */
public record ParsedVersion(
    String raw,
    String branch,
    int major,
    int minor,
    int patch,
    ReleaseType releaseType,
    String releaseLabel,
    int releaseNumber
) {

    private static final int KEY_WIDTH = 10;

    public boolean isPreRelease() {
        return releaseType.isPreRelease();
    }

    public boolean isBranchQualified() {
        return branch != null;
    }

    public boolean sameNumericLine(ParsedVersion other) {
        return major == other.major && minor == other.minor && patch == other.patch;
    }

    /**
     * Branch key used to group releases, e.g. {@code 8.x-1.x} or {@code 2.x}.
     */
    public String branchKey() {
        return branch != null ? branch + "-" + major + ".x" : major + ".x";
    }

    /**
     * Derived key whose lexicographic order matches precedence order.
     * Build metadata does not participate.
     */
    public String sortKey() {
        StringBuilder key = new StringBuilder("1:");
        if (branch == null) {
            key.append('0');
        } else {
            key.append('1').append(pad(Integer.parseInt(branch.substring(0, branch.indexOf('.')))));
        }
        key.append(':')
            .append(pad(major)).append('.')
            .append(pad(minor)).append('.')
            .append(pad(patch)).append(':')
            .append(releaseType.ordinal()).append(':');
        if (releaseType == ReleaseType.OTHER) {
            key.append(releaseLabel);
        }
        // space sorts below every label character
        key.append(' ').append(pad(releaseNumber));
        return key.toString();
    }

    private static String pad(int value) {
        String digits = Integer.toString(value);
        return "0".repeat(Math.max(0, KEY_WIDTH - digits.length())) + digits;
    }
}
