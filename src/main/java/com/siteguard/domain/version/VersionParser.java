package com.siteguard.domain.version;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses module version strings without ever throwing.
 *
 * <p>Recognised shapes:
 * <ul>
 *   <li>semantic: {@code 1.0.0}, {@code 2.1.0-alpha2}, {@code 3.0.0-beta1+build5}, {@code 1.0}, {@code 2}</li>
 *   <li>semantic dev lines: {@code 1.x-dev}, {@code 2.0.x-dev}</li>
 *   <li>branch-qualified: {@code 8.x-1.0}, {@code 7.x-2.5-beta1}, {@code 8.x-1.x-dev}</li>
 * </ul>
 * Anything else is reported as unparseable via an empty result.
 */
public final class VersionParser {

    private static final Pattern BRANCH_QUALIFIED = Pattern.compile(
        "^(\\d{1,9})\\.x-(.+)$", Pattern.CASE_INSENSITIVE);

    private static final Pattern NUMERIC = Pattern.compile(
        "^v?(\\d{1,9})(?:\\.(\\d{1,9}|x))?(?:\\.(\\d{1,9}|x))?"
            + "(?:-([0-9a-z][0-9a-z.-]*)|([a-z][0-9a-z.-]*))?"
            + "(?:\\+([0-9a-z.-]+))?$",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern LABEL = Pattern.compile("^([a-z]*)[.-]?(\\d{1,9})?$");

    private static final String WILDCARD = "x";

    private VersionParser() {
    }

    public static Optional<ParsedVersion> parse(String version) {
        if (version == null) {
            return Optional.empty();
        }
        String trimmed = version.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }

        Matcher branchMatcher = BRANCH_QUALIFIED.matcher(trimmed);
        if (branchMatcher.matches()) {
            String branch = branchMatcher.group(1) + ".x";
            Optional<ParsedVersion> qualified = parseNumeric(trimmed, branch, branchMatcher.group(2));
            if (qualified.isPresent()) {
                return qualified;
            }
        }
        // "1.x-dev" also matches the branch shape; fall back to reading it as a plain dev line
        return parseNumeric(trimmed, null, trimmed);
    }

    private static Optional<ParsedVersion> parseNumeric(String raw, String branch, String body) {
        Matcher matcher = NUMERIC.matcher(body);
        if (!matcher.matches()) {
            return Optional.empty();
        }

        String minorPart = matcher.group(2);
        String patchPart = matcher.group(3);
        boolean wildcard = WILDCARD.equalsIgnoreCase(minorPart) || WILDCARD.equalsIgnoreCase(patchPart);
        if (WILDCARD.equalsIgnoreCase(minorPart) && patchPart != null) {
            // "1.x.3" is not a meaningful version
            return Optional.empty();
        }

        int major = Integer.parseInt(matcher.group(1));
        int minor = numericOrZero(minorPart);
        int patch = numericOrZero(patchPart);

        String suffix = matcher.group(4) != null ? matcher.group(4) : matcher.group(5);
        ReleaseType releaseType = ReleaseType.STABLE;
        String label = "";
        int releaseNumber = 0;

        if (suffix != null) {
            String lowered = suffix.toLowerCase(Locale.ROOT);
            Matcher labelMatcher = LABEL.matcher(lowered);
            if (labelMatcher.matches() && !labelMatcher.group(1).isEmpty()) {
                label = labelMatcher.group(1);
                releaseType = ReleaseType.fromLabel(label);
                releaseNumber = labelMatcher.group(2) != null ? Integer.parseInt(labelMatcher.group(2)) : 0;
            } else {
                label = lowered;
                releaseType = ReleaseType.OTHER;
            }
        } else if (wildcard) {
            label = "dev";
            releaseType = ReleaseType.DEV;
        }

        return Optional.of(new ParsedVersion(
            raw,
            branch,
            major,
            minor,
            patch,
            releaseType,
            label,
            releaseNumber
        ));
    }

    private static int numericOrZero(String part) {
        if (part == null || WILDCARD.equalsIgnoreCase(part)) {
            return 0;
        }
        return Integer.parseInt(part);
    }
}
