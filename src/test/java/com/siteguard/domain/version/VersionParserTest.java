package com.siteguard.domain.version;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class VersionParserTest {

    @Test
    @DisplayName("semantic version with all components")
    void parsesSemanticVersion() {
        ParsedVersion version = VersionParser.parse("2.1.3").orElseThrow();

        assertNull(version.branch());
        assertEquals(2, version.major());
        assertEquals(1, version.minor());
        assertEquals(3, version.patch());
        assertEquals(ReleaseType.STABLE, version.releaseType());
        assertFalse(version.isPreRelease());
    }

    @Test
    @DisplayName("missing components count as zero")
    void missingComponentsAreZero() {
        ParsedVersion version = VersionParser.parse("2").orElseThrow();

        assertEquals(2, version.major());
        assertEquals(0, version.minor());
        assertEquals(0, version.patch());
    }

    @Test
    @DisplayName("branch-qualified version keeps its branch")
    void parsesBranchQualifiedVersion() {
        ParsedVersion version = VersionParser.parse("8.x-1.0").orElseThrow();

        assertEquals("8.x", version.branch());
        assertEquals(1, version.major());
        assertEquals(0, version.minor());
        assertTrue(version.isBranchQualified());
        assertEquals("8.x-1.x", version.branchKey());
    }

    @Test
    @DisplayName("branch-qualified pre-release")
    void parsesBranchQualifiedPreRelease() {
        ParsedVersion version = VersionParser.parse("7.x-2.5-beta1").orElseThrow();

        assertEquals("7.x", version.branch());
        assertEquals(2, version.major());
        assertEquals(5, version.minor());
        assertEquals(ReleaseType.BETA, version.releaseType());
        assertEquals(1, version.releaseNumber());
    }

    @Test
    @DisplayName("dev line without a branch is read as a dev release")
    void parsesPlainDevLine() {
        ParsedVersion version = VersionParser.parse("1.x-dev").orElseThrow();

        assertNull(version.branch());
        assertEquals(1, version.major());
        assertEquals(ReleaseType.DEV, version.releaseType());
    }

    @Test
    @DisplayName("dev line inside a branch")
    void parsesBranchDevLine() {
        ParsedVersion version = VersionParser.parse("8.x-1.x-dev").orElseThrow();

        assertEquals("8.x", version.branch());
        assertEquals(1, version.major());
        assertEquals(ReleaseType.DEV, version.releaseType());
    }

    @Test
    @DisplayName("pre-release labels are case-insensitive and may be dotted")
    void parsesPreReleaseLabels() {
        assertEquals(ReleaseType.ALPHA, VersionParser.parse("2.1.0-alpha2").orElseThrow().releaseType());
        assertEquals(ReleaseType.BETA, VersionParser.parse("1.0.0-BETA1").orElseThrow().releaseType());

        ParsedVersion rc = VersionParser.parse("1.0.0-rc.3").orElseThrow();
        assertEquals(ReleaseType.RC, rc.releaseType());
        assertEquals(3, rc.releaseNumber());
    }

    @Test
    @DisplayName("unknown suffix labels are grouped as OTHER")
    void unknownLabelsAreOther() {
        ParsedVersion version = VersionParser.parse("1.0.0-preview4").orElseThrow();

        assertEquals(ReleaseType.OTHER, version.releaseType());
        assertEquals("preview", version.releaseLabel());
        assertEquals(4, version.releaseNumber());
        assertTrue(version.isPreRelease());
    }

    @Test
    @DisplayName("build metadata is accepted and ignored")
    void ignoresBuildMetadata() {
        ParsedVersion withBuild = VersionParser.parse("3.0.0-beta1+build5").orElseThrow();
        ParsedVersion withoutBuild = VersionParser.parse("3.0.0-beta1").orElseThrow();

        assertEquals(withoutBuild.sortKey(), withBuild.sortKey());
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "latest", "not-a-version", "1.x.3", "8.x-", "..", "1..2"})
    @DisplayName("garbage is reported as unparseable, never thrown")
    void unparseableInputs(String input) {
        assertEquals(Optional.empty(), VersionParser.parse(input));
    }

    @Test
    @DisplayName("sort keys of higher versions sort higher lexicographically")
    void sortKeysArePadded() {
        String older = VersionParser.parse("1.9.0").orElseThrow().sortKey();
        String newer = VersionParser.parse("1.10.0").orElseThrow().sortKey();

        assertTrue(newer.compareTo(older) > 0);
    }
}
