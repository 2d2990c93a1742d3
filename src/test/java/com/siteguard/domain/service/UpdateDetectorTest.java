package com.siteguard.domain.service;

import com.siteguard.domain.model.Module;
import com.siteguard.domain.model.ModuleVersion;
import com.siteguard.domain.version.BranchPolicy;
import com.siteguard.domain.version.VersionComparator;
import com.siteguard.support.CatalogFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static com.siteguard.support.CatalogFixtures.securityVersion;
import static com.siteguard.support.CatalogFixtures.version;
import static org.junit.jupiter.api.Assertions.*;

class UpdateDetectorTest {

    private final VersionComparator comparator = new VersionComparator();
    private final UpdateDetector detector = new UpdateDetector(comparator, BranchPolicy.SAME_BRANCH, true);
    private final Module webform = CatalogFixtures.module("webform");

    @Nested
    @DisplayName("assess")
    class Assess {

        @Test
        @DisplayName("newer security release flags both update and security update")
        void securityReleaseFlagsBoth() {
            ModuleVersion installed = version(webform, "6.2.0");
            ModuleVersion security = securityVersion(webform, "6.2.1");

            UpdateAssessment assessment = detector.assess(installed, List.of(installed, security));

            assertTrue(assessment.updateAvailable());
            assertTrue(assessment.securityUpdateAvailable());
            assertSame(security, assessment.latestVersion());
            assertSame(security, assessment.latestSecurityVersion());
        }

        @Test
        @DisplayName("a non-security release above a security release still counts as the security fix line")
        void securityBelowLatest() {
            ModuleVersion installed = version(webform, "6.2.0");
            ModuleVersion security = securityVersion(webform, "6.2.1");
            ModuleVersion latest = version(webform, "6.2.2");

            UpdateAssessment assessment = detector.assess(installed, List.of(latest, installed, security));

            assertTrue(assessment.securityUpdateAvailable());
            assertSame(latest, assessment.latestVersion());
            assertSame(security, assessment.latestSecurityVersion());
        }

        @Test
        @DisplayName("only non-security releases flag an update without security")
        void plainUpdate() {
            ModuleVersion installed = version(webform, "6.2.0");

            UpdateAssessment assessment = detector.assess(installed, List.of(installed, version(webform, "6.3.0")));

            assertTrue(assessment.updateAvailable());
            assertFalse(assessment.securityUpdateAvailable());
            assertNull(assessment.latestSecurityVersion());
        }

        @Test
        @DisplayName("security releases older than the installed version are ignored")
        void olderSecurityReleaseIgnored() {
            ModuleVersion installed = version(webform, "6.2.5");

            UpdateAssessment assessment = detector.assess(installed,
                List.of(securityVersion(webform, "6.2.1"), installed));

            assertEquals(UpdateAssessment.upToDate(), assessment);
        }

        @Test
        @DisplayName("releases of another branch are not offered")
        void otherBranchIgnored() {
            ModuleVersion installed = version(webform, "7.x-4.20");

            UpdateAssessment assessment = detector.assess(installed,
                List.of(installed, securityVersion(webform, "8.x-5.0")));

            assertFalse(assessment.updateAvailable());
        }

        @Test
        @DisplayName("deleted catalog versions are not offered")
        void deletedIgnored() {
            ModuleVersion installed = version(webform, "6.2.0");
            ModuleVersion deleted = securityVersion(webform, "6.2.1");
            markDeleted(deleted);

            assertFalse(detector.assess(installed, List.of(installed, deleted)).updateAvailable());
        }

        @Test
        @DisplayName("unparseable installed version has no updates")
        void unparseableInstalled() {
            ModuleVersion installed = version(webform, "custom-fork");

            assertEquals(UpdateAssessment.upToDate(),
                detector.assess(installed, List.of(installed, securityVersion(webform, "6.2.1"))));
        }

        @Test
        @DisplayName("the installed version alone is up to date")
        void onlyInstalled() {
            ModuleVersion installed = version(webform, "6.2.0");

            assertEquals(UpdateAssessment.upToDate(), detector.assess(installed, List.of(installed)));
        }
    }

    @Nested
    @DisplayName("pre-release handling")
    class PreReleases {

        private final UpdateDetector stableOnly = new UpdateDetector(comparator, BranchPolicy.SAME_BRANCH, false);

        @Test
        @DisplayName("pre-releases count as updates by default")
        void includedByDefault() {
            ModuleVersion installed = version(webform, "6.2.0");

            assertTrue(detector.assess(installed, List.of(installed, version(webform, "6.3.0-beta1"))).updateAvailable());
        }

        @Test
        @DisplayName("excluded pre-releases are not offered to stable installs")
        void excludedForStable() {
            ModuleVersion installed = version(webform, "6.2.0");

            assertFalse(stableOnly.assess(installed, List.of(installed, version(webform, "6.3.0-beta1"))).updateAvailable());
        }

        @Test
        @DisplayName("a pre-release install is still offered the next pre-release of its line")
        void offeredWithinLine() {
            ModuleVersion installed = version(webform, "6.3.0-beta1");
            ModuleVersion next = version(webform, "6.3.0-beta2");
            ModuleVersion otherLine = version(webform, "6.4.0-alpha1");

            UpdateAssessment assessment = stableOnly.assess(installed, List.of(installed, next, otherLine));

            assertTrue(assessment.updateAvailable());
            assertSame(next, assessment.latestVersion());
        }
    }

    @Nested
    @DisplayName("securityPatchApplied")
    class SecurityPatchApplied {

        @Test
        @DisplayName("moving across a security release counts")
        void crossingSecurityRelease() {
            ModuleVersion from = version(webform, "6.2.0");
            ModuleVersion security = securityVersion(webform, "6.2.1");
            ModuleVersion to = version(webform, "6.2.2");

            assertTrue(detector.securityPatchApplied(from, to, List.of(from, security, to)));
            assertTrue(detector.securityPatchApplied(from, security, List.of(from, security, to)));
        }

        @Test
        @DisplayName("moving below the security release does not count")
        void stoppingShort() {
            ModuleVersion from = version(webform, "6.2.0");
            ModuleVersion to = version(webform, "6.2.1");
            ModuleVersion security = securityVersion(webform, "6.2.2");

            assertFalse(detector.securityPatchApplied(from, to, List.of(from, to, security)));
        }

        @Test
        @DisplayName("downgrades never count")
        void downgrade() {
            ModuleVersion security = securityVersion(webform, "6.2.1");
            ModuleVersion older = version(webform, "6.2.0");

            assertFalse(detector.securityPatchApplied(security, older, List.of(security, older)));
        }
    }

    private static void markDeleted(ModuleVersion version) {
        ReflectionTestUtils.setField(version, "deleted", true);
    }
}
