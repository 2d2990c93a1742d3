package com.siteguard.domain.version;

import com.siteguard.domain.model.Module;
import com.siteguard.domain.model.ModuleVersion;
import com.siteguard.support.CatalogFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class VersionComparatorTest {

    private final VersionComparator comparator = new VersionComparator();

    @Nested
    @DisplayName("precedence")
    class Precedence {

        @ParameterizedTest(name = "{0} < {1}")
        @CsvSource({
            "1.0.0, 1.0.1",
            "1.9.0, 1.10.0",
            "1.0.0-dev, 1.0.0-alpha1",
            "1.0.0-alpha1, 1.0.0-beta1",
            "1.0.0-beta2, 1.0.0-beta10",
            "1.0.0-beta2, 1.0.0-rc1",
            "1.0.0-rc1, 1.0.0-preview1",
            "1.0.0-rc1, 1.0.0",
            "8.x-1.0, 8.x-1.1",
            "8.x-1.x-dev, 8.x-1.0",
            "7.x-2.5, 8.x-1.0",
            "2.0.0, 7.x-1.0",
            "not-a-version, 0.0.1"
        })
        void ordersLowerBeforeHigher(String lower, String higher) {
            assertEquals(VersionOrdering.LESS, comparator.order(lower, higher));
            assertEquals(VersionOrdering.GREATER, comparator.order(higher, lower));
            assertTrue(comparator.compare(lower, higher) < 0);
            assertTrue(comparator.sortKey(lower).compareTo(comparator.sortKey(higher)) < 0);
        }

        @Test
        @DisplayName("missing components and build metadata compare equal in precedence")
        void equivalentSpellings() {
            assertEquals(VersionOrdering.EQUAL, comparator.order("1.0", "1.0.0"));
            assertEquals(VersionOrdering.EQUAL, comparator.order("1.0.0+build5", "1.0.0+build6"));
        }

        @Test
        @DisplayName("compare breaks precedence ties on the raw string")
        void compareIsTotal() {
            assertTrue(comparator.compare("1.0", "1.0.0") < 0);
            assertEquals(0, comparator.compare("1.0.0", "1.0.0"));
        }

        @Test
        @DisplayName("unparseable strings order among themselves lexicographically")
        void unparseableOrdering() {
            assertEquals(VersionOrdering.LESS, comparator.order("aaa", "bbb"));
            assertEquals(VersionOrdering.EQUAL, comparator.order("zzz", "zzz"));
        }

        @Test
        @DisplayName("sorting a shuffled list yields precedence order")
        void sortsList() {
            List<String> versions = new ArrayList<>(List.of("1.1.0", "1.0.0-beta1", "garbage", "1.0.0", "1.0.0-rc1"));
            versions.sort(comparator);

            assertEquals(List.of("garbage", "1.0.0-beta1", "1.0.0-rc1", "1.0.0", "1.1.0"), versions);
        }
    }

    @Nested
    @DisplayName("upgrades")
    class Upgrades {

        @Test
        @DisplayName("newer version on the same branch is an upgrade")
        void sameBranchUpgrade() {
            assertTrue(comparator.isUpgrade("8.x-1.0", "8.x-1.1", BranchPolicy.SAME_BRANCH));
            assertFalse(comparator.isUpgrade("8.x-1.1", "8.x-1.0", BranchPolicy.SAME_BRANCH));
            assertFalse(comparator.isUpgrade("8.x-1.1", "8.x-1.1", BranchPolicy.SAME_BRANCH));
        }

        @Test
        @DisplayName("versions of another branch are never upgrades under SAME_BRANCH")
        void crossBranchIsNotUpgrade() {
            assertFalse(comparator.isUpgrade("7.x-2.5", "8.x-1.0", BranchPolicy.SAME_BRANCH));
            assertFalse(comparator.isUpgrade("2.0.0", "8.x-1.0", BranchPolicy.SAME_BRANCH));
            assertTrue(comparator.isUpgrade("7.x-2.5", "8.x-1.0", BranchPolicy.ANY_BRANCH));
        }

        @Test
        @DisplayName("SAME_MAJOR additionally pins the major version")
        void sameMajor() {
            assertTrue(comparator.isUpgrade("1.2.0", "1.3.0", BranchPolicy.SAME_MAJOR));
            assertFalse(comparator.isUpgrade("1.2.0", "2.0.0", BranchPolicy.SAME_MAJOR));
            assertTrue(comparator.isUpgrade("1.2.0", "2.0.0", BranchPolicy.SAME_BRANCH));
        }

        @Test
        @DisplayName("unparseable versions neither have nor are upgrades")
        void unparseableNeverUpgrades() {
            assertFalse(comparator.isUpgrade("custom-build", "1.0.0", BranchPolicy.ANY_BRANCH));
            assertFalse(comparator.isUpgrade("1.0.0", "custom-build", BranchPolicy.ANY_BRANCH));
        }

        @Test
        @DisplayName("security successor relies on the catalog flag")
        void securitySuccessor() {
            Module module = CatalogFixtures.module("webform");
            ModuleVersion installed = CatalogFixtures.version(module, "6.2.0");
            ModuleVersion flagged = CatalogFixtures.securityVersion(module, "6.2.1");
            ModuleVersion plain = CatalogFixtures.version(module, "6.2.2");
            ModuleVersion older = CatalogFixtures.securityVersion(module, "6.1.9");

            assertTrue(comparator.isSecuritySuccessor(installed, flagged, BranchPolicy.SAME_BRANCH));
            assertFalse(comparator.isSecuritySuccessor(installed, plain, BranchPolicy.SAME_BRANCH));
            assertFalse(comparator.isSecuritySuccessor(installed, older, BranchPolicy.SAME_BRANCH));
        }
    }

    @Test
    @DisplayName("catalog order prefers the security release on a precedence tie")
    void catalogOrderTieBreak() {
        Module module = CatalogFixtures.module("token");
        ModuleVersion plain = CatalogFixtures.version(module, "1.0");
        ModuleVersion security = CatalogFixtures.securityVersion(module, "1.0.0");

        assertTrue(comparator.catalogOrder().compare(plain, security) < 0);
    }

    @Test
    @DisplayName("a custom parse function is consulted for every lookup")
    void usesInjectedParser() {
        AtomicInteger calls = new AtomicInteger();
        VersionComparator counting = new VersionComparator(version -> {
            calls.incrementAndGet();
            return VersionParser.parse(version);
        });

        counting.order("1.0.0", "1.0.1");

        assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("branch key groups releases of a line")
    void branchKeys() {
        assertEquals("8.x-2.x", comparator.branchKey("8.x-2.3").orElseThrow());
        assertEquals("1.x", comparator.branchKey("1.4.2").orElseThrow());
        assertTrue(comparator.branchKey("nightly").isEmpty());
    }
}
