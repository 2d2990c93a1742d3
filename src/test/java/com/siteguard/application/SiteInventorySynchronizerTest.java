package com.siteguard.application;

import com.siteguard.application.exceptions.FieldViolation;
import com.siteguard.application.exceptions.ManifestValidationException;
import com.siteguard.config.SiteGuardProperties;
import com.siteguard.domain.model.ModuleCategory;
import com.siteguard.domain.model.ModuleMetadata;
import com.siteguard.domain.model.Site;
import com.siteguard.domain.model.SiteModule;
import com.siteguard.domain.service.UpdateDetector;
import com.siteguard.domain.version.BranchPolicy;
import com.siteguard.domain.version.VersionComparator;
import com.siteguard.support.CatalogFixtures;
import com.siteguard.support.InMemoryModuleCatalog;
import com.siteguard.support.InMemorySiteModuleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SiteInventorySynchronizerTest {

    private final Clock clock = Clock.fixed(CatalogFixtures.NOW, ZoneOffset.UTC);

    private InMemoryModuleCatalog catalog;
    private InMemorySiteModuleRepository siteModules;
    private CatalogReconciler reconciler;
    private SiteInventorySynchronizer synchronizer;
    private Site site;

    @BeforeEach
    void setUp() {
        VersionComparator comparator = new VersionComparator();
        catalog = new InMemoryModuleCatalog();
        siteModules = new InMemorySiteModuleRepository();
        reconciler = new CatalogReconciler(catalog, comparator, clock, new SiteGuardProperties());
        synchronizer = new SiteInventorySynchronizer(reconciler, catalog, siteModules,
            new UpdateDetector(comparator, BranchPolicy.SAME_BRANCH, true), clock);
        site = CatalogFixtures.site();

        publish("webform", "6.2.0", false);
        publish("webform", "6.2.1", true);
    }

    @Nested
    @DisplayName("security update lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("first manifest installs every module and flags the security update")
        void firstManifest() {
            SyncResult result = synchronizer.synchronize(site,
                List.of(report("webform", "6.2.0"), report("pathauto", "1.12")), false);

            assertEquals(new SyncResult(true, 2, 2, 0, 0, 0), result);
            SiteModule webform = row("webform");
            assertTrue(webform.isUpdateAvailable());
            assertTrue(webform.isSecurityUpdateAvailable());
            assertEquals("6.2.1", webform.getLatestVersion().getVersionString());
            assertFalse(row("pathauto").isUpdateAvailable());
        }

        @Test
        @DisplayName("upgrading across the security release counts a security patch")
        void upgradeAppliesSecurityPatch() {
            synchronizer.synchronize(site, List.of(report("webform", "6.2.0"), report("pathauto", "1.12")), false);

            SyncResult result = synchronizer.synchronize(site,
                List.of(report("webform", "6.2.1"), report("pathauto", "1.12")), false);

            assertEquals(new SyncResult(true, 2, 0, 0, 1, 1), result);
            SiteModule webform = row("webform");
            assertFalse(webform.isUpdateAvailable());
            assertFalse(webform.isSecurityUpdateAvailable());
            assertNull(webform.getLatestVersion());
        }

        @Test
        @DisplayName("resubmitting the same manifest changes nothing")
        void idempotent() {
            List<ModuleReport> manifest = List.of(report("webform", "6.2.0"), report("pathauto", "1.12"));
            synchronizer.synchronize(site, manifest, false);
            siteModules.resetCounters();

            SyncResult result = synchronizer.synchronize(site, manifest, false);

            assertEquals(new SyncResult(false, 2, 0, 0, 0, 0), result);
            assertEquals(0, siteModules.saves());
            assertEquals(0, siteModules.deletes());
        }

        @Test
        @DisplayName("a plain upgrade is counted without a security patch")
        void plainUpgrade() {
            synchronizer.synchronize(site, List.of(report("pathauto", "1.11")), false);

            SyncResult result = synchronizer.synchronize(site, List.of(report("pathauto", "1.12")), false);

            assertEquals(1, result.modulesUpdated());
            assertEquals(0, result.securityPatchesApplied());
        }

        @Test
        @DisplayName("toggling the enabled state is a change but not an update")
        void enabledToggle() {
            synchronizer.synchronize(site, List.of(report("pathauto", "1.12")), false);

            SyncResult result = synchronizer.synchronize(site,
                List.of(new ModuleReport("pathauto", null, null, Boolean.FALSE, "1.12", null, null)), false);

            assertTrue(result.changed());
            assertEquals(0, result.modulesUpdated());
            assertFalse(row("pathauto").isEnabled());
        }
    }

    @Nested
    @DisplayName("removal")
    class Removal {

        @Test
        @DisplayName("modules missing from the manifest are uninstalled, catalog rows stay")
        void missingModulesRemoved() {
            synchronizer.synchronize(site, List.of(report("webform", "6.2.0"), report("pathauto", "1.12")), false);

            SyncResult result = synchronizer.synchronize(site, List.of(report("webform", "6.2.0")), false);

            assertEquals(1, result.modulesRemoved());
            assertTrue(result.changed());
            assertEquals(List.of("webform"), installedNames());
            assertTrue(catalog.findModule("pathauto").isPresent());
        }

        @Test
        @DisplayName("an empty manifest uninstalls everything")
        void emptyManifest() {
            synchronizer.synchronize(site, List.of(report("webform", "6.2.0"), report("pathauto", "1.12")), false);

            SyncResult result = synchronizer.synchronize(site, List.of(), false);

            assertEquals(new SyncResult(true, 0, 0, 2, 0, 0), result);
            assertTrue(siteModules.findBySite(site).isEmpty());
        }

        @Test
        @DisplayName("an empty manifest for an empty site is not a change")
        void emptyOnEmpty() {
            assertFalse(synchronizer.synchronize(site, List.of(), false).changed());
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("one invalid report rejects the whole manifest before any write")
        void atomicRejection() {
            int modulesBefore = catalog.moduleCount();
            List<ModuleReport> manifest = List.of(
                report("token", "1.13"),
                new ModuleReport("bad name", null, null, Boolean.TRUE, "", null, null));

            ManifestValidationException e = assertThrows(ManifestValidationException.class,
                () -> synchronizer.synchronize(site, manifest, false));

            List<String> fields = e.getViolations().stream().map(FieldViolation::field).collect(Collectors.toList());
            assertEquals(List.of("modules[1].machineName", "modules[1].version"), fields);
            assertEquals(modulesBefore, catalog.moduleCount());
            assertEquals(0, siteModules.saves());
        }

        @Test
        @DisplayName("duplicate machine names are rejected")
        void duplicates() {
            ManifestValidationException e = assertThrows(ManifestValidationException.class,
                () -> synchronizer.synchronize(site, List.of(report("token", "1.13"), report("token", "1.14")), false));

            FieldViolation violation = e.getViolations().get(0);
            assertEquals("modules[1].machineName", violation.field());
            assertEquals("duplicates modules[0]", violation.message());
        }

        @Test
        @DisplayName("null list and null entries are rejected")
        void nulls() {
            assertThrows(ManifestValidationException.class, () -> synchronizer.synchronize(site, null, false));

            List<ModuleReport> withNull = new ArrayList<>(Arrays.asList(report("token", "1.13"), null));
            ManifestValidationException e = assertThrows(ManifestValidationException.class,
                () -> synchronizer.synchronize(site, withNull, false));
            assertEquals("modules[1]", e.getViolations().get(0).field());
        }

        @Test
        @DisplayName("missing enabled flag is rejected")
        void missingEnabled() {
            ManifestValidationException e = assertThrows(ManifestValidationException.class,
                () -> synchronizer.synchronize(site,
                    List.of(new ModuleReport("token", null, null, null, "1.13", null, null)), false));

            assertEquals("modules[0].enabled", e.getViolations().get(0).field());
        }
    }

    @Nested
    @DisplayName("security assertions")
    class SecurityAssertions {

        @Test
        @DisplayName("assertions from untrusted submitters are ignored")
        void untrustedIgnored() {
            synchronizer.synchronize(site, List.of(asserting("ctools", "4.0.1")), false);

            assertFalse(catalog.findVersion(catalog.findModule("ctools").orElseThrow(), "4.0.1")
                .orElseThrow().isSecurityUpdate());
        }

        @Test
        @DisplayName("assertions from trusted submitters flag new versions")
        void trustedApplied() {
            synchronizer.synchronize(site, List.of(asserting("ctools", "4.0.1")), true);

            assertTrue(catalog.findVersion(catalog.findModule("ctools").orElseThrow(), "4.0.1")
                .orElseThrow().isSecurityUpdate());
        }
    }

    private void publish(String machineName, String version, boolean security) {
        reconciler.reconcile(machineName, new ModuleMetadata(null, ModuleCategory.CONTRIB, null), version,
            VersionMetadata.published(null, security));
    }

    private static ModuleReport report(String machineName, String version) {
        return new ModuleReport(machineName, null, ModuleCategory.CONTRIB, Boolean.TRUE, version, null, null);
    }

    private static ModuleReport asserting(String machineName, String version) {
        return new ModuleReport(machineName, null, ModuleCategory.CONTRIB, Boolean.TRUE, version, Boolean.TRUE, null);
    }

    private SiteModule row(String machineName) {
        return siteModules.findBySite(site).stream()
            .filter(row -> row.getModule().getMachineName().equals(machineName))
            .findFirst()
            .orElseThrow();
    }

    private List<String> installedNames() {
        return siteModules.findBySite(site).stream()
            .map(row -> row.getModule().getMachineName())
            .sorted()
            .collect(Collectors.toList());
    }
}
