package com.siteguard.application;

import com.siteguard.application.exceptions.FieldViolation;
import com.siteguard.application.exceptions.ManifestValidationException;
import com.siteguard.domain.model.ModuleVersion;
import com.siteguard.domain.model.Site;
import com.siteguard.domain.model.SiteModule;
import com.siteguard.domain.repository.ModuleCatalogRepository;
import com.siteguard.domain.repository.SiteModuleRepository;
import com.siteguard.domain.service.UpdateDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Applies a site's full manifest to its inventory.
 *
 * <p>The manifest replaces the inventory: reported modules are installed or moved to the
 * reported version, modules missing from the manifest are uninstalled (catalog rows stay),
 * and update flags of every reported module are recomputed against the catalog.
 *
 * <p>Must run inside the caller's per-site transaction and lock. The whole manifest is
 * validated before anything is written, so an invalid report never leaves a partially
 * applied inventory behind.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SiteInventorySynchronizer {

    private final CatalogReconciler catalogReconciler;
    private final ModuleCatalogRepository catalog;
    private final SiteModuleRepository siteModules;
    private final UpdateDetector updateDetector;
    private final Clock clock;

    /**
     * @param site                     locked site
     * @param manifest                 complete list of installed modules, possibly empty
     * @param acceptSecurityAssertions whether {@link ModuleReport#securityUpdate()} may flag newly
     *                                 catalogued versions
     * @throws ManifestValidationException if any report is structurally invalid
     */
    public SyncResult synchronize(Site site, List<ModuleReport> manifest, boolean acceptSecurityAssertions) {
        validate(manifest);

        Instant now = clock.instant();
        List<SiteModule> prior = siteModules.findBySite(site);

        Map<UUID, SiteModule> rowsByModule = new HashMap<>();
        Map<UUID, SiteModule.Snapshot> before = new HashMap<>();
        Map<UUID, ModuleVersion> previousVersions = new HashMap<>();
        for (SiteModule row : prior) {
            UUID moduleId = row.getModule().getId();
            rowsByModule.put(moduleId, row);
            before.put(moduleId, row.snapshot());
            previousVersions.put(moduleId, row.getCurrentVersion());
        }

        int added = 0;
        Set<UUID> reported = new HashSet<>();
        List<SiteModule> current = new ArrayList<>(manifest.size());

        // fixed order, so concurrent first sightings wait on each other's catalog rows without deadlocking
        List<ModuleReport> ordered = new ArrayList<>(manifest);
        ordered.sort(Comparator.comparing(ModuleReport::machineName));

        for (ModuleReport report : ordered) {
            VersionMetadata versionMetadata = acceptSecurityAssertions
                ? VersionMetadata.asserted(report.assertsSecurityUpdate())
                : VersionMetadata.reported();

            CatalogEntry entry = catalogReconciler.reconcile(
                report.machineName(), report.metadata(), report.version(), versionMetadata);

            UUID moduleId = entry.module().getId();
            reported.add(moduleId);

            SiteModule row = rowsByModule.get(moduleId);
            if (row == null) {
                row = SiteModule.install(site, entry.module(), entry.version(), report.isEnabled(), now);
                siteModules.save(row);
                rowsByModule.put(moduleId, row);
                added++;
            } else if (row.moveTo(entry.version(), report.isEnabled(), now)) {
                siteModules.save(row);
            }
            current.add(row);
        }

        int removed = 0;
        for (SiteModule row : prior) {
            if (!reported.contains(row.getModule().getId())) {
                siteModules.delete(row);
                removed++;
            }
        }

        int updated = 0;
        int securityPatches = 0;
        boolean changed = added > 0 || removed > 0;

        for (SiteModule row : current) {
            UUID moduleId = row.getModule().getId();
            List<ModuleVersion> knownVersions = catalog.findVersions(row.getModule());

            if (row.applyAssessment(updateDetector.assess(row.getCurrentVersion(), knownVersions), now)) {
                siteModules.save(row);
            }

            SiteModule.Snapshot previous = before.get(moduleId);
            if (previous == null) {
                continue;
            }
            if (!previous.versionId().equals(row.getCurrentVersion().getId())) {
                updated++;
                if (updateDetector.securityPatchApplied(previousVersions.get(moduleId), row.getCurrentVersion(), knownVersions)) {
                    securityPatches++;
                }
            }
            if (!previous.equals(row.snapshot())) {
                changed = true;
            }
        }

        SyncResult result = new SyncResult(changed, manifest.size(), added, removed, updated, securityPatches);
        log.debug("Synchronized inventory: siteId={}, result={}", site.getId(), result);
        return result;
    }

    private void validate(List<ModuleReport> manifest) {
        if (manifest == null) {
            throw new ManifestValidationException("Manifest must contain a module list",
                List.of(new FieldViolation("modules", "must not be null", null)));
        }

        List<FieldViolation> violations = new ArrayList<>();
        Map<String, Integer> firstOccurrence = new HashMap<>();

        for (int i = 0; i < manifest.size(); i++) {
            ModuleReport report = manifest.get(i);
            if (report == null) {
                violations.add(new FieldViolation("modules[" + i + "]", "must not be null", null));
                continue;
            }
            violations.addAll(report.violations(i));

            if (report.machineName() != null && !report.machineName().isBlank()) {
                Integer first = firstOccurrence.putIfAbsent(report.machineName().trim(), i);
                if (first != null) {
                    violations.add(new FieldViolation("modules[" + i + "].machineName",
                        "duplicates modules[" + first + "]", report.machineName()));
                }
            }
        }

        if (!violations.isEmpty()) {
            throw new ManifestValidationException(
                "Manifest contains " + violations.size() + " invalid field(s)", violations);
        }
    }
}
