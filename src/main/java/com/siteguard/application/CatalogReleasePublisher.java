package com.siteguard.application;

import com.siteguard.application.exceptions.FieldViolation;
import com.siteguard.application.exceptions.ManifestValidationException;
import com.siteguard.config.SiteGuardProperties;
import com.siteguard.domain.model.Module;
import com.siteguard.domain.model.ModuleVersion;
import com.siteguard.domain.model.Site;
import com.siteguard.domain.model.SiteModule;
import com.siteguard.domain.repository.ModuleCatalogRepository;
import com.siteguard.domain.repository.SiteModuleRepository;
import com.siteguard.domain.repository.SiteRepository;
import com.siteguard.domain.service.UpdateDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Applies authoritative releases to the catalog and re-evaluates every site that has an
 * affected module installed.
 *
 * <p>Every module named in the release list is re-evaluated, whether or not this call created or
 * promoted anything: a republished release repairs flags left stale by an earlier publication
 * that failed after its catalog writes. Sites with an affected module installed are locked in
 * ascending id order, their rows for the affected modules are re-flagged and their counters and
 * score recomputed. No patch run is recorded since no site's inventory changed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CatalogReleasePublisher {

    private final CatalogReconciler catalogReconciler;
    private final ModuleCatalogRepository catalog;
    private final SiteRepository sites;
    private final SiteModuleRepository siteModules;
    private final UpdateDetector updateDetector;
    private final PatchRunRecorder patchRunRecorder;
    private final SiteGuardProperties properties;
    private final Clock clock;

    @Transactional(isolation = Isolation.READ_COMMITTED)
    public CatalogPublicationResult publish(List<CatalogRelease> releases) {
        validate(releases);

        int modulesCreated = 0;
        int versionsCreated = 0;
        int versionsPromoted = 0;
        Map<UUID, Module> affectedModules = new LinkedHashMap<>();
        Map<UUID, Site> lockedSites = new TreeMap<>();

        List<CatalogRelease> ordered = new ArrayList<>(releases);
        ordered.sort(Comparator.comparing(CatalogRelease::machineName).thenComparing(CatalogRelease::version));

        // sites are locked before any catalog write, so a concurrent synchronization of one of
        // them never waits on our catalog rows while we wait on its site
        List<Module> knownModules = new ArrayList<>();
        for (CatalogRelease release : ordered) {
            catalog.findModule(release.machineName().trim()).ifPresent(knownModules::add);
        }
        lockSites(installedSiteIds(knownModules), lockedSites);

        for (CatalogRelease release : ordered) {
            CatalogEntry entry = catalogReconciler.reconcile(
                release.machineName(),
                release.metadata(),
                release.version(),
                VersionMetadata.published(release.releaseDate(), release.securityUpdate()));

            if (entry.moduleCreated()) {
                modulesCreated++;
            }
            if (entry.versionCreated()) {
                versionsCreated++;
            }
            if (entry.versionPromoted()) {
                versionsPromoted++;
            }
            affectedModules.put(entry.module().getId(), entry.module());
        }

        lockSites(installedSiteIds(affectedModules.values()), lockedSites);
        int sitesReevaluated = reevaluate(lockedSites.values(), affectedModules);

        log.info("Published catalog releases: releases={}, modulesCreated={}, versionsCreated={}, "
                + "versionsPromoted={}, sitesReevaluated={}",
            releases.size(), modulesCreated, versionsCreated, versionsPromoted, sitesReevaluated);

        return new CatalogPublicationResult(releases.size(), modulesCreated, versionsCreated,
            versionsPromoted, sitesReevaluated);
    }

    private TreeSet<UUID> installedSiteIds(Collection<Module> modules) {
        TreeSet<UUID> siteIds = new TreeSet<>();
        for (Module module : modules) {
            siteIds.addAll(siteModules.findSiteIdsByModule(module));
        }
        return siteIds;
    }

    /**
     * Lock the given sites in ascending id order, skipping those already held.
     */
    private void lockSites(TreeSet<UUID> siteIds, Map<UUID, Site> lockedSites) {
        for (UUID siteId : siteIds) {
            if (lockedSites.containsKey(siteId)) {
                continue;
            }
            Optional<Site> locked = sites.lockForSynchronization(siteId, properties.getIngestion().getLockTimeout());
            if (locked.isPresent() && !locked.get().isDeleted()) {
                lockedSites.put(siteId, locked.get());
            }
        }
    }

    private int reevaluate(Collection<Site> lockedSites, Map<UUID, Module> affectedModules) {
        Map<UUID, List<ModuleVersion>> versionsByModule = new HashMap<>();
        Instant now = clock.instant();
        int reevaluated = 0;

        for (Site site : lockedSites) {
            boolean affected = false;
            for (SiteModule row : siteModules.findBySite(site)) {
                Module module = affectedModules.get(row.getModule().getId());
                if (module == null) {
                    continue;
                }
                affected = true;
                List<ModuleVersion> knownVersions =
                    versionsByModule.computeIfAbsent(module.getId(), id -> catalog.findVersions(module));
                if (row.applyAssessment(updateDetector.assess(row.getCurrentVersion(), knownVersions), now)) {
                    siteModules.save(row);
                }
            }
            if (affected) {
                patchRunRecorder.refreshPosture(site);
                reevaluated++;
            }
        }
        return reevaluated;
    }

    private void validate(List<CatalogRelease> releases) {
        List<FieldViolation> violations = new ArrayList<>();
        for (int i = 0; i < releases.size(); i++) {
            CatalogRelease release = releases.get(i);
            List<FieldViolation> reportViolations = new ModuleReport(
                release.machineName(), null, null, Boolean.TRUE, release.version(), null, null).violations(i);
            for (FieldViolation violation : reportViolations) {
                violations.add(new FieldViolation(
                    violation.field().replaceFirst("^modules", "releases"),
                    violation.message(),
                    violation.rejectedValue()));
            }
        }
        if (!violations.isEmpty()) {
            throw new ManifestValidationException("Release list contains invalid entries", violations);
        }
    }
}
