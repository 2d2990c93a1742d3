package com.siteguard.application;

import com.siteguard.application.exceptions.CatalogConflictException;
import com.siteguard.application.exceptions.FieldViolation;
import com.siteguard.application.exceptions.ManifestValidationException;
import com.siteguard.config.SiteGuardProperties;
import com.siteguard.domain.model.Module;
import com.siteguard.domain.model.ModuleMetadata;
import com.siteguard.domain.model.ModuleVersion;
import com.siteguard.domain.repository.DuplicateCatalogEntryException;
import com.siteguard.domain.repository.ModuleCatalogRepository;
import com.siteguard.domain.version.VersionComparator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Finds or creates the canonical {@link Module} and {@link ModuleVersion} for a reported
 * module/version pair.
 *
 * <p>Reconciliation is an idempotent upsert keyed by the catalog uniqueness constraints. No
 * global catalog lock is taken: when two writers race to insert the same row, the loser gets a
 * {@link DuplicateCatalogEntryException} from the port, re-reads, and reuses the winner's row.
 * If the row is still not visible after the configured number of attempts the storage contract
 * is broken and {@link CatalogConflictException} is raised.
 *
 * <p>Descriptive module fields are first-writer-wins. A version's security flag is only set when
 * the version is first catalogued, except for authoritative publications which may promote an
 * existing version (never demote).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CatalogReconciler {

    private final ModuleCatalogRepository catalog;
    private final VersionComparator versionComparator;
    private final Clock clock;
    private final SiteGuardProperties properties;

    public CatalogEntry reconcile(String machineName, ModuleMetadata metadata,
                                  String versionString, VersionMetadata versionMetadata) {
        validate(machineName, versionString);

        Reconciled<Module> module = reconcileModule(machineName.trim(), metadata);
        Reconciled<ModuleVersion> version = reconcileVersion(module.value(), versionString.trim(), versionMetadata);

        return new CatalogEntry(module.value(), version.value(), module.created(), version.created(), version.promoted());
    }

    private Reconciled<Module> reconcileModule(String machineName, ModuleMetadata metadata) {
        Reconciled<Module> module = findOrInsert("module " + machineName,
            () -> catalog.findModule(machineName),
            () -> catalog.insertModule(Module.create(machineName, metadata, now())));

        if (module.created()) {
            log.info("Catalogued new module: machineName={}", machineName);
        } else if (module.value().canBeEnrichedBy(metadata) && catalog.enrichModule(module.value(), metadata, now())) {
            log.debug("Enriched module metadata: machineName={}", machineName);
        }
        return module;
    }

    private Reconciled<ModuleVersion> reconcileVersion(Module module, String versionString, VersionMetadata metadata) {
        Reconciled<ModuleVersion> version = findOrInsert(
            "version " + module.getMachineName() + "@" + versionString,
            () -> catalog.findVersion(module, versionString),
            () -> catalog.insertVersion(ModuleVersion.create(
                module,
                versionString,
                versionComparator.sortKey(versionString),
                metadata.releaseDate(),
                metadata.securityUpdate(),
                now())));

        if (version.created()) {
            log.info("Catalogued new version: machineName={}, version={}, securityUpdate={}",
                module.getMachineName(), versionString, version.value().isSecurityUpdate());
            return version;
        }

        ModuleVersion existing = version.value();
        if (!metadata.promoteExisting()) {
            if (metadata.securityUpdate() && !existing.isSecurityUpdate()) {
                log.warn("Ignoring security assertion for already catalogued version: machineName={}, version={}",
                    module.getMachineName(), versionString);
            }
            return version;
        }

        boolean promoted = metadata.securityUpdate() && existing.promoteToSecurityUpdate();
        boolean dated = existing.recordReleaseDate(metadata.releaseDate());
        if (promoted || dated) {
            catalog.saveVersion(existing);
        }
        if (promoted) {
            log.info("Promoted version to security release: machineName={}, version={}",
                module.getMachineName(), versionString);
        }
        return new Reconciled<>(existing, false, promoted);
    }

    private <T> Reconciled<T> findOrInsert(String description, Supplier<Optional<T>> finder, Supplier<T> inserter) {
        int maxAttempts = properties.getCatalog().getMaxReconcileAttempts();
        DuplicateCatalogEntryException lastConflict = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Optional<T> existing = finder.get();
            if (existing.isPresent()) {
                return new Reconciled<>(existing.get(), false, false);
            }
            try {
                return new Reconciled<>(inserter.get(), true, false);
            } catch (DuplicateCatalogEntryException e) {
                lastConflict = e;
                log.debug("Concurrent insert of {} detected, re-reading (attempt {}/{})",
                    description, attempt, maxAttempts);
            }
        }

        log.error("Catalog conflict unresolved after {} attempts: {}", maxAttempts, description);
        throw new CatalogConflictException("Could not reconcile " + description, lastConflict);
    }

    private void validate(String machineName, String versionString) {
        List<FieldViolation> violations =
            new ModuleReport(machineName, null, null, Boolean.TRUE, versionString, null, null).violations(0);
        if (!violations.isEmpty()) {
            throw new ManifestValidationException("Invalid catalog entry", violations);
        }
    }

    private Instant now() {
        return clock.instant();
    }

    private record Reconciled<T>(T value, boolean created, boolean promoted) {
    }
}
