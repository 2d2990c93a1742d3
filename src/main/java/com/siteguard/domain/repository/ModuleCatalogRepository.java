package com.siteguard.domain.repository;

import com.siteguard.domain.model.Module;
import com.siteguard.domain.model.ModuleMetadata;
import com.siteguard.domain.model.ModuleVersion;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Port for the shared module/version catalog.
 *
 * <p>Implementations must guarantee:
 * <ul>
 *   <li>Unique machine name per module and unique (module, version string) per version</li>
 *   <li>Writes join the caller's transaction: a rolled-back synchronization or publication leaves
 *       no catalog rows behind</li>
 *   <li>An insert that collides with a row created by a concurrent writer surfaces as
 *       {@link DuplicateCatalogEntryException} once that writer has committed, and never
 *       aborts the caller's transaction</li>
 * </ul>
 * Catalog rows are never deleted.
 */
public interface ModuleCatalogRepository {

    Optional<Module> findModule(String machineName);

    /**
     * Insert a new module.
     *
     * @return the stored module, attached to the caller's unit of work
     * @throws DuplicateCatalogEntryException if the machine name already exists
     */
    Module insertModule(Module module);

    /**
     * Fill descriptive fields of an existing module that are still empty. Never waits for a
     * concurrent writer of the same module row; the enrichment is skipped instead.
     *
     * @return true if the module was updated
     */
    boolean enrichModule(Module module, ModuleMetadata metadata, Instant now);

    Optional<ModuleVersion> findVersion(Module module, String versionString);

    /**
     * Insert a new version.
     *
     * @return the stored version, attached to the caller's unit of work
     * @throws DuplicateCatalogEntryException if (module, version string) already exists
     */
    ModuleVersion insertVersion(ModuleVersion version);

    /**
     * Persist a release date or security promotion on an existing version.
     */
    void saveVersion(ModuleVersion version);

    /**
     * All versions known for a module, deleted ones included, in no particular order.
     */
    List<ModuleVersion> findVersions(Module module);

    Page<Module> searchModules(ModuleSearchCriteria criteria, Pageable pageable);
}
