package com.siteguard.infrastructure.persistence;

import com.siteguard.domain.model.Module;
import com.siteguard.domain.model.ModuleMetadata;
import com.siteguard.domain.model.ModuleVersion;
import com.siteguard.domain.repository.DuplicateCatalogEntryException;
import com.siteguard.domain.repository.ModuleCatalogRepository;
import com.siteguard.domain.repository.ModuleSearchCriteria;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Adapter implementing the catalog port with Spring Data JPA and PostgreSQL upserts.
 *
 * <p>Inserts are {@code INSERT ... ON CONFLICT DO NOTHING} in the caller's transaction:
 * <ul>
 *   <li>a rollback of the caller removes the rows it created</li>
 *   <li>a writer racing on the same key waits for the other writer's outcome, then either
 *       inserts (the other rolled back) or gets zero rows and a {@link DuplicateCatalogEntryException},
 *       without aborting its own transaction</li>
 *   <li>no second pooled connection is needed</li>
 * </ul>
 * The stored row is then read back into the caller's persistence context.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class ModuleCatalogRepositoryAdapter implements ModuleCatalogRepository {

    private static final String INSERT_MODULE =
        "INSERT INTO modules (id, machine_name, display_name, category, project_link, deleted, created_at, updated_at) "
            + "VALUES (:id, :machineName, CAST(:displayName AS varchar), CAST(:category AS varchar), "
            + "CAST(:link AS varchar), false, :createdAt, :createdAt) "
            + "ON CONFLICT (machine_name) DO NOTHING";

    private static final String INSERT_VERSION =
        "INSERT INTO module_versions (id, module_id, version_string, sort_key, release_date, security_update, deleted, created_at) "
            + "VALUES (:id, :moduleId, :versionString, :sortKey, CAST(CAST(:releaseDate AS varchar) AS date), "
            + ":securityUpdate, false, :createdAt) "
            + "ON CONFLICT (module_id, version_string) DO NOTHING";

    // SKIP LOCKED: a module row held by another writer is left alone, first writer wins anyway
    private static final String ENRICH_MODULE =
        "UPDATE modules SET "
            + "display_name = COALESCE(display_name, CAST(:displayName AS varchar)), "
            + "category = COALESCE(category, CAST(:category AS varchar)), "
            + "project_link = COALESCE(project_link, CAST(:link AS varchar)), "
            + "updated_at = :now "
            + "WHERE id = (SELECT m.id FROM modules m WHERE m.id = :id "
            + "AND ((m.display_name IS NULL AND CAST(:displayName AS varchar) IS NOT NULL) "
            + "OR (m.category IS NULL AND CAST(:category AS varchar) IS NOT NULL) "
            + "OR (m.project_link IS NULL AND CAST(:link AS varchar) IS NOT NULL)) "
            + "FOR UPDATE SKIP LOCKED)";

    private final SpringDataModuleRepository modules;
    private final SpringDataModuleVersionRepository versions;

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public Optional<Module> findModule(String machineName) {
        UUID id = modules.findIdByMachineName(machineName);
        if (id == null) {
            return Optional.empty();
        }
        return modules.findById(id);
    }

    @Override
    public Module insertModule(Module module) {
        int inserted = entityManager.createNativeQuery(INSERT_MODULE)
            .setParameter("id", module.getId())
            .setParameter("machineName", module.getMachineName())
            .setParameter("displayName", module.getDisplayName())
            .setParameter("category", module.getCategory() == null ? null : module.getCategory().name())
            .setParameter("link", module.getLink())
            .setParameter("createdAt", module.getCreatedAt())
            .executeUpdate();

        if (inserted == 0) {
            log.debug("Insert of module {} lost a uniqueness race", module.getMachineName());
            throw new DuplicateCatalogEntryException("Duplicate catalog entry: module " + module.getMachineName());
        }
        return modules.findById(module.getId())
            .orElseThrow(() -> new IllegalStateException("Inserted module not visible: " + module.getId()));
    }

    @Override
    public boolean enrichModule(Module module, ModuleMetadata metadata, Instant now) {
        int updated = entityManager.createNativeQuery(ENRICH_MODULE)
            .setParameter("id", module.getId())
            .setParameter("displayName", trimToNull(metadata.displayName()))
            .setParameter("category", metadata.category() == null ? null : metadata.category().name())
            .setParameter("link", trimToNull(metadata.link()))
            .setParameter("now", now)
            .executeUpdate();

        if (updated == 0) {
            return false;
        }
        entityManager.refresh(module);
        return true;
    }

    @Override
    public Optional<ModuleVersion> findVersion(Module module, String versionString) {
        return versions.findByModuleAndVersion(module.getId(), versionString);
    }

    @Override
    public ModuleVersion insertVersion(ModuleVersion version) {
        int inserted = entityManager.createNativeQuery(INSERT_VERSION)
            .setParameter("id", version.getId())
            .setParameter("moduleId", version.getModule().getId())
            .setParameter("versionString", version.getVersionString())
            .setParameter("sortKey", version.getSortKey())
            .setParameter("releaseDate", version.getReleaseDate() == null ? null : version.getReleaseDate().toString())
            .setParameter("securityUpdate", version.isSecurityUpdate())
            .setParameter("createdAt", version.getCreatedAt())
            .executeUpdate();

        if (inserted == 0) {
            log.debug("Insert of version {}@{} lost a uniqueness race",
                version.getModule().getMachineName(), version.getVersionString());
            throw new DuplicateCatalogEntryException("Duplicate catalog entry: version "
                + version.getModule().getMachineName() + "@" + version.getVersionString());
        }
        return versions.findById(version.getId())
            .orElseThrow(() -> new IllegalStateException("Inserted version not visible: " + version.getId()));
    }

    @Override
    public void saveVersion(ModuleVersion version) {
        versions.save(version);
    }

    @Override
    public List<ModuleVersion> findVersions(Module module) {
        return versions.findByModuleId(module.getId());
    }

    @Override
    public Page<Module> searchModules(ModuleSearchCriteria criteria, Pageable pageable) {
        if (criteria.hasSecurityUpdate() == null) {
            return modules.search(criteria.category(), pageable);
        }
        return criteria.hasSecurityUpdate()
            ? modules.searchWithSecurityReleases(criteria.category(), pageable)
            : modules.searchWithoutSecurityReleases(criteria.category(), pageable);
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
