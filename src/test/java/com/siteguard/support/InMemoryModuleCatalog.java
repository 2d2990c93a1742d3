package com.siteguard.support;

import com.siteguard.domain.model.Module;
import com.siteguard.domain.model.ModuleMetadata;
import com.siteguard.domain.model.ModuleVersion;
import com.siteguard.domain.repository.DuplicateCatalogEntryException;
import com.siteguard.domain.repository.ModuleCatalogRepository;
import com.siteguard.domain.repository.ModuleSearchCriteria;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Thread-safe catalog honouring the same uniqueness rules as the database.
 */
public class InMemoryModuleCatalog implements ModuleCatalogRepository {

    private final ConcurrentMap<String, Module> modules = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ModuleVersion> versions = new ConcurrentHashMap<>();
    private final AtomicInteger duplicateInserts = new AtomicInteger();

    @Override
    public Optional<Module> findModule(String machineName) {
        return Optional.ofNullable(modules.get(machineName));
    }

    @Override
    public Module insertModule(Module module) {
        Module existing = modules.putIfAbsent(module.getMachineName(), module);
        if (existing != null) {
            duplicateInserts.incrementAndGet();
            throw new DuplicateCatalogEntryException("module " + module.getMachineName() + " exists");
        }
        return module;
    }

    @Override
    public boolean enrichModule(Module module, ModuleMetadata metadata, Instant now) {
        return module.enrich(metadata, now);
    }

    @Override
    public Optional<ModuleVersion> findVersion(Module module, String versionString) {
        return Optional.ofNullable(versions.get(key(module, versionString)));
    }

    @Override
    public ModuleVersion insertVersion(ModuleVersion version) {
        ModuleVersion existing = versions.putIfAbsent(key(version.getModule(), version.getVersionString()), version);
        if (existing != null) {
            duplicateInserts.incrementAndGet();
            throw new DuplicateCatalogEntryException("version " + version.getVersionString() + " exists");
        }
        return version;
    }

    @Override
    public void saveVersion(ModuleVersion version) {
        // instances are shared, nothing to write back
    }

    @Override
    public List<ModuleVersion> findVersions(Module module) {
        return versions.values().stream()
            .filter(version -> version.getModule().getId().equals(module.getId()))
            .collect(Collectors.toList());
    }

    @Override
    public Page<Module> searchModules(ModuleSearchCriteria criteria, Pageable pageable) {
        List<Module> matching = modules.values().stream()
            .filter(module -> criteria.category() == null || criteria.category() == module.getCategory())
            .filter(module -> criteria.hasSecurityUpdate() == null
                || criteria.hasSecurityUpdate() == findVersions(module).stream().anyMatch(ModuleVersion::isSecurityUpdate))
            .sorted(Comparator.comparing(Module::getMachineName))
            .collect(Collectors.toList());
        int from = (int) Math.min(pageable.getOffset(), matching.size());
        int to = Math.min(from + pageable.getPageSize(), matching.size());
        return new PageImpl<>(matching.subList(from, to), pageable, matching.size());
    }

    public int moduleCount() {
        return modules.size();
    }

    public int versionCount() {
        return versions.size();
    }

    public int duplicateInserts() {
        return duplicateInserts.get();
    }

    private static String key(Module module, String versionString) {
        return module.getId() + "|" + versionString;
    }
}
