package com.siteguard.application;

import com.siteguard.application.exceptions.ModuleNotFoundException;
import com.siteguard.domain.model.Module;
import com.siteguard.domain.model.ModuleVersion;
import com.siteguard.domain.repository.ModuleCatalogRepository;
import com.siteguard.domain.repository.ModuleSearchCriteria;
import com.siteguard.domain.repository.SiteModuleRepository;
import com.siteguard.domain.service.UpdateDetector;
import com.siteguard.domain.version.ParsedVersion;
import com.siteguard.domain.version.VersionComparator;
import com.siteguard.interfaces.api.dto.ModuleSummaryResponse;
import com.siteguard.interfaces.api.dto.ModuleVersionResponse;
import com.siteguard.interfaces.api.dto.PageResponse;
import com.siteguard.interfaces.api.dto.VersionComparisonResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read access to the shared module catalog for the reporting layer.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true, isolation = Isolation.READ_COMMITTED)
public class ModuleCatalogQueryService {

    private final ModuleCatalogRepository catalog;
    private final SiteModuleRepository siteModules;
    private final VersionComparator versionComparator;
    private final UpdateDetector updateDetector;

    public PageResponse<ModuleSummaryResponse> listModules(ModuleSearchCriteria criteria, Pageable pageable) {
        Page<Module> page = catalog.searchModules(criteria, pageable);
        return PageResponse.of(page, this::summarize);
    }

    /**
     * Non-deleted versions of a module, newest first.
     */
    public List<ModuleVersionResponse> listVersions(String machineName) {
        Module module = catalog.findModule(machineName)
            .filter(candidate -> !candidate.isDeleted())
            .orElseThrow(() -> new ModuleNotFoundException(machineName));

        return liveVersions(module).stream()
            .sorted(versionComparator.catalogOrder().reversed())
            .map(this::toResponse)
            .collect(Collectors.toList());
    }

    @Transactional(propagation = Propagation.SUPPORTS)
    public VersionComparisonResponse compare(String left, String right) {
        Optional<ParsedVersion> parsedLeft = versionComparator.parse(left);
        Optional<ParsedVersion> parsedRight = versionComparator.parse(right);

        return VersionComparisonResponse.builder()
            .left(left)
            .right(right)
            .ordering(versionComparator.order(left, right).name())
            .leftParseable(parsedLeft.isPresent())
            .rightParseable(parsedRight.isPresent())
            .leftBranch(parsedLeft.map(ParsedVersion::branchKey).orElse(null))
            .rightBranch(parsedRight.map(ParsedVersion::branchKey).orElse(null))
            .sameBranch(versionComparator.sameBranch(left, right))
            .upgrade(versionComparator.isUpgrade(left, right, updateDetector.getBranchPolicy()))
            .build();
    }

    private ModuleSummaryResponse summarize(Module module) {
        List<ModuleVersion> versions = liveVersions(module);
        Comparator<ModuleVersion> order = versionComparator.catalogOrder();

        Optional<ModuleVersion> latest = versions.stream().max(order);
        Optional<ModuleVersion> latestSecurity = versions.stream()
            .filter(ModuleVersion::isSecurityUpdate)
            .max(order);

        return ModuleSummaryResponse.builder()
            .id(module.getId())
            .machineName(module.getMachineName())
            .displayName(module.getLabel())
            .category(module.getCategory() != null ? module.getCategory().wireValue() : null)
            .link(module.getLink())
            .versionCount(versions.size())
            .latestVersion(latest.map(ModuleVersion::getVersionString).orElse(null))
            .latestSecurityVersion(latestSecurity.map(ModuleVersion::getVersionString).orElse(null))
            .hasSecurityUpdate(latestSecurity.isPresent())
            .installCount(siteModules.countByModule(module))
            .build();
    }

    private List<ModuleVersion> liveVersions(Module module) {
        return catalog.findVersions(module).stream()
            .filter(version -> !version.isDeleted())
            .collect(Collectors.toList());
    }

    private ModuleVersionResponse toResponse(ModuleVersion version) {
        Optional<ParsedVersion> parsed = versionComparator.parse(version.getVersionString());
        return ModuleVersionResponse.builder()
            .id(version.getId())
            .version(version.getVersionString())
            .branchKey(parsed.map(ParsedVersion::branchKey).orElse(null))
            .preRelease(parsed.map(ParsedVersion::isPreRelease).orElse(false))
            .releaseDate(version.getReleaseDate())
            .securityUpdate(version.isSecurityUpdate())
            .build();
    }
}
