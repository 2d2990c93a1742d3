package com.siteguard.application;

import com.siteguard.application.exceptions.SiteNotFoundException;
import com.siteguard.domain.model.PatchRun;
import com.siteguard.domain.model.Site;
import com.siteguard.domain.model.SiteModule;
import com.siteguard.domain.repository.PatchRunRepository;
import com.siteguard.domain.repository.SiteModuleRepository;
import com.siteguard.domain.repository.SiteRepository;
import com.siteguard.infrastructure.security.SecurityContext;
import com.siteguard.infrastructure.security.SecurityKernel;
import com.siteguard.interfaces.api.dto.PageResponse;
import com.siteguard.interfaces.api.dto.PatchRunResponse;
import com.siteguard.interfaces.api.dto.SecuritySummaryResponse;
import com.siteguard.interfaces.api.dto.SiteModuleResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Read access to a site's inventory, patch history and security summary.
 * Every call is authorized against the site first.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true, isolation = Isolation.READ_COMMITTED)
public class SiteInventoryQueryService {

    private final SiteRepository sites;
    private final SiteModuleRepository siteModules;
    private final PatchRunRepository patchRuns;
    private final SecurityKernel securityKernel;
    private final SecurityContextProvider securityContextProvider;

    public PageResponse<SiteModuleResponse> listModules(UUID siteId, Boolean updateAvailable,
                                                        Boolean securityUpdateAvailable, Pageable pageable) {
        Site site = authorizedSite(siteId);
        return PageResponse.of(
            siteModules.findBySite(site.getId(), updateAvailable, securityUpdateAvailable, pageable),
            SiteInventoryQueryService::toModuleResponse);
    }

    public PageResponse<PatchRunResponse> listPatchRuns(UUID siteId, Pageable pageable) {
        Site site = authorizedSite(siteId);
        return PageResponse.of(patchRuns.findBySite(site.getId(), pageable), SiteInventoryQueryService::toPatchRunResponse);
    }

    public SecuritySummaryResponse securitySummary(UUID siteId) {
        Site site = authorizedSite(siteId);
        return SecuritySummaryResponse.builder()
            .siteId(site.getId())
            .name(site.getName())
            .url(site.getUrl())
            .coreVersion(site.getCoreVersion())
            .runtimeVersion(site.getRuntimeVersion())
            .securityScore(site.getSecurityScore())
            .totalModulesCount(site.getTotalModulesCount())
            .securityUpdatesCount(site.getSecurityUpdatesCount())
            .nonSecurityUpdatesCount(site.getNonSecurityUpdatesCount())
            .lastDataPush(site.getLastDataPush())
            .build();
    }

    private Site authorizedSite(UUID siteId) {
        SecurityContext context = securityContextProvider.getCurrentContext();
        Site site = sites.findById(siteId)
            .filter(candidate -> !candidate.isDeleted())
            .orElseThrow(() -> new SiteNotFoundException(siteId));
        securityKernel.authorizeSiteRead(context, site);
        return site;
    }

    private static SiteModuleResponse toModuleResponse(SiteModule siteModule) {
        return SiteModuleResponse.builder()
            .machineName(siteModule.getModule().getMachineName())
            .displayName(siteModule.getModule().getLabel())
            .category(siteModule.getModule().getCategory() != null
                ? siteModule.getModule().getCategory().wireValue() : null)
            .currentVersion(siteModule.getCurrentVersion().getVersionString())
            .latestVersion(siteModule.getLatestVersion() != null
                ? siteModule.getLatestVersion().getVersionString() : null)
            .currentVersionSecurityUpdate(siteModule.getCurrentVersion().isSecurityUpdate())
            .enabled(siteModule.isEnabled())
            .updateAvailable(siteModule.isUpdateAvailable())
            .securityUpdateAvailable(siteModule.isSecurityUpdateAvailable())
            .versionUpdatedAt(siteModule.getVersionUpdatedAt())
            .build();
    }

    private static PatchRunResponse toPatchRunResponse(PatchRun patchRun) {
        return PatchRunResponse.builder()
            .id(patchRun.getId())
            .runAt(patchRun.getRunAt())
            .modulesUpdated(patchRun.getModulesUpdated())
            .securityPatchesApplied(patchRun.getSecurityPatchesApplied())
            .modulesAdded(patchRun.getModulesAdded())
            .modulesRemoved(patchRun.getModulesRemoved())
            .securityScore(patchRun.getSecurityScore())
            .build();
    }
}
