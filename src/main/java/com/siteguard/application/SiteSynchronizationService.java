package com.siteguard.application;

import com.siteguard.application.exceptions.SiteNotFoundException;
import com.siteguard.config.SiteGuardProperties;
import com.siteguard.domain.model.PatchRun;
import com.siteguard.domain.model.Site;
import com.siteguard.domain.repository.SiteRepository;
import com.siteguard.infrastructure.security.SecurityContext;
import com.siteguard.infrastructure.security.SecurityKernel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;

/**
 * One site synchronization as a single atomic unit.
 *
 * <p>Inventory rows, update flags, counters, score and patch run commit together or not at all.
 * Synchronizations of the same site are serialized by a row lock on the site, held until commit;
 * different sites proceed in parallel. A timeout anywhere rolls the whole unit back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SiteSynchronizationService {

    private final SiteRepository sites;
    private final SiteInventorySynchronizer inventorySynchronizer;
    private final PatchRunRecorder patchRunRecorder;
    private final SecurityKernel securityKernel;
    private final SiteGuardProperties properties;
    private final Clock clock;

    @Transactional(isolation = Isolation.READ_COMMITTED)
    public SynchronizationOutcome synchronize(SecurityContext context, Manifest manifest) {
        Site site = sites.findById(manifest.siteId())
            .filter(candidate -> !candidate.isDeleted())
            .orElseThrow(() -> new SiteNotFoundException(manifest.siteId()));

        securityKernel.authorizeSiteSubmission(context, site);

        Site locked = sites.lockForSynchronization(site.getId(), properties.getIngestion().getLockTimeout())
            .orElseThrow(() -> new SiteNotFoundException(manifest.siteId()));

        boolean trusted = securityKernel.mayAssertSecurityUpdates(context);
        if (!trusted && manifest.assertsSecurityUpdates()) {
            log.warn("Ignoring securityUpdate assertions from untrusted principal: siteId={}, principal={}",
                locked.getId(), context.getPrincipalId());
        }

        SyncResult result = inventorySynchronizer.synchronize(locked, manifest.modules(), trusted);
        locked.recordPush(manifest.coreVersion(), manifest.runtimeVersion(), clock.instant());

        Optional<PatchRun> patchRun = patchRunRecorder.record(locked, result);
        sites.save(locked);

        return new SynchronizationOutcome(
            locked.getId(),
            result,
            locked.currentPosture(),
            patchRun.map(PatchRun::getId).orElse(null)
        );
    }
}
