package com.siteguard.application;

import com.siteguard.domain.model.PatchRun;
import com.siteguard.domain.model.Site;
import com.siteguard.domain.repository.PatchRunRepository;
import com.siteguard.domain.repository.SiteModuleRepository;
import com.siteguard.domain.repository.SiteRepository;
import com.siteguard.domain.service.SecurityPosture;
import com.siteguard.domain.service.SecurityScoreCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Rolls a site's module flags up into its counters and security score, and appends a
 * {@link PatchRun} for every synchronization that changed the inventory.
 *
 * <p>Runs inside the synchronization transaction, so counters, score and patch run commit
 * together with the inventory they describe.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PatchRunRecorder {

    private final SiteRepository sites;
    private final SiteModuleRepository siteModules;
    private final PatchRunRepository patchRuns;
    private final SecurityScoreCalculator scoreCalculator;
    private final Clock clock;

    /**
     * Record the outcome of a synchronization.
     *
     * @return the appended patch run, empty when the synchronization changed nothing
     */
    public Optional<PatchRun> record(Site site, SyncResult result) {
        if (!result.changed()) {
            log.debug("Inventory unchanged, no patch run recorded: siteId={}", site.getId());
            return Optional.empty();
        }

        Instant now = clock.instant();
        SecurityPosture posture = refreshPosture(site, now);

        PatchRun patchRun = patchRuns.append(PatchRun.capture(
            site,
            now,
            result.modulesUpdated(),
            result.securityPatchesApplied(),
            result.modulesAdded(),
            result.modulesRemoved()
        ));

        log.info("Recorded patch run: siteId={}, patchRunId={}, updated={}, securityPatches={}, score={}",
            site.getId(), patchRun.getId(), result.modulesUpdated(), result.securityPatchesApplied(), posture.score());
        return Optional.of(patchRun);
    }

    /**
     * Recompute counters and score from the site's current rows without recording a patch run.
     * Used when catalog data changed but the site's inventory did not.
     */
    public SecurityPosture refreshPosture(Site site) {
        return refreshPosture(site, clock.instant());
    }

    private SecurityPosture refreshPosture(Site site, Instant now) {
        SecurityPosture posture = scoreCalculator.evaluate(siteModules.findBySite(site));
        if (site.applySecurityPosture(posture, now)) {
            log.debug("Security posture changed: siteId={}, posture={}", site.getId(), posture);
        }
        sites.save(site);
        return posture;
    }
}
