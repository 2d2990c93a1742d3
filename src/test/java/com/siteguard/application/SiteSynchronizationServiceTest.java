package com.siteguard.application;

import com.siteguard.application.exceptions.SiteAccessDeniedException;
import com.siteguard.application.exceptions.SiteNotFoundException;
import com.siteguard.config.SiteGuardProperties;
import com.siteguard.domain.model.PatchRun;
import com.siteguard.domain.model.Site;
import com.siteguard.domain.repository.SiteRepository;
import com.siteguard.infrastructure.security.PrincipalType;
import com.siteguard.infrastructure.security.SecurityContext;
import com.siteguard.infrastructure.security.SecurityKernel;
import com.siteguard.support.CatalogFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SiteSynchronizationServiceTest {

    @Mock
    private SiteRepository sites;
    @Mock
    private SiteInventorySynchronizer inventorySynchronizer;
    @Mock
    private PatchRunRecorder patchRunRecorder;
    @Mock
    private SecurityKernel securityKernel;

    private final SiteGuardProperties properties = new SiteGuardProperties();
    private SiteSynchronizationService service;
    private Site site;
    private SecurityContext context;

    @BeforeEach
    void setUp() {
        service = new SiteSynchronizationService(sites, inventorySynchronizer, patchRunRecorder, securityKernel,
            properties, Clock.fixed(CatalogFixtures.NOW, ZoneOffset.UTC));
        site = CatalogFixtures.site();
        context = SecurityContext.builder()
            .requestId(UUID.randomUUID())
            .principalId("site-agent")
            .principalType(PrincipalType.SITE)
            .siteId(site.getId())
            .requestedAt(CatalogFixtures.NOW)
            .build();
    }

    @Test
    @DisplayName("authorizes, locks, synchronizes and records in that order")
    void happyPath() {
        SyncResult result = new SyncResult(true, 1, 1, 0, 0, 0);
        PatchRun patchRun = PatchRun.capture(site, CatalogFixtures.NOW, 0, 0, 1, 0);
        List<ModuleReport> modules = List.of(
            new ModuleReport("token", null, null, Boolean.TRUE, "1.13", null, null));

        when(sites.findById(site.getId())).thenReturn(Optional.of(site));
        when(sites.lockForSynchronization(eq(site.getId()), any(Duration.class))).thenReturn(Optional.of(site));
        when(securityKernel.mayAssertSecurityUpdates(context)).thenReturn(false);
        when(inventorySynchronizer.synchronize(site, modules, false)).thenReturn(result);
        when(patchRunRecorder.record(site, result)).thenReturn(Optional.of(patchRun));

        SynchronizationOutcome outcome = service.synchronize(context, manifest("10.2.4", modules));

        assertEquals(site.getId(), outcome.siteId());
        assertSame(result, outcome.result());
        assertEquals(patchRun.getId(), outcome.patchRunId());
        assertEquals("10.2.4", site.getCoreVersion());
        assertEquals(CatalogFixtures.NOW, site.getLastDataPush());

        InOrder order = inOrder(securityKernel, sites, inventorySynchronizer, patchRunRecorder);
        order.verify(securityKernel).authorizeSiteSubmission(context, site);
        order.verify(sites).lockForSynchronization(site.getId(), properties.getIngestion().getLockTimeout());
        order.verify(inventorySynchronizer).synchronize(site, modules, false);
        order.verify(patchRunRecorder).record(site, result);
        order.verify(sites).save(site);
    }

    @Test
    @DisplayName("trusted principals may flag new versions")
    void trustedAssertions() {
        List<ModuleReport> modules = List.of();
        when(sites.findById(site.getId())).thenReturn(Optional.of(site));
        when(sites.lockForSynchronization(eq(site.getId()), any(Duration.class))).thenReturn(Optional.of(site));
        when(securityKernel.mayAssertSecurityUpdates(context)).thenReturn(true);
        when(inventorySynchronizer.synchronize(site, modules, true)).thenReturn(new SyncResult(false, 0, 0, 0, 0, 0));
        when(patchRunRecorder.record(eq(site), any())).thenReturn(Optional.empty());

        SynchronizationOutcome outcome = service.synchronize(context, manifest(null, modules));

        assertNull(outcome.patchRunId());
        verify(inventorySynchronizer).synchronize(site, modules, true);
    }

    @Test
    @DisplayName("unknown site is rejected before locking")
    void unknownSite() {
        when(sites.findById(site.getId())).thenReturn(Optional.empty());

        assertThrows(SiteNotFoundException.class, () -> service.synchronize(context, manifest(null, List.of())));
        verify(sites, never()).lockForSynchronization(any(), any());
    }

    @Test
    @DisplayName("soft-deleted site is treated as unknown")
    void deletedSite() {
        ReflectionTestUtils.setField(site, "deleted", true);
        when(sites.findById(site.getId())).thenReturn(Optional.of(site));

        assertThrows(SiteNotFoundException.class, () -> service.synchronize(context, manifest(null, List.of())));
    }

    @Test
    @DisplayName("denied principal never reaches the inventory")
    void denied() {
        when(sites.findById(site.getId())).thenReturn(Optional.of(site));
        doThrow(new SiteAccessDeniedException(site.getId(), "denied"))
            .when(securityKernel).authorizeSiteSubmission(context, site);

        assertThrows(SiteAccessDeniedException.class, () -> service.synchronize(context, manifest(null, List.of())));
        verify(sites, never()).lockForSynchronization(any(), any());
        verify(inventorySynchronizer, never()).synchronize(any(), any(), anyBoolean());
    }

    private Manifest manifest(String coreVersion, List<ModuleReport> modules) {
        return new Manifest(site.getId(), coreVersion, null, modules);
    }
}
