package com.siteguard.infrastructure.security;

import com.siteguard.application.exceptions.SiteAccessDeniedException;
import com.siteguard.domain.model.Site;
import com.siteguard.support.CatalogFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class TrustedSecurityKernelTest {

    private final TrustedSecurityKernel kernel = new TrustedSecurityKernel();
    private final Site site = CatalogFixtures.site();

    @Test
    @DisplayName("a site principal may submit for its own site only")
    void sitePrincipal() {
        assertDoesNotThrow(() -> kernel.authorizeSiteSubmission(sitePrincipal(site.getId()), site));

        SiteAccessDeniedException denied = assertThrows(SiteAccessDeniedException.class,
            () -> kernel.authorizeSiteSubmission(sitePrincipal(UUID.randomUUID()), site));
        assertEquals(site.getId(), denied.getSiteId());
    }

    @Test
    @DisplayName("a user may read sites of organizations it belongs to")
    void userPrincipal() {
        SecurityContext member = context(PrincipalType.USER).organizationId(site.getOrganizationId()).build();
        SecurityContext outsider = context(PrincipalType.USER).organizationId(UUID.randomUUID()).build();

        assertDoesNotThrow(() -> kernel.authorizeSiteRead(member, site));
        assertThrows(SiteAccessDeniedException.class, () -> kernel.authorizeSiteRead(outsider, site));
    }

    @Test
    @DisplayName("only the catalog feed publishes releases and asserts security updates")
    void catalogFeed() {
        SecurityContext feed = context(PrincipalType.CATALOG_FEED).build();
        SecurityContext user = context(PrincipalType.USER).build();

        assertDoesNotThrow(() -> kernel.authorizeCatalogFeed(feed));
        assertDoesNotThrow(() -> kernel.authorizeSiteSubmission(feed, site));
        assertTrue(kernel.mayAssertSecurityUpdates(feed));

        assertThrows(SiteAccessDeniedException.class, () -> kernel.authorizeCatalogFeed(user));
        assertFalse(kernel.mayAssertSecurityUpdates(user));
        assertFalse(kernel.mayAssertSecurityUpdates(sitePrincipal(site.getId())));
    }

    @Test
    @DisplayName("a context without principal type is denied")
    void missingType() {
        SecurityContext untyped = SecurityContext.builder()
            .requestId(UUID.randomUUID())
            .principalId("anonymous")
            .requestedAt(Instant.now())
            .build();

        assertThrows(SiteAccessDeniedException.class, () -> kernel.authorizeSiteRead(untyped, site));
    }

    private static SecurityContext sitePrincipal(UUID siteId) {
        return context(PrincipalType.SITE).siteId(siteId).build();
    }

    private static SecurityContext.SecurityContextBuilder context(PrincipalType type) {
        return SecurityContext.builder()
            .requestId(UUID.randomUUID())
            .principalId(type.name().toLowerCase() + "-principal")
            .principalType(type)
            .requestedAt(Instant.now());
    }
}
