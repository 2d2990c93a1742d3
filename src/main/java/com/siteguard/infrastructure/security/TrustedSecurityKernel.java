package com.siteguard.infrastructure.security;

import com.siteguard.application.exceptions.SiteAccessDeniedException;
import com.siteguard.domain.model.Site;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Central authorization enforcement point.
 *
 * <p>Rules:
 * <ul>
 *   <li>A SITE principal may submit and read only the site its credential is bound to</li>
 *   <li>A USER principal may submit and read sites of organizations it belongs to</li>
 *   <li>A CATALOG_FEED principal may act on every site and is the only one allowed to publish
 *       catalog releases</li>
 * </ul>
 * Every denial is logged at WARN with the request id.
 */
@Service
@Slf4j
public class TrustedSecurityKernel implements SecurityKernel {

    @Override
    public void authorizeSiteSubmission(SecurityContext context, Site site) {
        authorizeSite(context, site, "SUBMIT_MANIFEST");
    }

    @Override
    public void authorizeSiteRead(SecurityContext context, Site site) {
        authorizeSite(context, site, "READ_SITE");
    }

    @Override
    public void authorizeCatalogFeed(SecurityContext context) {
        if (!context.isCatalogFeed()) {
            deny(context, "PUBLISH_RELEASES", null, "NOT_CATALOG_FEED");
        }
        log.debug("AUTHORIZATION GRANTED [{}]: principal={}, operation=PUBLISH_RELEASES",
            context.getRequestId(), context.getPrincipalId());
    }

    private void authorizeSite(SecurityContext context, Site site, String operation) {
        PrincipalType type = context.getPrincipalType();
        if (type == null) {
            deny(context, operation, site.getId(), "UNKNOWN_PRINCIPAL_TYPE");
        }

        switch (type) {
            case CATALOG_FEED:
                break;
            case SITE:
                if (!site.getId().equals(context.getSiteId())) {
                    deny(context, operation, site.getId(), "FOREIGN_SITE");
                }
                break;
            case USER:
                if (!context.getOrganizationIds().contains(site.getOrganizationId())) {
                    deny(context, operation, site.getId(), "NOT_ORGANIZATION_MEMBER");
                }
                break;
            default:
                deny(context, operation, site.getId(), "UNSUPPORTED_PRINCIPAL_TYPE");
        }

        log.debug("AUTHORIZATION GRANTED [{}]: principal={}, operation={}, siteId={}",
            context.getRequestId(), context.getPrincipalId(), operation, site.getId());
    }

    private void deny(SecurityContext context, String operation, UUID siteId, String reason) {
        log.warn("AUTHORIZATION DENIED [{}]: principal={}, type={}, operation={}, siteId={}, reason={}",
            context.getRequestId(), context.getPrincipalId(), context.getPrincipalType(),
            operation, siteId, reason);

        throw new SiteAccessDeniedException(siteId,
            "Access denied: principal may not perform " + operation);
    }
}
