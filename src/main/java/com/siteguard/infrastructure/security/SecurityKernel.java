package com.siteguard.infrastructure.security;

import com.siteguard.domain.model.Site;

/**
 * Authorization decisions for the engine. Authentication itself happens upstream.
 */
public interface SecurityKernel {

    void authorizeSiteSubmission(SecurityContext context, Site site);

    void authorizeSiteRead(SecurityContext context, Site site);

    void authorizeCatalogFeed(SecurityContext context);

    /**
     * Whether the caller may flag versions as security releases.
     */
    default boolean mayAssertSecurityUpdates(SecurityContext context) {
        return context.isCatalogFeed();
    }
}
