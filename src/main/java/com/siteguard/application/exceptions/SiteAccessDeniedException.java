package com.siteguard.application.exceptions;

import java.util.UUID;

/**
 * The caller is not allowed to act on the site or catalog resource.
 */
public class SiteAccessDeniedException extends RuntimeException {

    private final UUID siteId;

    public SiteAccessDeniedException(UUID siteId, String message) {
        super(message);
        this.siteId = siteId;
    }

    public UUID getSiteId() {
        return siteId;
    }
}
