package com.siteguard.application.exceptions;

import java.util.UUID;

public class SiteNotFoundException extends RuntimeException {

    private final UUID siteId;

    public SiteNotFoundException(UUID siteId) {
        super("Site not found: " + siteId);
        this.siteId = siteId;
    }

    public UUID getSiteId() {
        return siteId;
    }
}
