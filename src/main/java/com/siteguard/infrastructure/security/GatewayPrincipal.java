package com.siteguard.infrastructure.security;

import java.util.Set;
import java.util.UUID;

/**
 * Principal forwarded by the identity gateway.
 */
public record GatewayPrincipal(
    String principalId,
    PrincipalType type,
    UUID siteId,
    Set<UUID> organizationIds
) {

    public GatewayPrincipal {
        organizationIds = organizationIds == null ? Set.of() : Set.copyOf(organizationIds);
    }

    @Override
    public String toString() {
        return type + ":" + principalId;
    }
}
