package com.siteguard.infrastructure.security;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * Immutable security context for a request.
 *
 * <p>Built from the principal the gateway authenticated and threaded through all operations.
 */
@Value
@Builder
public class SecurityContext {
    UUID requestId;
    String principalId;
    PrincipalType principalType;
    /** Site bound to a SITE credential, null for other principal types. */
    UUID siteId;
    @Singular
    Set<UUID> organizationIds;
    String sourceIp;
    Instant requestedAt;

    public boolean isCatalogFeed() {
        return principalType == PrincipalType.CATALOG_FEED;
    }
}
