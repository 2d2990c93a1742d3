package com.siteguard.application;

import com.siteguard.infrastructure.security.GatewayPrincipal;
import com.siteguard.infrastructure.security.SecurityContext;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetails;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;

/**
 * Provider for current security context from Spring Security.
 *
 * Converts the gateway principal held by Spring Security's SecurityContextHolder
 * into our domain SecurityContext.
 */
@Component
public class SecurityContextProvider {

    private final Clock clock;

    public SecurityContextProvider(Clock clock) {
        this.clock = clock;
    }

    public SecurityContext getCurrentContext() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()
                || !(authentication.getPrincipal() instanceof GatewayPrincipal)) {
            throw new SecurityException("No authenticated principal");
        }

        GatewayPrincipal principal = (GatewayPrincipal) authentication.getPrincipal();
        return SecurityContext.builder()
            .requestId(UUID.randomUUID())
            .principalId(principal.principalId())
            .principalType(principal.type())
            .siteId(principal.siteId())
            .organizationIds(principal.organizationIds())
            .sourceIp(remoteAddress(authentication))
            .requestedAt(clock.instant())
            .build();
    }

    private String remoteAddress(Authentication authentication) {
        if (authentication.getDetails() instanceof WebAuthenticationDetails) {
            return ((WebAuthenticationDetails) authentication.getDetails()).getRemoteAddress();
        }
        return null;
    }
}
