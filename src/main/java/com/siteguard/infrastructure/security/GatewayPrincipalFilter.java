package com.siteguard.infrastructure.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.security.web.authentication.preauth.PreAuthenticatedAuthenticationToken;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Turns the principal headers set by the upstream identity gateway into a Spring Security
 * {@code Authentication}.
 *
 * <p>The gateway strips these headers from external traffic, so they are trusted as-is.
 * Requests without them, or with malformed values, stay unauthenticated and are rejected
 * by the entry point.
 */
@Slf4j
public class GatewayPrincipalFilter extends OncePerRequestFilter {

    public static final String PRINCIPAL_ID_HEADER = "X-Principal-Id";
    public static final String PRINCIPAL_TYPE_HEADER = "X-Principal-Type";
    public static final String SITE_ID_HEADER = "X-Site-Id";
    public static final String ORGANIZATION_IDS_HEADER = "X-Organization-Ids";

    private final WebAuthenticationDetailsSource detailsSource = new WebAuthenticationDetailsSource();

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        String principalId = request.getHeader(PRINCIPAL_ID_HEADER);
        if (principalId != null && !principalId.isBlank()) {
            try {
                GatewayPrincipal principal = new GatewayPrincipal(
                    principalId.trim(),
                    PrincipalType.valueOf(required(request, PRINCIPAL_TYPE_HEADER).trim().toUpperCase(Locale.ROOT)),
                    optionalUuid(request.getHeader(SITE_ID_HEADER)),
                    uuidList(request.getHeader(ORGANIZATION_IDS_HEADER))
                );

                PreAuthenticatedAuthenticationToken authentication = new PreAuthenticatedAuthenticationToken(
                    principal, "N/A", List.of(new SimpleGrantedAuthority("ROLE_" + principal.type().name())));
                authentication.setDetails(detailsSource.buildDetails(request));

                var securityContext = SecurityContextHolder.createEmptyContext();
                securityContext.setAuthentication(authentication);
                SecurityContextHolder.setContext(securityContext);
            } catch (IllegalArgumentException e) {
                log.warn("Rejected malformed gateway principal headers on {}: {}",
                    request.getRequestURI(), e.getMessage());
                SecurityContextHolder.clearContext();
            }
        }

        chain.doFilter(request, response);
    }

    private static String required(HttpServletRequest request, String header) {
        String value = request.getHeader(header);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("missing " + header);
        }
        return value;
    }

    private static UUID optionalUuid(String value) {
        return value == null || value.isBlank() ? null : UUID.fromString(value.trim());
    }

    private static Set<UUID> uuidList(String value) {
        if (value == null || value.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(part -> !part.isEmpty())
            .map(UUID::fromString)
            .collect(Collectors.toUnmodifiableSet());
    }
}
