package com.siteguard.config;

import com.siteguard.infrastructure.security.GatewayPrincipalFilter;
import com.siteguard.infrastructure.security.PrincipalType;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.preauth.AbstractPreAuthenticatedProcessingFilter;

/**
 * Spring Security configuration.
 *
 * <p>Authentication happens upstream: the identity gateway forwards the authenticated
 * principal as headers, which {@link GatewayPrincipalFilter} turns into an
 * {@code Authentication}. Coarse rules live here; per-site decisions are made by
 * the {@code SecurityKernel} inside the application services.
 * <ul>
 *   <li>Stateless, no CSRF (machine clients only)</li>
 *   <li>Catalog publication restricted to the catalog feed principal</li>
 *   <li>Everything else under {@code /api} requires an authenticated principal</li>
 * </ul>
 */
@Configuration
@EnableWebSecurity
public class SecurityConfiguration {

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            .csrf(csrf -> csrf.disable())

            .sessionManagement(session ->
                session.sessionCreationPolicy(SessionCreationPolicy.STATELESS)
            )

            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/actuator/health", "/actuator/info").permitAll()
                .requestMatchers("/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html").permitAll()

                .requestMatchers(HttpMethod.POST, "/api/v1/catalog/**").hasRole(PrincipalType.CATALOG_FEED.name())
                .requestMatchers("/api/**").authenticated()

                .anyRequest().denyAll()
            )

            .addFilterBefore(new GatewayPrincipalFilter(), AbstractPreAuthenticatedProcessingFilter.class)

            .exceptionHandling(exceptions -> exceptions
                .authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED))
            )

            .headers(headers -> headers
                .contentSecurityPolicy(csp ->
                    csp.policyDirectives("default-src 'self'; frame-ancestors 'none'")
                )
                .frameOptions(frame -> frame.deny())
                .httpStrictTransportSecurity(hsts -> hsts
                    .includeSubDomains(true)
                    .maxAgeInSeconds(31536000)
                )
            );

        return http.build();
    }
}
