package com.siteguard;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main application class for the SiteGuard backend.
 *
 * <p>Sites push manifests of their installed modules; the backend keeps a shared catalog of
 * modules and versions, works out which sites have updates (and security updates) available,
 * and scores each site's security posture.
 *
 * <p><strong>Architecture:</strong>
 * <ul>
 *   <li>Hexagonal architecture (ports and adapters)</li>
 *   <li>Framework-free domain: version ordering, update detection, scoring</li>
 *   <li>One transaction per synchronization, serialized per site by a row lock</li>
 *   <li>Separate audit transaction so every submission leaves a trace</li>
 * </ul>
 *
 * <p><strong>Deployment:</strong>
 * <ul>
 *   <li>PostgreSQL 15+</li>
 *   <li>Behind an identity gateway that forwards the authenticated principal as headers</li>
 * </ul>
 */
@SpringBootApplication
@EnableTransactionManagement
@EnableAspectJAutoProxy
@ConfigurationPropertiesScan
@Slf4j
public class SiteGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(SiteGuardApplication.class, args);
        log.info("SiteGuard backend started");
    }
}
