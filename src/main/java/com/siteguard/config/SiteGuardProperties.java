package com.siteguard.config;

import com.siteguard.domain.version.BranchPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Engine settings bound from {@code siteguard.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "siteguard")
public class SiteGuardProperties {

    @Valid
    private Scoring scoring = new Scoring();

    @Valid
    private Ingestion ingestion = new Ingestion();

    @Valid
    private Detection detection = new Detection();

    @Valid
    private Catalog catalog = new Catalog();

    @Data
    public static class Scoring {

        /** Points deducted per module with a security update available. */
        @Min(0)
        @Max(100)
        private int securityPenalty = 10;

        /** Points deducted per module with only a non-security update available. */
        @Min(0)
        @Max(100)
        private int updatePenalty = 2;
    }

    @Data
    public static class Ingestion {

        /** Manifests with more module reports are rejected before any write. */
        @Min(0)
        private int maxModules = 2000;

        /** Raw request bodies above this size are rejected before parsing. */
        @Min(1)
        private int maxPayloadChars = 2_000_000;

        /** Maximum wait for the per-site lock held by a concurrent synchronization. */
        @NotNull
        private Duration lockTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Detection {

        @NotNull
        private BranchPolicy branchPolicy = BranchPolicy.SAME_BRANCH;

        /** Whether pre-release versions count as available updates. */
        private boolean includePrereleases = true;
    }

    @Data
    public static class Catalog {

        /** Insert attempts before a unique-constraint race is treated as a conflict. */
        @Min(1)
        @Max(10)
        private int maxReconcileAttempts = 3;

        /** Bound of the parsed-version cache. */
        @Min(0)
        private long versionCacheSize = 50_000;
    }
}
