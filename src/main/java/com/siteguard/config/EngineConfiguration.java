package com.siteguard.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.siteguard.domain.service.ScoringPolicy;
import com.siteguard.domain.service.SecurityScoreCalculator;
import com.siteguard.domain.service.UpdateDetector;
import com.siteguard.domain.version.ParsedVersion;
import com.siteguard.domain.version.VersionComparator;
import com.siteguard.domain.version.VersionParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Optional;

/**
 * Wires the framework-free domain services from {@link SiteGuardProperties}.
 */
@Configuration
@Slf4j
public class EngineConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Comparator backed by a bounded cache of parse results. Version strings repeat heavily
     * across sites, so most comparisons never re-run the parser.
     */
    @Bean
    public VersionComparator versionComparator(SiteGuardProperties properties) {
        long cacheSize = properties.getCatalog().getVersionCacheSize();
        if (cacheSize == 0) {
            return new VersionComparator();
        }

        LoadingCache<String, Optional<ParsedVersion>> parsedVersions = Caffeine.newBuilder()
            .maximumSize(cacheSize)
            .recordStats()
            .build(VersionParser::parse);

        log.info("Configured parsed-version cache: maximumSize={}", cacheSize);
        return new VersionComparator(parsedVersions::get);
    }

    @Bean
    public UpdateDetector updateDetector(VersionComparator versionComparator, SiteGuardProperties properties) {
        SiteGuardProperties.Detection detection = properties.getDetection();
        log.info("Update detection: branchPolicy={}, includePrereleases={}",
            detection.getBranchPolicy(), detection.isIncludePrereleases());
        return new UpdateDetector(versionComparator, detection.getBranchPolicy(), detection.isIncludePrereleases());
    }

    @Bean
    public ScoringPolicy scoringPolicy(SiteGuardProperties properties) {
        SiteGuardProperties.Scoring scoring = properties.getScoring();
        return new ScoringPolicy(scoring.getSecurityPenalty(), scoring.getUpdatePenalty());
    }

    @Bean
    public SecurityScoreCalculator securityScoreCalculator(ScoringPolicy scoringPolicy) {
        return new SecurityScoreCalculator(scoringPolicy);
    }
}
