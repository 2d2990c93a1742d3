package com.siteguard.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.cache.transaction.TransactionAwareCacheManagerProxy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Caffeine-backed Spring cache.
 *
 * <p>Only immutable lookups are cached:
 * <ul>
 *   <li>{@code moduleIdsByMachineName}: machine names never change once a module exists,
 *       and misses are not cached so a freshly inserted module is found on the next lookup</li>
 * </ul>
 * Puts are deferred until the surrounding transaction commits, so an id read from a module
 * inserted by a transaction that later rolls back never reaches the cache.
 * Parsed versions live in a dedicated cache inside the comparator ({@link EngineConfiguration}).
 */
@Configuration
@EnableCaching
@Slf4j
public class CacheConfiguration {

    public static final String MODULE_IDS_BY_MACHINE_NAME = "moduleIdsByMachineName";

    @Bean
    public CacheManager cacheManager() {
        log.info("Configuring Caffeine cache");

        CaffeineCacheManager cacheManager = new CaffeineCacheManager();
        cacheManager.setCaffeine(Caffeine.newBuilder()
            .maximumSize(20_000)
            .expireAfterAccess(30, TimeUnit.MINUTES)
            .recordStats()
            .initialCapacity(1000)
        );
        cacheManager.setCacheNames(List.of(MODULE_IDS_BY_MACHINE_NAME));
        cacheManager.setAllowNullValues(false);

        return new TransactionAwareCacheManagerProxy(cacheManager);
    }
}
