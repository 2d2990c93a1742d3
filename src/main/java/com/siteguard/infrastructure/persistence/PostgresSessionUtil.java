package com.siteguard.infrastructure.persistence;

import jakarta.persistence.EntityManager;

import java.time.Duration;

/**
 * Utility for applying PostgreSQL transaction-local session settings consistently across
 * repositories.
 */
public final class PostgresSessionUtil {

    private PostgresSessionUtil() {}

    /**
     * Bound how long statements of the current transaction wait for row locks.
     *
     * <p>{@code SET LOCAL} does not accept bind parameters, so the transaction-local form of
     * {@code set_config} is used instead.
     */
    public static void applyLockTimeout(EntityManager entityManager, Duration timeout) {
        entityManager.createNativeQuery("SELECT set_config('lock_timeout', :timeout, true)")
            .setParameter("timeout", timeout.toMillis() + "ms")
            .getSingleResult();
    }
}
