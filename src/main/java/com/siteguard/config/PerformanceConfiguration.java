package com.siteguard.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

/**
 * Performance monitoring.
 *
 * <p>Tracks:
 * <ul>
 *   <li>Persistence adapter latency</li>
 *   <li>Authorization check latency and outcome</li>
 *   <li>End-to-end synchronization latency</li>
 *   <li>Submission outcomes and applied security patches</li>
 * </ul>
 *
 * No site URLs, module names or payload content end up in metric tags.
 */
@Configuration
@Slf4j
public class PerformanceConfiguration {

    static Object timed(MeterRegistry meterRegistry, String metric, String description,
                        String successOutcome, String failureOutcome,
                        ProceedingJoinPoint joinPoint) throws Throwable {
        String methodName = joinPoint.getSignature().toShortString();
        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            Object result = joinPoint.proceed();
            sample.stop(Timer.builder(metric)
                .tag("method", methodName)
                .tag("outcome", successOutcome)
                .description(description)
                .register(meterRegistry));
            return result;

        } catch (Exception e) {
            sample.stop(Timer.builder(metric)
                .tag("method", methodName)
                .tag("outcome", failureOutcome)
                .description(description)
                .register(meterRegistry));
            throw e;
        }
    }

    /**
     * Aspect for timing persistence adapter operations.
     */
    @Aspect
    @Component
    public static class RepositoryPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public RepositoryPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.siteguard.infrastructure.persistence.*Adapter.*(..))")
        public Object timeRepositoryMethod(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "repository.operation", "Repository operation timing",
                "success", "failure", joinPoint);
        }
    }

    /**
     * Aspect for timing authorization checks.
     */
    @Aspect
    @Component
    public static class SecurityPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public SecurityPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.siteguard.infrastructure.security.SecurityKernel.authorize*(..))")
        public Object timeSecurityCheck(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "security.authorization", "Authorization check timing",
                "granted", "denied", joinPoint);
        }
    }

    @Aspect
    @Component
    public static class SynchronizationPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public SynchronizationPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.siteguard.application.SiteSynchronizationService.synchronize(..)) "
            + "|| execution(* com.siteguard.application.CatalogReleasePublisher.publish(..))")
        public Object timeSynchronization(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "synchronization.operation", "Synchronization timing",
                "success", "failure", joinPoint);
        }
    }

    /**
     * Custom metrics for ingestion outcomes.
     */
    @Component
    @Slf4j
    public static class BusinessMetrics {

        private final MeterRegistry meterRegistry;

        public BusinessMetrics(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            log.info("Initialized business metrics");
        }

        /**
         * Record a submission outcome, e.g. {@code MANIFEST}/{@code SUCCESS}.
         */
        public void recordSubmission(String submissionType, String status) {
            meterRegistry.counter("business.submissions",
                "type", submissionType, "status", status).increment();
        }

        public void recordPatchRun(int modulesUpdated, int securityPatchesApplied) {
            meterRegistry.counter("business.patch_runs").increment();
            if (modulesUpdated > 0) {
                meterRegistry.counter("business.modules.updated").increment(modulesUpdated);
            }
            if (securityPatchesApplied > 0) {
                meterRegistry.counter("business.security_patches.applied").increment(securityPatchesApplied);
            }
        }
    }
}
