package com.phiprotection.config;

import com.phiprotection.domain.model.RecordKind;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

/**
 * Performance Monitoring Configuration.
 *
 * Tracks:
 * - Repository latency
 * - Authorization decision latency and outcome
 * - Encryption and decryption latency (PBKDF2 dominates)
 * - Records created per kind
 *
 * Security: No sensitive data in metric names or tags.
 */
@Configuration
@Slf4j
public class PerformanceConfiguration {

    /**
     * Aspect for timing repository operations.
     */
    @Aspect
    @Component
    @Slf4j
    public static class RepositoryPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public RepositoryPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.phiprotection.domain.repository.*Repository.*(..))")
        public Object timeRepositoryMethod(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "repository.operation", "Repository operation timing",
                joinPoint, "success", "failure");
        }
    }

    /**
     * Aspect for timing authorization checks.
     */
    @Aspect
    @Component
    @Slf4j
    public static class SecurityPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public SecurityPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.phiprotection.infrastructure.security.AccessKernel.authorize*(..))")
        public Object timeSecurityCheck(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "security.authorization", "Authorization check timing",
                joinPoint, "granted", "denied");
        }
    }

    /**
     * Aspect for timing crypto operations.
     */
    @Aspect
    @Component
    @Slf4j
    public static class CryptoPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public CryptoPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.phiprotection.infrastructure.crypto.CryptoService.*(..))")
        public Object timeCryptoOperation(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "crypto.operation", "Cryptographic operation timing",
                joinPoint, "success", "failure");
        }
    }

    private static Object timed(
            MeterRegistry meterRegistry,
            String name,
            String description,
            ProceedingJoinPoint joinPoint,
            String successOutcome,
            String failureOutcome) throws Throwable {

        String methodName = joinPoint.getSignature().toShortString();
        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            Object result = joinPoint.proceed();
            sample.stop(Timer.builder(name)
                .tag("method", methodName)
                .tag("outcome", successOutcome)
                .description(description)
                .register(meterRegistry));
            return result;

        } catch (Exception e) {
            sample.stop(Timer.builder(name)
                .tag("method", methodName)
                .tag("outcome", failureOutcome)
                .description(description)
                .register(meterRegistry));
            throw e;
        }
    }

    /**
     * Custom metrics for record operations.
     */
    @Component
    @Slf4j
    public static class BusinessMetrics {

        private final MeterRegistry meterRegistry;

        public BusinessMetrics(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            log.info("Initialized business metrics");
        }

        public void recordCreated(RecordKind kind) {
            meterRegistry.counter("business.records.created", "kind", kind.name()).increment();
        }

        public void recordUpdated(RecordKind kind) {
            meterRegistry.counter("business.records.updated", "kind", kind.name()).increment();
        }

        public void recordConcurrentModification() {
            meterRegistry.counter("business.records.conflicts").increment();
        }
    }
}
