package com.phiprotection.config;

import com.phiprotection.infrastructure.audit.AuditLogger;
import com.phiprotection.infrastructure.audit.GuardedAuditLogger;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the audit sink behind the timeout and failure-policy guard.
 * Everything that injects {@link AuditLogger} receives the guarded instance.
 */
@Configuration
@Slf4j
public class AuditConfiguration {

    @Bean
    @Primary
    public AuditLogger auditLogger(
            @Qualifier("outboxAuditLogger") AuditLogger outboxAuditLogger,
            @Qualifier("auditExecutor") ThreadPoolTaskExecutor auditExecutor,
            PhiProtectionProperties properties,
            MeterRegistry meterRegistry) {

        PhiProtectionProperties.Audit audit = properties.getAudit();
        log.info("Audit trail guarded: policy={}, timeout={}", audit.getFailurePolicy(), audit.getTimeout());

        return new GuardedAuditLogger(
            outboxAuditLogger,
            auditExecutor,
            audit.getTimeout(),
            audit.getFailurePolicy(),
            meterRegistry);
    }
}
