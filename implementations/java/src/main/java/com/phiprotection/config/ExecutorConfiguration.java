package com.phiprotection.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bounded platform thread pools.
 *
 * The audit pool rejects work when saturated instead of running it on the caller, so
 * a stalled audit sink surfaces as a failure within the configured timeout.
 */
@Configuration
@Slf4j
public class ExecutorConfiguration {

    @Bean(name = "auditExecutor")
    public ThreadPoolTaskExecutor auditExecutor(PhiProtectionProperties properties) {
        PhiProtectionProperties.Audit audit = properties.getAudit();
        log.info("Configuring audit executor: poolSize={}, queueCapacity={}",
            audit.getPoolSize(), audit.getQueueCapacity());

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(audit.getPoolSize());
        executor.setMaxPoolSize(audit.getPoolSize() * 2);
        executor.setQueueCapacity(audit.getQueueCapacity());
        executor.setThreadNamePrefix("phi-audit-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        return executor;
    }
}
