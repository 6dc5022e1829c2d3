package com.phiprotection.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Binds the {@code phi.*} settings and provides the shared time source.
 */
@Configuration
@EnableConfigurationProperties(PhiProtectionProperties.class)
public class PhiProtectionConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
