package com.phiprotection.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Caffeine cache for revoked sessions.
 *
 * Security:
 * - Keys are SHA-256 digests of token signatures, never the tokens themselves
 * - Each entry expires when the revoked token would have expired
 * - No size bound: evicting an entry early would un-revoke a live token
 * - PHI is never cached
 */
@Configuration
@Slf4j
public class CacheConfiguration {

    @Bean(name = "revokedSessionCache")
    public Cache<String, Instant> revokedSessionCache(Clock clock) {
        log.info("Configuring Caffeine revoked-session cache");

        return Caffeine.newBuilder()
            .expireAfter(new Expiry<String, Instant>() {
                @Override
                public long expireAfterCreate(String tokenId, Instant expiresAt, long currentTime) {
                    return remaining(expiresAt);
                }

                @Override
                public long expireAfterUpdate(String tokenId, Instant expiresAt, long currentTime, long currentDuration) {
                    return remaining(expiresAt);
                }

                @Override
                public long expireAfterRead(String tokenId, Instant expiresAt, long currentTime, long currentDuration) {
                    return currentDuration;
                }

                private long remaining(Instant expiresAt) {
                    Duration left = Duration.between(clock.instant(), expiresAt);
                    return left.isNegative() ? 0L : left.toNanos();
                }
            })
            .recordStats()
            .build();
    }
}
