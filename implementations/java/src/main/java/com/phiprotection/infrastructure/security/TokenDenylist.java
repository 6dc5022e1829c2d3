package com.phiprotection.infrastructure.security;

import com.github.benmanes.caffeine.cache.Cache;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Revoked session ids, each held until the revoked token would have expired anyway.
 */
@Component
public class TokenDenylist {

    private final Cache<String, Instant> revoked;

    public TokenDenylist(@Qualifier("revokedSessionCache") Cache<String, Instant> revoked) {
        this.revoked = revoked;
    }

    public void revoke(String tokenId, Instant expiresAt) {
        revoked.put(tokenId, expiresAt);
    }

    public boolean isRevoked(String tokenId) {
        return revoked.getIfPresent(tokenId) != null;
    }
}
