package com.phiprotection.infrastructure.security;

import com.phiprotection.domain.model.SensitiveValue;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable authorization context for a request.
 *
 * <p>Built from a verified session token and installed as the Spring Security principal.
 * The display name is tainted so the context can be logged safely.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class AuthorizationContext {
    UUID requestId;
    String subjectId;
    SensitiveValue displayName;
    boolean admin;
    String sourceIp;
    Instant sessionExpiresAt;
}
