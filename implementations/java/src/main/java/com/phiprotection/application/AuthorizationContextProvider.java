package com.phiprotection.application;

import com.phiprotection.config.PhiProtectionProperties;
import com.phiprotection.domain.model.PhiField;
import com.phiprotection.domain.model.SensitiveValue;
import com.phiprotection.infrastructure.security.AuthorizationContext;
import com.phiprotection.infrastructure.security.SessionTokenPayload;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * Builds and exposes the per-request {@link AuthorizationContext}.
 *
 * The context is created from a verified session payload by the authentication filter and
 * read back by controllers from Spring Security's SecurityContextHolder.
 *
 * The source IP is the servlet remote address. Forwarded headers are only honoured when the
 * container resolves them from a trusted proxy ({@code server.forward-headers-strategy}).
 */
@Component
public class AuthorizationContextProvider {

    private final Set<String> adminSubjects;

    public AuthorizationContextProvider(PhiProtectionProperties properties) {
        this.adminSubjects = Set.copyOf(properties.getAccess().getAdminSubjects());
    }

    /**
     * Get the current authorization context from Spring Security.
     */
    public AuthorizationContext getCurrentContext() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null
                || !authentication.isAuthenticated()
                || !(authentication.getPrincipal() instanceof AuthorizationContext)) {
            throw new SecurityException("No authenticated user");
        }

        return (AuthorizationContext) authentication.getPrincipal();
    }

    public AuthorizationContext fromVerifiedSession(SessionTokenPayload payload, HttpServletRequest request) {
        return AuthorizationContext.builder()
            .requestId(UUID.randomUUID())
            .subjectId(payload.subjectId())
            .displayName(SensitiveValue.of(PhiField.PREFERRED_NAME, payload.displayName()))
            .admin(adminSubjects.contains(payload.subjectId()))
            .sourceIp(request.getRemoteAddr())
            .sessionExpiresAt(Instant.ofEpochMilli(payload.expiresAt()))
            .build();
    }
}
