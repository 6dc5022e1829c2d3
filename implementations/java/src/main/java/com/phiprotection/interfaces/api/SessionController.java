package com.phiprotection.interfaces.api;

import com.phiprotection.application.AuthorizationContextProvider;
import com.phiprotection.config.OpenApiConfiguration;
import com.phiprotection.config.PhiProtectionProperties;
import com.phiprotection.infrastructure.audit.AuditAction;
import com.phiprotection.infrastructure.audit.AuditLogger;
import com.phiprotection.infrastructure.security.AuthorizationContext;
import com.phiprotection.infrastructure.security.SessionCredentialResolver;
import com.phiprotection.infrastructure.security.SessionTokenManager;
import com.phiprotection.infrastructure.security.TokenVerification;
import com.phiprotection.interfaces.api.dto.SessionResponse;
import com.phiprotection.interfaces.api.dto.SessionTokenResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * The caller's own session: inspect, extend, log out.
 */
@RestController
@RequestMapping("/api/session")
@Slf4j
@Tag(name = "Session", description = "Session lifecycle")
@SecurityRequirement(name = OpenApiConfiguration.SESSION_SCHEME)
public class SessionController {

    private static final String SESSION_LABEL = "SESSION";

    private final SessionTokenManager sessionTokenManager;
    private final SessionCredentialResolver credentialResolver;
    private final AuthorizationContextProvider contextProvider;
    private final AuditLogger auditLogger;
    private final Duration lifetime;

    public SessionController(
            SessionTokenManager sessionTokenManager,
            SessionCredentialResolver credentialResolver,
            AuthorizationContextProvider contextProvider,
            AuditLogger auditLogger,
            PhiProtectionProperties properties) {
        this.sessionTokenManager = sessionTokenManager;
        this.credentialResolver = credentialResolver;
        this.contextProvider = contextProvider;
        this.auditLogger = auditLogger;
        this.lifetime = properties.getSession().getLifetime();
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Current session")
    public ResponseEntity<SessionResponse> currentSession() {
        AuthorizationContext context = contextProvider.getCurrentContext();

        return ResponseEntity.ok(SessionResponse.builder()
            .subjectId(context.getSubjectId())
            .displayName(context.getDisplayName().reveal("session-display"))
            .admin(context.isAdmin())
            .expiresAt(context.getSessionExpiresAt())
            .build());
    }

    @PostMapping(value = "/extend", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "Extend session",
        description = "Issues a new token with a fresh expiry; the presented token stays valid until its own expiry"
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "New token issued"),
        @ApiResponse(responseCode = "401", description = "Presented token is not valid")
    })
    public ResponseEntity<SessionTokenResponse> extendSession(HttpServletRequest request) {
        AuthorizationContext context = contextProvider.getCurrentContext();

        String extended = credentialResolver.resolve(request)
            .flatMap(sessionTokenManager::extendSession)
            .orElseThrow(() -> new SecurityException("Session could not be extended"));

        TokenVerification verification = sessionTokenManager.verifySessionToken(extended);
        Instant expiresAt = Instant.ofEpochMilli(verification.data().expiresAt());

        log.info("Session extended: subject={}, expiresAt={}", context.getSubjectId(), expiresAt);

        return ResponseEntity.ok()
            .header(HttpHeaders.SET_COOKIE, credentialResolver.sessionCookie(extended, lifetime).toString())
            .body(SessionTokenResponse.builder().token(extended).expiresAt(expiresAt).build());
    }

    @PostMapping("/logout")
    @Operation(summary = "Log out", description = "Revokes the presented token and clears the session cookie")
    @ApiResponses({
        @ApiResponse(responseCode = "204", description = "Session revoked")
    })
    public ResponseEntity<Void> logout(HttpServletRequest request) {
        AuthorizationContext context = contextProvider.getCurrentContext();

        boolean revoked = credentialResolver.resolve(request)
            .map(sessionTokenManager::revokeSession)
            .orElse(false);

        auditLogger.logAudit(context.getSubjectId(), SESSION_LABEL, AuditAction.LOGOUT,
            context.getSourceIp(), revoked, Map.of("requestId", context.getRequestId().toString()));

        return ResponseEntity.noContent()
            .header(HttpHeaders.SET_COOKIE, credentialResolver.sessionCookie("", Duration.ZERO).toString())
            .build();
    }
}
