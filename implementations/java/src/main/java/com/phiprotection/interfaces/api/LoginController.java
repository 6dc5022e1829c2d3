package com.phiprotection.interfaces.api;

import com.phiprotection.config.PhiProtectionProperties;
import com.phiprotection.infrastructure.audit.AuditAction;
import com.phiprotection.infrastructure.audit.AuditLogger;
import com.phiprotection.infrastructure.security.PhiAccount;
import com.phiprotection.infrastructure.security.SessionCredentialResolver;
import com.phiprotection.infrastructure.security.SessionTokenManager;
import com.phiprotection.interfaces.api.dto.ErrorResponse;
import com.phiprotection.interfaces.api.dto.LoginRequest;
import com.phiprotection.interfaces.api.dto.SessionTokenResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Exchanges account credentials for a session token.
 *
 * Security:
 * - Credentials checked by the AuthenticationManager (BCrypt hashes)
 * - Token set in an HttpOnly, Secure, SameSite=Strict cookie and returned in the body
 * - Every attempt audited; failures do not reveal whether the account exists
 */
@RestController
@Slf4j
@Tag(name = "Session", description = "Session lifecycle")
public class LoginController {

    private static final String SESSION_LABEL = "SESSION";

    private final AuthenticationManager authenticationManager;
    private final SessionTokenManager sessionTokenManager;
    private final SessionCredentialResolver credentialResolver;
    private final AuditLogger auditLogger;
    private final Duration lifetime;

    public LoginController(
            AuthenticationManager authenticationManager,
            SessionTokenManager sessionTokenManager,
            SessionCredentialResolver credentialResolver,
            AuditLogger auditLogger,
            PhiProtectionProperties properties) {
        this.authenticationManager = authenticationManager;
        this.sessionTokenManager = sessionTokenManager;
        this.credentialResolver = credentialResolver;
        this.auditLogger = auditLogger;
        this.lifetime = properties.getSession().getLifetime();
    }

    @PostMapping(
        value = "/login",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(summary = "Log in", description = "Checks the credentials and issues a new session token")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Session issued"),
        @ApiResponse(responseCode = "400", description = "Missing credentials",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "401", description = "Authentication failed",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<SessionTokenResponse> login(
            @Valid @RequestBody LoginRequest credentials,
            HttpServletRequest request) {

        String sourceIp = request.getRemoteAddr();
        Authentication authentication;
        try {
            authentication = authenticationManager.authenticate(
                UsernamePasswordAuthenticationToken.unauthenticated(credentials.getUsername(), credentials.getPassword()));
        } catch (AuthenticationException e) {
            auditLogger.logAudit(credentials.getUsername(), SESSION_LABEL, AuditAction.LOGIN, sourceIp, false,
                Map.of("reason", "Invalid credentials"));
            if (log.isWarnEnabled()) {
                log.warn("Login rejected: username={}", Encode.forJava(credentials.getUsername()));
            }
            throw e;
        }

        PhiAccount account = (PhiAccount) authentication.getPrincipal();
        String token = sessionTokenManager.createSessionToken(account.getSubjectId(), account.getDisplayName());
        Instant expiresAt = Instant.ofEpochMilli(sessionTokenManager.verifySessionToken(token).data().expiresAt());

        auditLogger.logAudit(account.getSubjectId(), SESSION_LABEL, AuditAction.LOGIN, sourceIp, true, Map.of());
        log.info("Session issued: subject={}, expiresAt={}", account.getSubjectId(), expiresAt);

        return ResponseEntity.ok()
            .header(HttpHeaders.SET_COOKIE, credentialResolver.sessionCookie(token, lifetime).toString())
            .body(SessionTokenResponse.builder().token(token).expiresAt(expiresAt).build());
    }
}
