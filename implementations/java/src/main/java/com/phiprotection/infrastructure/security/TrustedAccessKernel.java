package com.phiprotection.infrastructure.security;

import com.phiprotection.infrastructure.audit.AuditAction;
import com.phiprotection.infrastructure.audit.AuditLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;

/**
 * Trusted Access Kernel - enforcement point for subject-scoped data.
 *
 * Decision table:
 * 1. Caller id equals the resource owner id: allow
 * 2. Different ids, caller is an admin: allow
 * 3. Different ids, caller is not an admin: deny with no detail about the other subject
 *
 * Every decision is logged; denials are also written to the audit trail.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrustedAccessKernel implements AccessKernel {

    private static final String ACCESS_CONTROL_LABEL = "ACCESS_CONTROL";

    private final AuditLogger auditLogger;

    @Override
    public void authorizeSubjectAccess(AuthorizationContext context, String resourceOwnerId) {
        UUID requestId = context != null && context.getRequestId() != null
            ? context.getRequestId()
            : UUID.randomUUID();

        if (context == null || context.getSubjectId() == null) {
            log.warn("AUTHORIZATION DENIED [{}]: no authenticated subject, operation=SUBJECT_ACCESS", requestId);
            throw new AccessDeniedException("Access denied");
        }

        log.debug("Authorization check [{}]: principal={}, operation=SUBJECT_ACCESS",
            requestId, context.getSubjectId());

        if (context.getSubjectId().equals(resourceOwnerId)) {
            log.info("AUTHORIZATION GRANTED [{}]: principal={}, operation=SUBJECT_ACCESS, basis=OWNER",
                requestId, context.getSubjectId());
            return;
        }

        if (context.isAdmin()) {
            log.info("AUTHORIZATION GRANTED [{}]: principal={}, operation=SUBJECT_ACCESS, basis=ADMIN",
                requestId, context.getSubjectId());
            return;
        }

        log.warn("AUTHORIZATION DENIED [{}]: principal={}, operation=SUBJECT_ACCESS, reason=NOT_OWNER",
            requestId, context.getSubjectId());

        auditAuthorizationDenial(context, requestId);

        throw new AccessDeniedException("Access denied");
    }

    /**
     * Audit authorization denial (critical for security monitoring).
     */
    private void auditAuthorizationDenial(AuthorizationContext context, UUID requestId) {
        auditLogger.logAudit(
            context.getSubjectId(),
            ACCESS_CONTROL_LABEL,
            AuditAction.PERMISSION_DENIED,
            context.getSourceIp(),
            false,
            Map.of("reason", "NOT_OWNER", "requestId", requestId.toString()));
    }

    /**
     * Exception thrown when authorization fails.
     */
    public static class AccessDeniedException extends RuntimeException {
        public AccessDeniedException(String message) {
            super(message);
        }
    }
}
