package com.phiprotection.infrastructure.audit;

import java.util.Map;

/**
 * Sink for the PHI access trail.
 *
 * <p>Every call must complete before the operation that triggered it reports success.
 * Metadata carries field names, counts and reasons, never field values.
 */
public interface AuditLogger {

    void logPatientAccess(
        String actorId,
        String subjectId,
        AuditAction action,
        String sourceIp,
        boolean success,
        Map<String, Object> metadata);

    void logPHIEncryption(String actorId, String subjectId, String sourceIp);

    void logPHIDecryption(String actorId, String subjectId, String sourceIp);

    /**
     * Generic entry for events that do not target a single record, such as searches.
     */
    void logAudit(
        String actorId,
        String subjectLabel,
        AuditAction action,
        String sourceIp,
        boolean success,
        Map<String, Object> metadata);
}
