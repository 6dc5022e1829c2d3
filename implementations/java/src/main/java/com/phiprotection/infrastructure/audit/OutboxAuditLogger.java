package com.phiprotection.infrastructure.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phiprotection.infrastructure.crypto.PhiLogSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;

/**
 * Writes audit entries to the append-only outbox table.
 *
 * Failures propagate as {@link AuditSinkFailureException}; whether they reject the PHI
 * operation is decided by {@link GuardedAuditLogger}.
 */
@Service("outboxAuditLogger")
@Slf4j
@RequiredArgsConstructor
public class OutboxAuditLogger implements AuditLogger {

    private static final String SYSTEM_ACTOR = "system";

    private final AuditEntryRepository outbox;
    private final ObjectMapper objectMapper;
    private final PhiLogSanitizer sanitizer;
    private final Clock clock;

    @Override
    public void logPatientAccess(
            String actorId,
            String subjectId,
            AuditAction action,
            String sourceIp,
            boolean success,
            Map<String, Object> metadata) {
        record(actorId, subjectId, action, sourceIp, success, metadata);
    }

    @Override
    public void logPHIEncryption(String actorId, String subjectId, String sourceIp) {
        record(actorId, subjectId, AuditAction.ENCRYPT_DATA, sourceIp, true, Map.of());
    }

    @Override
    public void logPHIDecryption(String actorId, String subjectId, String sourceIp) {
        record(actorId, subjectId, AuditAction.DECRYPT_DATA, sourceIp, true, Map.of());
    }

    @Override
    public void logAudit(
            String actorId,
            String subjectLabel,
            AuditAction action,
            String sourceIp,
            boolean success,
            Map<String, Object> metadata) {
        record(actorId, subjectLabel, action, sourceIp, success, metadata);
    }

    private void record(
            String actorId,
            String subjectId,
            AuditAction action,
            String sourceIp,
            boolean success,
            Map<String, Object> metadata) {

        Map<String, Object> detail = metadata == null ? Map.of() : metadata;

        log.info("AUDIT action={} subject={} actor={} success={} detail={}",
            action, Encode.forJava(subjectId), Encode.forJava(actorId), success, sanitizer.describe(detail));

        try {
            AuditEntry entry = AuditEntry.builder()
                .actorId(actorId == null ? SYSTEM_ACTOR : actorId)
                .subjectId(subjectId)
                .action(action)
                .sourceIp(sourceIp)
                .success(success)
                .metadata(objectMapper.writeValueAsString(detail))
                .createdAt(clock.instant())
                .processed(false)
                .build();
            outbox.save(entry);
        } catch (JsonProcessingException | DataAccessException e) {
            log.error("Audit outbox write failed: action={}, cause={}", action, e.getClass().getSimpleName());
            throw new AuditSinkFailureException("Audit entry could not be persisted", e);
        }
    }
}
