package com.phiprotection.infrastructure.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phiprotection.infrastructure.crypto.PhiLogSanitizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OutboxAuditLoggerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private AuditEntryRepository outbox;

    private OutboxAuditLogger auditLogger;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        auditLogger = new OutboxAuditLogger(
            outbox, objectMapper, new PhiLogSanitizer(objectMapper), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void writesOneRowPerCall() {
        auditLogger.logPatientAccess("user-1", "record-1", AuditAction.VIEW_PATIENT, "10.0.0.5", true,
            Map.of("action", "Viewed patient record"));

        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(outbox).save(captor.capture());
        AuditEntry entry = captor.getValue();
        assertThat(entry.getActorId()).isEqualTo("user-1");
        assertThat(entry.getSubjectId()).isEqualTo("record-1");
        assertThat(entry.getAction()).isEqualTo(AuditAction.VIEW_PATIENT);
        assertThat(entry.isSuccess()).isTrue();
        assertThat(entry.getMetadata()).isEqualTo("{\"action\":\"Viewed patient record\"}");
        assertThat(entry.getCreatedAt()).isEqualTo(NOW);
        assertThat(entry.isProcessed()).isFalse();
    }

    @Test
    void encryptionEventsUseTheirOwnAction() {
        auditLogger.logPHIEncryption("user-1", "record-1", "10.0.0.5");

        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(outbox).save(captor.capture());
        assertThat(captor.getValue().getAction()).isEqualTo(AuditAction.ENCRYPT_DATA);
        assertThat(captor.getValue().getMetadata()).isEqualTo("{}");
    }

    @Test
    void datastoreFailurePropagatesAsSinkFailure() {
        when(outbox.save(any(AuditEntry.class))).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> auditLogger.logPHIDecryption("user-1", "record-1", "10.0.0.5"))
            .isInstanceOf(AuditSinkFailureException.class);
    }
}
