package com.phiprotection.application;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phiprotection.application.exceptions.ConcurrentRecordModificationException;
import com.phiprotection.application.exceptions.RecordNotFoundException;
import com.phiprotection.application.exceptions.RecordOperationException;
import com.phiprotection.config.PerformanceConfiguration.BusinessMetrics;
import com.phiprotection.domain.model.PatientRecord;
import com.phiprotection.domain.model.PhiField;
import com.phiprotection.domain.model.RecordKind;
import com.phiprotection.domain.model.VisitRecord;
import com.phiprotection.domain.repository.PatientRecordRepository;
import com.phiprotection.domain.repository.VisitRecordRepository;
import com.phiprotection.infrastructure.audit.AuditAction;
import com.phiprotection.infrastructure.audit.AuditLogger;
import com.phiprotection.infrastructure.audit.AuditSinkFailureException;
import com.phiprotection.infrastructure.crypto.AesGcmCryptoService;
import com.phiprotection.infrastructure.crypto.MasterKey;
import com.phiprotection.infrastructure.crypto.Pbkdf2KeyDerivation;
import com.phiprotection.infrastructure.crypto.PhiObjectCipher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SecurePatientServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String ACTOR = "user-1";
    private static final String IP = "10.0.0.5";

    @Mock
    private PatientRecordRepository patientRepository;

    @Mock
    private VisitRecordRepository visitRepository;

    @Mock
    private AuditLogger auditLogger;

    @Mock
    private BusinessMetrics businessMetrics;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private AesGcmCryptoService cryptoService;
    private PhiObjectCipher objectCipher;
    private SecurePatientService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        cryptoService = new AesGcmCryptoService(
            new MasterKey("service-test-master-key-0123456789abcdef"), new Pbkdf2KeyDerivation(1000, 2),
            new SimpleMeterRegistry());
        objectCipher = spy(new PhiObjectCipher(cryptoService, clock));
        service = new SecurePatientService(
            patientRepository,
            visitRepository,
            objectCipher,
            auditLogger,
            objectMapper,
            businessMetrics,
            clock);
    }

    private ObjectNode json(String text) throws Exception {
        return (ObjectNode) objectMapper.readTree(text);
    }

    private PatientRecord createAndCapture(ObjectNode payload) {
        service.createRecord(payload, ACTOR, IP);
        ArgumentCaptor<PatientRecord> captor = ArgumentCaptor.forClass(PatientRecord.class);
        verify(patientRepository).save(captor.capture());
        return captor.getValue();
    }

    @Nested
    class CreateRecord {

        @Test
        @DisplayName("SSN is stored as an envelope longer than the 64-byte header, never in plaintext")
        void storesSsnEncrypted() throws Exception {
            PatientRecord stored = createAndCapture(json(
                "{\"firstName\": \"John\", \"ssn\": \"123-45-6789\", \"bloodType\": \"O+\"}"));

            assertThat(stored.getEncryptedData()).doesNotContain("123-45-6789").doesNotContain("John");
            JsonNode envelope = objectMapper.readTree(stored.getEncryptedData());
            assertThat(Base64.getDecoder().decode(envelope.get("ssn").asText()).length).isGreaterThan(64);
            assertThat(envelope.get("bloodType").asText()).isEqualTo("O+");
            assertThat(envelope.get("_encrypted").asBoolean()).isTrue();
            assertThat(stored.getOwnerId()).isEqualTo(ACTOR);
            assertThat(stored.getCreatedAt()).isEqualTo(NOW);
        }

        @Test
        void recordNumberIsGeneratedWhenAbsentAndKeptWhenGiven() throws Exception {
            PatientRecord generated = createAndCapture(json("{\"lastName\": \"Doe\"}"));

            assertThat(generated.getRecordNumber()).matches("PT-2026-\\d{6}");
        }

        @Test
        void providedRecordNumberIsUsed() throws Exception {
            PatientRecord stored = createAndCapture(json("{\"recordNumber\": \"MRN-7\", \"lastName\": \"Doe\"}"));

            assertThat(stored.getRecordNumber()).isEqualTo("MRN-7");
        }

        @Test
        void recordNumberShapedLikeARecordIdIsRejected() {
            String foreignId = UUID.randomUUID().toString();

            assertThatThrownBy(() -> service.createRecord(
                    json("{\"recordNumber\": \"" + foreignId + "\"}"), ACTOR, IP))
                .isInstanceOf(IllegalArgumentException.class);
            verifyNoInteractions(patientRepository, auditLogger);
        }

        @Test
        void recordNumberWithWildcardsOrSpacesIsRejected() {
            assertThatThrownBy(() -> service.createRecord(json("{\"recordNumber\": \"PT 2026%\"}"), ACTOR, IP))
                .isInstanceOf(IllegalArgumentException.class);
            verifyNoInteractions(patientRepository);
        }

        @Test
        void auditsEncryptionThenAccessAndCountsTheRecord() throws Exception {
            String id = service.createRecord(json("{\"lastName\": \"Doe\"}"), ACTOR, IP);

            InOrder order = inOrder(patientRepository, auditLogger);
            order.verify(patientRepository).save(any(PatientRecord.class));
            order.verify(auditLogger).logPHIEncryption(ACTOR, id, IP);
            order.verify(auditLogger).logPatientAccess(eq(ACTOR), eq(id), eq(AuditAction.CREATE_PATIENT),
                eq(IP), eq(true), anyMap());
            verify(businessMetrics).recordCreated(RecordKind.PATIENT);
        }

        @Test
        void datastoreFailureIsAuditedAndSurfacedGenerically() throws Exception {
            when(patientRepository.save(any(PatientRecord.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

            assertThatThrownBy(() -> service.createRecord(json("{\"ssn\": \"123-45-6789\"}"), ACTOR, IP))
                .isInstanceOf(RecordOperationException.class)
                .hasMessage("Failed to create patient record");

            verify(auditLogger).logPatientAccess(eq(ACTOR), anyString(), eq(AuditAction.CREATE_PATIENT),
                eq(IP), eq(false), argThat(metadata -> metadata.containsKey("error")));
            verify(auditLogger, never()).logPHIEncryption(anyString(), anyString(), anyString());
        }

        @Test
        void auditSinkFailureRejectsTheOperation() throws Exception {
            doThrow(new AuditSinkFailureException("Audit trail unavailable", null))
                .when(auditLogger).logPHIEncryption(anyString(), anyString(), anyString());

            assertThatThrownBy(() -> service.createRecord(json("{\"lastName\": \"Doe\"}"), ACTOR, IP))
                .isInstanceOf(AuditSinkFailureException.class);
            verify(businessMetrics, never()).recordCreated(any());
        }
    }

    @Nested
    class ReadRecord {

        @Test
        void roundTripRestoresEveryField() throws Exception {
            ObjectNode payload = json("""
                {"firstName": "John", "ssn": "123-45-6789", "medications": ["metformin"], "age": 54}
                """);
            PatientRecord stored = createAndCapture(payload);
            when(patientRepository.findByIdOrRecordNumber(stored.getId())).thenReturn(Optional.of(stored));

            ObjectNode record = service.getRecord(stored.getId(), ACTOR, IP);

            assertThat(record.get("firstName").asText()).isEqualTo("John");
            assertThat(record.get("ssn").asText()).isEqualTo("123-45-6789");
            assertThat(record.at("/medications/0").asText()).isEqualTo("metformin");
            assertThat(record.get("age").asInt()).isEqualTo(54);
            assertThat(record.get("id").asText()).isEqualTo(stored.getId());
            assertThat(record.get("recordNumber").asText()).isEqualTo(stored.getRecordNumber());
            assertThat(record.has("_encrypted")).isFalse();

            verify(auditLogger).logPHIDecryption(ACTOR, stored.getId(), IP);
            verify(auditLogger).logPatientAccess(eq(ACTOR), eq(stored.getId()), eq(AuditAction.VIEW_PATIENT),
                eq(IP), eq(true), anyMap());
        }

        @Test
        void missingRecordIsNullAndAuditedAsFailure() {
            when(patientRepository.findByIdOrRecordNumber("nope")).thenReturn(Optional.empty());

            assertThat(service.getRecord("nope", ACTOR, IP)).isNull();

            verify(auditLogger).logPatientAccess(ACTOR, "nope", AuditAction.VIEW_PATIENT, IP, false,
                Map.of("reason", "Patient not found"));
            verify(auditLogger, never()).logPHIDecryption(anyString(), anyString(), anyString());
        }

        @Test
        void selectedFieldsAreTheOnlyOnesDecrypted() throws Exception {
            PatientRecord stored = createAndCapture(json("{\"firstName\": \"John\", \"ssn\": \"123-45-6789\"}"));
            when(patientRepository.findByIdOrRecordNumber(stored.getId())).thenReturn(Optional.of(stored));

            ObjectNode partial = service.getRecordFields(stored.getId(), EnumSet.of(PhiField.FIRST_NAME), ACTOR, IP);

            assertThat(partial.get("firstName").asText()).isEqualTo("John");
            assertThat(partial.get("ssn").asText()).isNotEqualTo("123-45-6789");
            verify(auditLogger).logPatientAccess(ACTOR, stored.getId(), AuditAction.VIEW_PATIENT, IP, true,
                Map.of("fieldsAccessed", List.of("firstName")));
        }
    }

    @Nested
    class UpdateRecord {

        @Test
        void mergesEncryptedChangesOverTheStoredEnvelope() throws Exception {
            PatientRecord stored = createAndCapture(json("{\"firstName\": \"John\", \"ssn\": \"123-45-6789\"}"));
            String originalNumber = stored.getRecordNumber();
            when(patientRepository.findByIdOrRecordNumber(stored.getId())).thenReturn(Optional.of(stored));

            boolean updated = service.updateRecord(stored.getId(),
                json("{\"firstName\": \"Johnny\", \"recordNumber\": \"HIJACK\", \"id\": \"other\"}"), "user-2", IP);

            assertThat(updated).isTrue();
            assertThat(stored.getEncryptedData()).doesNotContain("Johnny");
            assertThat(stored.getUpdatedBy()).isEqualTo("user-2");

            ObjectNode record = service.getRecord(stored.getId(), ACTOR, IP);
            assertThat(record.get("firstName").asText()).isEqualTo("Johnny");
            assertThat(record.get("ssn").asText()).isEqualTo("123-45-6789");
            assertThat(record.get("recordNumber").asText()).isEqualTo(originalNumber);
            assertThat(record.get("id").asText()).isEqualTo(stored.getId());
            verify(businessMetrics).recordUpdated(RecordKind.PATIENT);
        }

        @Test
        void missingRecordReturnsFalse() throws Exception {
            when(patientRepository.findByIdOrRecordNumber("nope")).thenReturn(Optional.empty());

            assertThat(service.updateRecord("nope", json("{\"firstName\": \"X\"}"), ACTOR, IP)).isFalse();
            verify(auditLogger).logPatientAccess(ACTOR, "nope", AuditAction.UPDATE_PATIENT, IP, false,
                Map.of("reason", "Patient not found"));
        }

        @Test
        void concurrentWriterIsReportedAsConflict() throws Exception {
            PatientRecord stored = PatientRecord.create("rec-1", "PT-1", ACTOR, "{\"_encrypted\":true}", NOW);
            when(patientRepository.findByIdOrRecordNumber("rec-1")).thenReturn(Optional.of(stored));
            when(patientRepository.save(stored))
                .thenThrow(new ObjectOptimisticLockingFailureException(PatientRecord.class, "rec-1"));

            assertThatThrownBy(() -> service.updateRecord("rec-1", json("{\"firstName\": \"X\"}"), ACTOR, IP))
                .isInstanceOf(ConcurrentRecordModificationException.class);
            verify(businessMetrics).recordConcurrentModification();
        }
    }

    @Nested
    class Search {

        @Test
        void returnsIdentifiersOnlyAndAuditsTheSearch() {
            String ssnBlob = cryptoService.encryptValue("123-45-6789");
            String envelope = "{\"_encrypted\":true,\"ssn\":\"" + ssnBlob + "\"}";
            PatientRecord first = PatientRecord.create("rec-1", "PT-2025-000123", ACTOR, envelope, NOW);
            PatientRecord second = PatientRecord.create("rec-2", "PT-2025-001234", "user-9", envelope, NOW);
            when(patientRepository.searchByIdentifier("PT-2025", SecurePatientService.SEARCH_LIMIT))
                .thenReturn(List.of(first, second));

            List<RecordSummary> results = service.searchRecords(" PT-2025 ", ACTOR, IP);

            assertThat(results).containsExactly(
                new RecordSummary("rec-1", "PT-2025-000123"),
                new RecordSummary("rec-2", "PT-2025-001234"));
            assertThat(results).extracting(RecordSummary::toString)
                .noneMatch(text -> text.contains("123-45-6789") || text.contains(ssnBlob));
            verifyNoInteractions(objectCipher);
            verify(auditLogger).logAudit(ACTOR, "SEARCH", AuditAction.SEARCH_PATIENT, IP, true,
                Map.of("searchTerm", "PT-2025", "resultCount", 2));
            verify(auditLogger, never()).logPHIDecryption(anyString(), anyString(), anyString());
        }

        @Test
        void blankTermIsRejected() {
            assertThatThrownBy(() -> service.searchRecords("  ", ACTOR, IP))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class Visits {

        @Test
        void createVisitForMissingPatientIsNotFound() throws Exception {
            when(patientRepository.findByIdOrRecordNumber("nope")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.createVisit("nope", json("{\"dictation\": \"x\"}"), ACTOR, IP))
                .isInstanceOf(RecordNotFoundException.class);
        }

        @Test
        void visitClinicalFieldsAreEncryptedAndReadBack() throws Exception {
            PatientRecord patient = PatientRecord.create("rec-1", "PT-1", ACTOR, "{}", NOW);
            when(patientRepository.findByIdOrRecordNumber("rec-1")).thenReturn(Optional.of(patient));

            String visitId = service.createVisit("rec-1",
                json("{\"visitDate\": \"2026-02-14\", \"dictation\": \"Chest pain since Tuesday\", \"room\": \"4\"}"),
                ACTOR, IP);

            ArgumentCaptor<VisitRecord> captor = ArgumentCaptor.forClass(VisitRecord.class);
            verify(visitRepository).save(captor.capture());
            VisitRecord visit = captor.getValue();
            assertThat(visit.getId()).isEqualTo(visitId);
            assertThat(visit.getVisitDate()).isEqualTo(LocalDate.of(2026, 2, 14));
            assertThat(visit.getEncryptedData()).doesNotContain("Chest pain");
            verify(businessMetrics).recordCreated(RecordKind.VISIT);

            when(visitRepository.findByPatientId("rec-1")).thenReturn(List.of(visit));
            List<ObjectNode> visits = service.getVisits("rec-1", ACTOR, IP);

            assertThat(visits).hasSize(1);
            assertThat(visits.get(0).get("dictation").asText()).isEqualTo("Chest pain since Tuesday");
            assertThat(visits.get(0).get("room").asText()).isEqualTo("4");
            assertThat(visits.get(0).get("patientId").asText()).isEqualTo("rec-1");
            verify(auditLogger).logPatientAccess(ACTOR, "rec-1", AuditAction.VIEW_VISIT, IP, true,
                Map.of("visitCount", 1));
        }

        @Test
        void invalidVisitDateIsRejected() throws Exception {
            PatientRecord patient = PatientRecord.create("rec-1", "PT-1", ACTOR, "{}", NOW);
            when(patientRepository.findByIdOrRecordNumber("rec-1")).thenReturn(Optional.of(patient));

            assertThatThrownBy(() -> service.createVisit("rec-1", json("{\"visitDate\": \"yesterday\"}"), ACTOR, IP))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void visitsOfMissingPatientAreEmpty() {
            when(patientRepository.findByIdOrRecordNumber("nope")).thenReturn(Optional.empty());

            assertThat(service.getVisits("nope", ACTOR, IP)).isEmpty();
        }
    }
}
