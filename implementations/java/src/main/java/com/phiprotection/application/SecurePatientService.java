package com.phiprotection.application;

import com.fasterxml.jackson.core.JsonProcessingException;
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
import com.phiprotection.infrastructure.crypto.EncryptionFailureException;
import com.phiprotection.infrastructure.crypto.PhiObjectCipher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDate;
import java.time.Year;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Audited, encrypted access to patient and visit records.
 *
 * Every operation:
 * - encrypts sensitive fields before anything is written
 * - decrypts only after a successful read
 * - writes an audit entry for the attempt, successful or not
 * - surfaces only generic domain exceptions
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SecurePatientService {

    static final int SEARCH_LIMIT = 10;
    static final String RECORD_NUMBER_FIELD = "recordNumber";
    static final String VISIT_DATE_FIELD = "visitDate";

    private static final String NOT_FOUND_REASON = "Patient not found";
    private static final String SEARCH_LABEL = "SEARCH";

    // Record ids are UUIDs; a record number must never be mistaken for one
    private static final Pattern RECORD_NUMBER_PATTERN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_-]{0,63}");
    private static final Pattern UUID_PATTERN =
        Pattern.compile("[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    private final PatientRecordRepository patientRepository;
    private final VisitRecordRepository visitRepository;
    private final PhiObjectCipher objectCipher;
    private final AuditLogger auditLogger;
    private final ObjectMapper objectMapper;
    private final BusinessMetrics businessMetrics;
    private final Clock clock;

    private final SecureRandom secureRandom = new SecureRandom();

    /**
     * Create a patient record.
     *
     * @return Generated record id
     */
    @Transactional
    public String createRecord(ObjectNode payload, String actorId, String sourceIp) {
        Objects.requireNonNull(payload, "Payload cannot be null");

        String recordId = UUID.randomUUID().toString();
        String recordNumber = resolveRecordNumber(payload);

        try {
            ObjectNode envelope = objectCipher.encryptObject(payload, RecordKind.PATIENT.getFields());
            envelope.put(RECORD_NUMBER_FIELD, recordNumber);
            patientRepository.save(PatientRecord.create(
                recordId, recordNumber, actorId, envelope.toString(), clock.instant()));

        } catch (EncryptionFailureException | DataAccessException e) {
            log.error("Patient record creation failed: id={}, cause={}", recordId, e.getClass().getSimpleName());
            auditLogger.logPatientAccess(actorId, recordId, AuditAction.CREATE_PATIENT, sourceIp, false,
                Map.of("error", "Failed to create patient record"));
            throw new RecordOperationException("Failed to create patient record", e);
        }

        auditLogger.logPHIEncryption(actorId, recordId, sourceIp);
        auditLogger.logPatientAccess(actorId, recordId, AuditAction.CREATE_PATIENT, sourceIp, true,
            Map.of("action", "Created new patient record"));
        businessMetrics.recordCreated(RecordKind.PATIENT);

        log.info("Patient record created: id={}, recordNumber={}", recordId, recordNumber);
        return recordId;
    }

    /**
     * Read and decrypt a patient record by id or record number.
     *
     * @return Decrypted record, or {@code null} if there is none
     */
    @Transactional(readOnly = true)
    public ObjectNode getRecord(String recordId, String actorId, String sourceIp) {
        Optional<PatientRecord> found = loadRecord(recordId, actorId, sourceIp, AuditAction.VIEW_PATIENT);
        if (found.isEmpty()) {
            return null;
        }

        PatientRecord record = found.get();
        ObjectNode decrypted = objectCipher.decryptObject(readEnvelope(record), RecordKind.PATIENT.getFields());
        decorate(decrypted, record);

        auditLogger.logPHIDecryption(actorId, record.getId(), sourceIp);
        auditLogger.logPatientAccess(actorId, record.getId(), AuditAction.VIEW_PATIENT, sourceIp, true,
            Map.of("action", "Viewed patient record"));

        return decrypted;
    }

    /**
     * Minimal-exposure read: only the requested fields are decrypted, everything else stays
     * encrypted.
     */
    @Transactional(readOnly = true)
    public ObjectNode getRecordFields(String recordId, Set<PhiField> fields, String actorId, String sourceIp) {
        Optional<PatientRecord> found = loadRecord(recordId, actorId, sourceIp, AuditAction.VIEW_PATIENT);
        if (found.isEmpty()) {
            return null;
        }

        PatientRecord record = found.get();
        ObjectNode partial = objectCipher.partialDecrypt(readEnvelope(record), fields);
        decorate(partial, record);

        auditLogger.logPHIDecryption(actorId, record.getId(), sourceIp);
        auditLogger.logPatientAccess(actorId, record.getId(), AuditAction.VIEW_PATIENT, sourceIp, true,
            Map.of("fieldsAccessed", fieldNames(fields)));

        return partial;
    }

    /**
     * Encrypt the updated fields and merge them over the stored envelope.
     *
     * @return false if the record does not exist
     */
    @Transactional
    public boolean updateRecord(String recordId, ObjectNode updates, String actorId, String sourceIp) {
        Objects.requireNonNull(updates, "Updates cannot be null");

        Optional<PatientRecord> found = loadRecord(recordId, actorId, sourceIp, AuditAction.UPDATE_PATIENT);
        if (found.isEmpty()) {
            return false;
        }

        PatientRecord record = found.get();
        ObjectNode changes = updates.deepCopy();
        changes.remove("id");
        changes.remove(RECORD_NUMBER_FIELD);
        List<String> updatedFields = new ArrayList<>();
        changes.fieldNames().forEachRemaining(updatedFields::add);

        try {
            ObjectNode envelope = readEnvelope(record);
            envelope.setAll(objectCipher.encryptObject(changes, RecordKind.PATIENT.getFields()));
            record.replaceEnvelope(envelope.toString(), actorId, clock.instant());
            patientRepository.save(record);

        } catch (ObjectOptimisticLockingFailureException e) {
            businessMetrics.recordConcurrentModification();
            log.warn("Concurrent modification of patient record: id={}", record.getId());
            auditLogger.logPatientAccess(actorId, record.getId(), AuditAction.UPDATE_PATIENT, sourceIp, false,
                Map.of("error", "Concurrent modification"));
            throw new ConcurrentRecordModificationException("Patient record was modified concurrently", e);

        } catch (EncryptionFailureException | DataAccessException e) {
            log.error("Patient record update failed: id={}, cause={}", record.getId(), e.getClass().getSimpleName());
            auditLogger.logPatientAccess(actorId, record.getId(), AuditAction.UPDATE_PATIENT, sourceIp, false,
                Map.of("error", "Failed to update patient record"));
            throw new RecordOperationException("Failed to update patient record", e);
        }

        auditLogger.logPHIEncryption(actorId, record.getId(), sourceIp);
        auditLogger.logPatientAccess(actorId, record.getId(), AuditAction.UPDATE_PATIENT, sourceIp, true,
            Map.of("fieldsUpdated", updatedFields));
        businessMetrics.recordUpdated(RecordKind.PATIENT);

        return true;
    }

    /**
     * Substring search over record ids and record numbers. Nothing is decrypted.
     */
    @Transactional(readOnly = true)
    public List<RecordSummary> searchRecords(String term, String actorId, String sourceIp) {
        if (term == null || term.isBlank()) {
            throw new IllegalArgumentException("Search term must not be blank");
        }
        String normalized = term.trim();

        List<PatientRecord> matches;
        try {
            matches = patientRepository.searchByIdentifier(normalized, SEARCH_LIMIT);
        } catch (DataAccessException e) {
            log.error("Patient search failed: cause={}", e.getClass().getSimpleName());
            auditLogger.logAudit(actorId, SEARCH_LABEL, AuditAction.SEARCH_PATIENT, sourceIp, false,
                Map.of("searchTerm", normalized, "error", "Search failed"));
            throw new RecordOperationException("Failed to search patient records", e);
        }

        List<RecordSummary> results = matches.stream()
            .map(record -> new RecordSummary(record.getId(), record.getRecordNumber()))
            .collect(Collectors.toList());

        auditLogger.logAudit(actorId, SEARCH_LABEL, AuditAction.SEARCH_PATIENT, sourceIp, true,
            Map.of("searchTerm", normalized, "resultCount", results.size()));

        return results;
    }

    /**
     * Owner of a record, for the ownership check. Reads no PHI.
     */
    @Transactional(readOnly = true)
    public Optional<String> findOwnerId(String recordId) {
        return patientRepository.findOwnerId(recordId);
    }

    /**
     * Record a visit for an existing patient.
     *
     * @return Generated visit id
     * @throws RecordNotFoundException if the patient does not exist
     */
    @Transactional
    public String createVisit(String patientId, ObjectNode payload, String actorId, String sourceIp) {
        Objects.requireNonNull(payload, "Payload cannot be null");

        Optional<PatientRecord> patient = loadRecord(patientId, actorId, sourceIp, AuditAction.CREATE_VISIT);
        if (patient.isEmpty()) {
            throw new RecordNotFoundException(NOT_FOUND_REASON);
        }

        String ownerRecordId = patient.get().getId();
        String visitId = UUID.randomUUID().toString();
        LocalDate visitDate = resolveVisitDate(payload);

        try {
            ObjectNode envelope = objectCipher.encryptObject(payload, RecordKind.VISIT.getFields());
            visitRepository.save(VisitRecord.create(
                visitId, ownerRecordId, visitDate, envelope.toString(), actorId, clock.instant()));

        } catch (EncryptionFailureException | DataAccessException e) {
            log.error("Visit creation failed: patientId={}, cause={}", ownerRecordId, e.getClass().getSimpleName());
            auditLogger.logPatientAccess(actorId, ownerRecordId, AuditAction.CREATE_VISIT, sourceIp, false,
                Map.of("error", "Failed to create visit"));
            throw new RecordOperationException("Failed to create visit", e);
        }

        auditLogger.logPHIEncryption(actorId, ownerRecordId, sourceIp);
        auditLogger.logPatientAccess(actorId, ownerRecordId, AuditAction.CREATE_VISIT, sourceIp, true,
            Map.of("visitId", visitId, "visitDate", visitDate.toString()));
        businessMetrics.recordCreated(RecordKind.VISIT);

        return visitId;
    }

    /**
     * Decrypted visits of a patient, newest first. Empty if the patient does not exist.
     */
    @Transactional(readOnly = true)
    public List<ObjectNode> getVisits(String patientId, String actorId, String sourceIp) {
        Optional<PatientRecord> patient = loadRecord(patientId, actorId, sourceIp, AuditAction.VIEW_VISIT);
        if (patient.isEmpty()) {
            return List.of();
        }

        String ownerRecordId = patient.get().getId();
        List<VisitRecord> visits;
        try {
            visits = visitRepository.findByPatientId(ownerRecordId);
        } catch (DataAccessException e) {
            log.error("Visit lookup failed: patientId={}, cause={}", ownerRecordId, e.getClass().getSimpleName());
            auditLogger.logPatientAccess(actorId, ownerRecordId, AuditAction.VIEW_VISIT, sourceIp, false,
                Map.of("error", "Failed to retrieve visits"));
            throw new RecordOperationException("Failed to retrieve visits", e);
        }

        List<ObjectNode> decrypted = new ArrayList<>(visits.size());
        for (VisitRecord visit : visits) {
            ObjectNode node = objectCipher.decryptObject(parseEnvelope(visit.getEncryptedData()), RecordKind.VISIT.getFields());
            node.put("id", visit.getId());
            node.put("patientId", visit.getPatientId());
            node.put(VISIT_DATE_FIELD, visit.getVisitDate().toString());
            node.put("createdAt", visit.getCreatedAt().toString());
            decrypted.add(node);
        }

        if (!decrypted.isEmpty()) {
            auditLogger.logPHIDecryption(actorId, ownerRecordId, sourceIp);
        }
        auditLogger.logPatientAccess(actorId, ownerRecordId, AuditAction.VIEW_VISIT, sourceIp, true,
            Map.of("visitCount", decrypted.size()));

        return decrypted;
    }

    private Optional<PatientRecord> loadRecord(String recordId, String actorId, String sourceIp, AuditAction action) {
        Optional<PatientRecord> found;
        try {
            found = patientRepository.findByIdOrRecordNumber(recordId);
        } catch (DataAccessException e) {
            log.error("Patient record lookup failed: cause={}", e.getClass().getSimpleName());
            auditLogger.logPatientAccess(actorId, recordId, action, sourceIp, false,
                Map.of("error", "Failed to retrieve patient record"));
            throw new RecordOperationException("Failed to retrieve patient record", e);
        }

        if (found.isEmpty()) {
            auditLogger.logPatientAccess(actorId, recordId, action, sourceIp, false,
                Map.of("reason", NOT_FOUND_REASON));
        }
        return found;
    }

    private ObjectNode readEnvelope(PatientRecord record) {
        return parseEnvelope(record.getEncryptedData());
    }

    private ObjectNode parseEnvelope(String stored) {
        try {
            JsonNode node = objectMapper.readTree(stored);
            if (node == null || !node.isObject()) {
                throw new RecordOperationException("Stored record is unreadable", null);
            }
            return (ObjectNode) node;
        } catch (JsonProcessingException e) {
            throw new RecordOperationException("Stored record is unreadable", e);
        }
    }

    private static void decorate(ObjectNode node, PatientRecord record) {
        node.put("id", record.getId());
        node.put(RECORD_NUMBER_FIELD, record.getRecordNumber());
        node.put("createdAt", record.getCreatedAt().toString());
        node.put("updatedAt", record.getUpdatedAt().toString());
    }

    private String resolveRecordNumber(ObjectNode payload) {
        JsonNode provided = payload.get(RECORD_NUMBER_FIELD);
        if (provided != null && provided.isTextual() && !provided.textValue().isBlank()) {
            String recordNumber = provided.textValue().trim();
            if (!RECORD_NUMBER_PATTERN.matcher(recordNumber).matches()
                    || UUID_PATTERN.matcher(recordNumber).matches()) {
                throw new IllegalArgumentException(
                    "recordNumber must be 1-64 letters, digits, '-' or '_' and must not look like a record id");
            }
            return recordNumber;
        }
        return String.format("PT-%d-%06d", Year.now(clock).getValue(), secureRandom.nextInt(1_000_000));
    }

    private LocalDate resolveVisitDate(ObjectNode payload) {
        JsonNode provided = payload.get(VISIT_DATE_FIELD);
        if (provided == null || provided.isNull()) {
            return LocalDate.now(clock);
        }
        try {
            return LocalDate.parse(provided.asText());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("visitDate must be an ISO-8601 date");
        }
    }

    private static List<String> fieldNames(Set<PhiField> fields) {
        return fields.stream().map(PhiField::getJsonName).sorted().collect(Collectors.toList());
    }
}
