package com.phiprotection.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Objects;

/**
 * Patient aggregate as stored: non-PHI identifiers in columns, everything else inside an
 * opaque JSON envelope whose sensitive fields are individually encrypted.
 *
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>{@code encryptedData} never holds a plaintext taxonomy field</li>
 *   <li>{@code ownerId} is the subject that created the record and never changes</li>
 *   <li>Concurrent writers are detected through {@code version}</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Entity
@Table(name = "patient_records")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
public class PatientRecord {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "record_number", nullable = false, unique = true, updatable = false, length = 64)
    private String recordNumber;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private String ownerId;

    @Column(name = "encrypted_data", nullable = false, columnDefinition = "TEXT")
    private String encryptedData;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "updated_by", nullable = false)
    private String updatedBy;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    private PatientRecord(String id, String recordNumber, String ownerId, String encryptedData, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "Record id cannot be null");
        this.recordNumber = Objects.requireNonNull(recordNumber, "Record number cannot be null");
        this.ownerId = Objects.requireNonNull(ownerId, "Owner id cannot be null");
        this.encryptedData = Objects.requireNonNull(encryptedData, "Encrypted data cannot be null");
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.updatedBy = ownerId;
        // version is managed by JPA - leave it null for new entities
    }

    public static PatientRecord create(
            String id,
            String recordNumber,
            String ownerId,
            String encryptedData,
            Instant createdAt) {
        return new PatientRecord(id, recordNumber, ownerId, encryptedData, createdAt);
    }

    /**
     * Replace the stored envelope after a merge of encrypted updates.
     */
    public void replaceEnvelope(String encryptedData, String updatedBy, Instant updatedAt) {
        this.encryptedData = Objects.requireNonNull(encryptedData, "Encrypted data cannot be null");
        this.updatedBy = Objects.requireNonNull(updatedBy, "Updater cannot be null");
        this.updatedAt = updatedAt;
    }

    @Override
    public String toString() {
        return "PatientRecord{id=" + id + ", recordNumber=" + recordNumber + ", version=" + version + "}";
    }
}
