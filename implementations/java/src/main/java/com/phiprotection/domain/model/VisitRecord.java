package com.phiprotection.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One encounter for a patient. Visit notes are encrypted with the {@link RecordKind#VISIT} field set.
 * Visits are append-only.
 */
@Entity
@Table(name = "visit_records")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
public class VisitRecord {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "patient_id", nullable = false, updatable = false, length = 36)
    private String patientId;

    @Column(name = "visit_date", nullable = false, updatable = false)
    private LocalDate visitDate;

    @Column(name = "encrypted_data", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String encryptedData;

    @Column(name = "created_by", nullable = false, updatable = false)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static VisitRecord create(
            String id,
            String patientId,
            LocalDate visitDate,
            String encryptedData,
            String createdBy,
            Instant createdAt) {
        VisitRecord visit = new VisitRecord();
        visit.id = Objects.requireNonNull(id, "Visit id cannot be null");
        visit.patientId = Objects.requireNonNull(patientId, "Patient id cannot be null");
        visit.visitDate = Objects.requireNonNull(visitDate, "Visit date cannot be null");
        visit.encryptedData = Objects.requireNonNull(encryptedData, "Encrypted data cannot be null");
        visit.createdBy = Objects.requireNonNull(createdBy, "Creator cannot be null");
        visit.createdAt = createdAt;
        return visit;
    }

    @Override
    public String toString() {
        return "VisitRecord{id=" + id + ", patientId=" + patientId + ", visitDate=" + visitDate + "}";
    }
}
