package com.phiprotection.domain.repository;

import com.phiprotection.domain.model.VisitRecord;

import java.util.List;

/**
 * Repository interface for patient visits.
 */
public interface VisitRecordRepository {

    VisitRecord save(VisitRecord visit);

    /**
     * Visits of one patient, most recent visit date first.
     */
    List<VisitRecord> findByPatientId(String patientId);
}
