package com.phiprotection.infrastructure.persistence;

import com.phiprotection.domain.model.VisitRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for visits.
 */
@Repository
public interface SpringDataVisitRecordRepository extends JpaRepository<VisitRecord, String> {

    List<VisitRecord> findByPatientIdOrderByVisitDateDescCreatedAtDesc(String patientId);
}
