package com.phiprotection.infrastructure.persistence;

import com.phiprotection.domain.model.PatientRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for patient records.
 *
 * Queries touch identifier columns only; the encrypted envelope is never filtered on.
 */
@Repository
public interface SpringDataPatientRecordRepository extends JpaRepository<PatientRecord, String> {

    Optional<PatientRecord> findByRecordNumber(String recordNumber);

    @Query("SELECT p.ownerId FROM PatientRecord p WHERE p.id = :id")
    Optional<String> findOwnerIdById(@Param("id") String id);

    @Query("SELECT p.ownerId FROM PatientRecord p WHERE p.recordNumber = :recordNumber")
    Optional<String> findOwnerIdByRecordNumber(@Param("recordNumber") String recordNumber);

    /**
     * Substring search on identifiers.
     *
     * @param pattern LIKE pattern, with {@code !} as the escape character
     * @param pageable Result limit
     * @return Matching records, newest first
     */
    @Query("SELECT p FROM PatientRecord p "
        + "WHERE p.id LIKE :pattern ESCAPE '!' OR p.recordNumber LIKE :pattern ESCAPE '!' "
        + "ORDER BY p.createdAt DESC")
    List<PatientRecord> searchByIdentifier(@Param("pattern") String pattern, Pageable pageable);
}
