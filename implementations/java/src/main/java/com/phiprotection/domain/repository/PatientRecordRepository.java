package com.phiprotection.domain.repository;

import com.phiprotection.domain.model.PatientRecord;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for the patient record aggregate.
 *
 * <p>Implementations only ever see the encrypted envelope. They must never decrypt,
 * and lookups are restricted to non-PHI identifiers.
 *
 * @since 1.0.0
 */
public interface PatientRecordRepository {

    /**
     * Find a record by its UUID or by its human-readable record number. An id match always
     * wins over a record number match.
     *
     * @param key Record id or record number
     * @return Record if found
     */
    Optional<PatientRecord> findByIdOrRecordNumber(String key);

    /**
     * Owner of a record, without loading the envelope.
     *
     * @param key Record id or record number
     * @return Owning subject id if the record exists
     */
    Optional<String> findOwnerId(String key);

    /**
     * Persist a new or modified record and flush immediately so that constraint and
     * version conflicts surface to the caller.
     *
     * @param record Record to save
     * @return Saved record
     */
    PatientRecord save(PatientRecord record);

    /**
     * Substring match on id and record number only.
     *
     * @param term Search term
     * @param limit Maximum number of results
     * @return Matching records, newest first
     */
    List<PatientRecord> searchByIdentifier(String term, int limit);
}
