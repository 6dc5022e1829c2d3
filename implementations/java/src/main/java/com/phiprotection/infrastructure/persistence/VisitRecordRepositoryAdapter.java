package com.phiprotection.infrastructure.persistence;

import com.phiprotection.domain.model.VisitRecord;
import com.phiprotection.domain.repository.VisitRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Adapter implementing domain VisitRecordRepository using Spring Data JPA.
 */
@Component
@Transactional
@RequiredArgsConstructor
@Slf4j
public class VisitRecordRepositoryAdapter implements VisitRecordRepository {

    private final SpringDataVisitRecordRepository springDataRepository;

    @Override
    public VisitRecord save(VisitRecord visit) {
        VisitRecord saved = springDataRepository.saveAndFlush(visit);

        if (log.isInfoEnabled()) {
            log.info("Visit persisted: id={}, patientId={}", saved.getId(), saved.getPatientId());
        }

        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public List<VisitRecord> findByPatientId(String patientId) {
        return springDataRepository.findByPatientIdOrderByVisitDateDescCreatedAtDesc(patientId);
    }
}
