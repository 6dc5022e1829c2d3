package com.phiprotection.infrastructure.persistence;

import com.phiprotection.domain.model.PatientRecord;
import com.phiprotection.domain.repository.PatientRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Adapter implementing domain PatientRecordRepository using Spring Data JPA.
 *
 * Responsibilities:
 * - Translate domain repository interface to Spring Data JPA
 * - Resolve keys by id first, record number second, so a lookup never matches two rows
 * - Flush writes immediately so version conflicts reach the service
 * - Escape LIKE wildcards in search terms
 * - Log identifiers only, never envelope content
 */
@Component
@Transactional
@RequiredArgsConstructor
@Slf4j
public class PatientRecordRepositoryAdapter implements PatientRecordRepository {

    private static final char LIKE_ESCAPE = '!';

    private final SpringDataPatientRecordRepository springDataRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<PatientRecord> findByIdOrRecordNumber(String key) {
        Optional<PatientRecord> result = springDataRepository.findById(key)
            .or(() -> springDataRepository.findByRecordNumber(key));

        if (result.isPresent()) {
            log.debug("Patient record retrieved: id={}", result.get().getId());
        } else {
            log.debug("Patient record not found: key={}", Encode.forJava(key));
        }

        return result;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> findOwnerId(String key) {
        return springDataRepository.findOwnerIdById(key)
            .or(() -> springDataRepository.findOwnerIdByRecordNumber(key));
    }

    @Override
    public PatientRecord save(PatientRecord record) {
        PatientRecord saved = springDataRepository.saveAndFlush(record);

        if (log.isInfoEnabled()) {
            log.info("Patient record persisted: id={}, version={}", saved.getId(), saved.getVersion());
        }

        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public List<PatientRecord> searchByIdentifier(String term, int limit) {
        String pattern = "%" + escapeLike(term) + "%";
        return springDataRepository.searchByIdentifier(pattern, PageRequest.of(0, limit));
    }

    static String escapeLike(String term) {
        StringBuilder escaped = new StringBuilder(term.length());
        for (char c : term.toCharArray()) {
            if (c == LIKE_ESCAPE || c == '%' || c == '_') {
                escaped.append(LIKE_ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
