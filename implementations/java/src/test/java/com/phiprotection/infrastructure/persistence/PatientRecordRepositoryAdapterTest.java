package com.phiprotection.infrastructure.persistence;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PatientRecordRepositoryAdapterTest {

    @Test
    void escapesLikeWildcards() {
        assertThat(PatientRecordRepositoryAdapter.escapeLike("50%_off")).isEqualTo("50!%!_off");
    }

    @Test
    void escapesTheEscapeCharacter() {
        assertThat(PatientRecordRepositoryAdapter.escapeLike("wow!")).isEqualTo("wow!!");
    }

    @Test
    void leavesPlainTermsUntouched() {
        assertThat(PatientRecordRepositoryAdapter.escapeLike("PT-2026-000123")).isEqualTo("PT-2026-000123");
    }
}
