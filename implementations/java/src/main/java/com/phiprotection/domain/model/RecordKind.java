package com.phiprotection.domain.model;

import java.util.Set;

/**
 * Record kinds and the sensitive fields each one encrypts.
 */
public enum RecordKind {

    /** Demographics, insurance and the clinical summary of a patient. */
    PATIENT(PhiField.all()),

    /** A single encounter: dictation, SOAP note, complaints, diagnoses and screening results. */
    VISIT(PhiField.inCategories(PhiCategory.CLINICAL, PhiCategory.MENTAL_HEALTH));

    private final Set<PhiField> fields;

    RecordKind(Set<PhiField> fields) {
        this.fields = fields;
    }

    public Set<PhiField> getFields() {
        return fields;
    }
}
