package com.phiprotection.domain.model;

/**
 * Broad class of protected health information a {@link PhiField} belongs to.
 */
public enum PhiCategory {
    IDENTITY,
    CLINICAL,
    MENTAL_HEALTH,
    INSURANCE
}
