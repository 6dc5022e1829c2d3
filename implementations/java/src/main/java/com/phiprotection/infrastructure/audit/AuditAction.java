package com.phiprotection.infrastructure.audit;

/**
 * Actions recorded in the PHI access trail.
 */
public enum AuditAction {
    CREATE_PATIENT,
    VIEW_PATIENT,
    UPDATE_PATIENT,
    SEARCH_PATIENT,
    CREATE_VISIT,
    VIEW_VISIT,
    ENCRYPT_DATA,
    DECRYPT_DATA,
    PERMISSION_DENIED,
    LOGIN,
    LOGOUT
}
