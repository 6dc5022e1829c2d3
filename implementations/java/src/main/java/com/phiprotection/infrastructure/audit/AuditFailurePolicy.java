package com.phiprotection.infrastructure.audit;

/**
 * What happens to a PHI operation when its audit entry cannot be written.
 */
public enum AuditFailurePolicy {

    /** Reject the operation with {@link AuditSinkFailureException}. */
    FAIL_CLOSED,

    /** Log at ERROR, count the failure and let the operation proceed. */
    FAIL_OPEN
}
