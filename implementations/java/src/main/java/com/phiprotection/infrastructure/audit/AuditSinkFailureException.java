package com.phiprotection.infrastructure.audit;

/**
 * The audit trail could not be written, so the PHI operation it guards is rejected.
 */
public class AuditSinkFailureException extends RuntimeException {

    public AuditSinkFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
