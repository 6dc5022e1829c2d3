package com.phiprotection.application.exceptions;

/**
 * Another request updated the same record between this request's read and write.
 */
public class ConcurrentRecordModificationException extends RuntimeException {

    public ConcurrentRecordModificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
