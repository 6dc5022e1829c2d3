package com.phiprotection.application.exceptions;

/**
 * A patient or visit operation failed. The message is generic and safe to return to callers;
 * the cause stays server-side.
 */
public class RecordOperationException extends RuntimeException {

    public RecordOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
