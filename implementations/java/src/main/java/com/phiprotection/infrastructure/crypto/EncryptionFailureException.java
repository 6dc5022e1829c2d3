package com.phiprotection.infrastructure.crypto;

/**
 * Encryption of a sensitive value failed. The message is fixed and carries no detail
 * about the value or the key.
 */
public class EncryptionFailureException extends RuntimeException {

    public static final String MESSAGE = "Encryption operation failed";

    public EncryptionFailureException(Throwable cause) {
        super(MESSAGE, cause);
    }
}
