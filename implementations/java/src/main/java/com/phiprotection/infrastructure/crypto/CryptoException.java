package com.phiprotection.infrastructure.crypto;

/**
 * Exception thrown when a low-level cryptographic primitive fails.
 */
public class CryptoException extends RuntimeException {

    public CryptoException(String message) {
        super(message);
    }

    public CryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
