package com.phiprotection.infrastructure.crypto;

/**
 * Field-level encryption of single string values.
 *
 * @since 1.0.0
 */
public interface CryptoService {

    /**
     * Encrypt one value into a self-describing envelope.
     *
     * @param plaintext Value to encrypt
     * @return Base64 envelope, or {@code null} for null or empty input
     * @throws EncryptionFailureException if the value cannot be encrypted
     */
    String encryptValue(String plaintext);

    /**
     * Decrypt and authenticate an envelope.
     *
     * <p>Fails closed: any malformed, truncated or tampered envelope, or one sealed under a
     * different master key, yields {@code null}. Never throws and never returns partial plaintext.
     *
     * @param encrypted Base64 envelope
     * @return Plaintext, or {@code null}
     */
    String decryptValue(String encrypted);
}
