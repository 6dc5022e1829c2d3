package com.phiprotection.infrastructure.crypto;

import javax.crypto.SecretKey;

/**
 * Derives a single-use AES key from the master key and a per-value salt.
 */
public interface KeyDerivation {

    /**
     * @param masterKey Process master key
     * @param salt Random salt embedded in the envelope
     * @return 256-bit AES key; callers must not cache it
     * @throws CryptoException if derivation fails or is interrupted
     */
    SecretKey deriveKey(MasterKey masterKey, byte[] salt);
}
