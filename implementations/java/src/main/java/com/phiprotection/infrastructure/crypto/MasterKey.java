package com.phiprotection.infrastructure.crypto;

import com.phiprotection.config.ConfigurationException;

/**
 * Process-wide secret that every per-value encryption key is derived from.
 *
 * <p>Never used directly as a cipher key; it is only password input for key derivation.
 */
public final class MasterKey {

    public static final int MIN_LENGTH = 32;

    private final char[] secret;

    public MasterKey(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new ConfigurationException(
                "PHI master key is not configured (phi.encryption.master-key / PHI_MASTER_KEY)");
        }
        if (secret.length() < MIN_LENGTH) {
            throw new ConfigurationException(
                "PHI master key must be at least " + MIN_LENGTH + " characters");
        }
        this.secret = secret.toCharArray();
    }

    /**
     * Copy of the secret. Callers must wipe the copy after use.
     */
    char[] copySecret() {
        return secret.clone();
    }

    @Override
    public String toString() {
        return "MasterKey[PROTECTED]";
    }
}
