package com.phiprotection.infrastructure.crypto;

import lombok.extern.slf4j.Slf4j;

import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.concurrent.Semaphore;

/**
 * PBKDF2-HMAC-SHA256 key stretching.
 *
 * Each derivation costs {@code iterations} HMAC rounds, so concurrent derivations are
 * capped by a fair semaphore to keep request threads available under a burst of reads.
 */
@Slf4j
public class Pbkdf2KeyDerivation implements KeyDerivation {

    public static final int DEFAULT_ITERATIONS = 100_000;

    private static final String ALGORITHM = "PBKDF2WithHmacSHA256";
    private static final int KEY_LENGTH_BITS = 256;

    private final int iterations;
    private final Semaphore permits;

    public Pbkdf2KeyDerivation(int iterations, int maxConcurrentDerivations) {
        if (iterations < 1) {
            throw new IllegalArgumentException("Iterations must be positive");
        }
        if (maxConcurrentDerivations < 1) {
            throw new IllegalArgumentException("At least one concurrent derivation is required");
        }
        this.iterations = iterations;
        this.permits = new Semaphore(maxConcurrentDerivations, true);

        log.info("PBKDF2 key derivation configured: iterations={}, maxConcurrent={}",
            iterations, maxConcurrentDerivations);
    }

    @Override
    public SecretKey deriveKey(MasterKey masterKey, byte[] salt) {
        char[] password = masterKey.copySecret();
        PBEKeySpec spec = new PBEKeySpec(password, salt, iterations, KEY_LENGTH_BITS);
        try {
            permits.acquire();
            try {
                SecretKeyFactory factory = SecretKeyFactory.getInstance(ALGORITHM);
                byte[] keyBytes = factory.generateSecret(spec).getEncoded();
                SecretKey key = new SecretKeySpec(keyBytes, "AES");
                Arrays.fill(keyBytes, (byte) 0);
                return key;
            } finally {
                permits.release();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CryptoException("Key derivation interrupted", e);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Key derivation failed", e);
        } finally {
            spec.clearPassword();
            Arrays.fill(password, '\0');
        }
    }

    public int getIterations() {
        return iterations;
    }
}
