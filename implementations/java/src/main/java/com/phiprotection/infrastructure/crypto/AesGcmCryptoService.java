package com.phiprotection.infrastructure.crypto;

import com.phiprotection.domain.model.EncryptedBlob;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;

/**
 * AES-256-GCM envelope encryption with a per-value derived key.
 *
 * Architecture:
 * - Master key held in memory, only ever used as PBKDF2 input
 * - Fresh random salt and IV for every encryption
 * - Per-value key derived from (master key, salt), discarded after the call
 * - Salt, IV and authentication tag travel with the ciphertext
 *
 * Security properties:
 * - Semantic security: equal plaintexts give different envelopes
 * - Authentication via GCM mode (integrity + confidentiality)
 * - Decryption fails closed on any flipped bit
 */
@Service
@Slf4j
public class AesGcmCryptoService implements CryptoService {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_TAG_LENGTH = 128; // bits

    private final MasterKey masterKey;
    private final KeyDerivation keyDerivation;
    private final Counter decryptionFailures;
    private final SecureRandom secureRandom = new SecureRandom();

    public AesGcmCryptoService(MasterKey masterKey, KeyDerivation keyDerivation, MeterRegistry meterRegistry) {
        this.masterKey = masterKey;
        this.keyDerivation = keyDerivation;
        this.decryptionFailures = Counter.builder("phi.decryption.failures")
            .description("Envelopes rejected during decryption")
            .register(meterRegistry);
    }

    @Override
    public String encryptValue(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            return null;
        }

        try {
            byte[] salt = randomBytes(EncryptedBlob.SALT_LENGTH);
            byte[] iv = randomBytes(EncryptedBlob.IV_LENGTH);
            SecretKey key = keyDerivation.deriveKey(masterKey, salt);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));

            // GCM produces ciphertext || auth_tag
            byte[] ciphertextWithTag = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            int ciphertextLength = ciphertextWithTag.length - EncryptedBlob.TAG_LENGTH;
            byte[] ciphertext = new byte[ciphertextLength];
            byte[] authTag = new byte[EncryptedBlob.TAG_LENGTH];

            System.arraycopy(ciphertextWithTag, 0, ciphertext, 0, ciphertextLength);
            System.arraycopy(ciphertextWithTag, ciphertextLength, authTag, 0, authTag.length);

            return EncryptedBlob.of(salt, iv, authTag, ciphertext).toBase64();

        } catch (GeneralSecurityException | CryptoException e) {
            log.error("Encryption failed: {}", e.getClass().getSimpleName());
            throw new EncryptionFailureException(e);
        }
    }

    @Override
    public String decryptValue(String encrypted) {
        if (encrypted == null || encrypted.isEmpty()) {
            return null;
        }

        try {
            byte[] plaintext = open(EncryptedBlob.parse(encrypted));
            return new String(plaintext, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | IllegalArgumentException | CryptoException e) {
            decryptionFailures.increment();
            log.warn("Decryption rejected envelope: {}", e.getClass().getSimpleName());
            return null;
        }
    }

    private byte[] open(EncryptedBlob blob) throws GeneralSecurityException {
        SecretKey key = keyDerivation.deriveKey(masterKey, blob.getSalt());

        // Combine ciphertext and auth tag for GCM
        byte[] ciphertextWithTag = ByteBuffer.allocate(blob.getCiphertextLength() + EncryptedBlob.TAG_LENGTH)
            .put(blob.getCiphertext())
            .put(blob.getAuthTag())
            .array();

        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, blob.getIv()));
        return cipher.doFinal(ciphertextWithTag);
    }

    private byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        secureRandom.nextBytes(bytes);
        return bytes;
    }
}
