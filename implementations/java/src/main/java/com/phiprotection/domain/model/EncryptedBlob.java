package com.phiprotection.domain.model;

import lombok.EqualsAndHashCode;

import java.nio.ByteBuffer;
import java.util.Base64;
import java.util.Objects;

/**
 * Self-describing envelope for one encrypted value.
 *
 * <p>Wire layout, base64 encoded as a single string:
 * <pre>
 *   salt[32] | iv[16] | authTag[16] | ciphertext[N]
 * </pre>
 *
 * <p><strong>Security Guarantees:</strong>
 * <ul>
 *   <li>Immutable - segments are copied in and out</li>
 *   <li>No plaintext or key material is ever held here</li>
 *   <li>{@code toString} never prints segment bytes</li>
 * </ul>
 *
 * @since 1.0.0
 */
@EqualsAndHashCode
public final class EncryptedBlob {

    public static final int SALT_LENGTH = 32;
    public static final int IV_LENGTH = 16;
    public static final int TAG_LENGTH = 16;
    public static final int HEADER_LENGTH = SALT_LENGTH + IV_LENGTH + TAG_LENGTH;

    private final byte[] salt;
    private final byte[] iv;
    private final byte[] authTag;
    private final byte[] ciphertext;

    private EncryptedBlob(byte[] salt, byte[] iv, byte[] authTag, byte[] ciphertext) {
        this.salt = salt;
        this.iv = iv;
        this.authTag = authTag;
        this.ciphertext = ciphertext;
    }

    public static EncryptedBlob of(byte[] salt, byte[] iv, byte[] authTag, byte[] ciphertext) {
        Objects.requireNonNull(salt, "Salt cannot be null");
        Objects.requireNonNull(iv, "IV cannot be null");
        Objects.requireNonNull(authTag, "Authentication tag cannot be null");
        Objects.requireNonNull(ciphertext, "Ciphertext cannot be null");

        if (salt.length != SALT_LENGTH) {
            throw new IllegalArgumentException("Salt must be " + SALT_LENGTH + " bytes");
        }
        if (iv.length != IV_LENGTH) {
            throw new IllegalArgumentException("IV must be " + IV_LENGTH + " bytes");
        }
        if (authTag.length != TAG_LENGTH) {
            throw new IllegalArgumentException("Authentication tag must be " + TAG_LENGTH + " bytes");
        }
        if (ciphertext.length == 0) {
            throw new IllegalArgumentException("Ciphertext cannot be empty");
        }

        return new EncryptedBlob(salt.clone(), iv.clone(), authTag.clone(), ciphertext.clone());
    }

    /**
     * Split an encoded envelope by its fixed offsets.
     *
     * @throws IllegalArgumentException if the value is not base64 or too short to hold a ciphertext
     */
    public static EncryptedBlob parse(String encoded) {
        if (encoded == null || encoded.isEmpty()) {
            throw new IllegalArgumentException("Encrypted value cannot be empty");
        }

        byte[] raw = Base64.getDecoder().decode(encoded);
        if (raw.length <= HEADER_LENGTH) {
            throw new IllegalArgumentException("Encrypted value is too short");
        }

        ByteBuffer buffer = ByteBuffer.wrap(raw);
        byte[] salt = new byte[SALT_LENGTH];
        byte[] iv = new byte[IV_LENGTH];
        byte[] authTag = new byte[TAG_LENGTH];
        byte[] ciphertext = new byte[raw.length - HEADER_LENGTH];
        buffer.get(salt).get(iv).get(authTag).get(ciphertext);

        return new EncryptedBlob(salt, iv, authTag, ciphertext);
    }

    public String toBase64() {
        byte[] raw = ByteBuffer.allocate(HEADER_LENGTH + ciphertext.length)
            .put(salt)
            .put(iv)
            .put(authTag)
            .put(ciphertext)
            .array();
        return Base64.getEncoder().encodeToString(raw);
    }

    public byte[] getSalt() {
        return salt.clone();
    }

    public byte[] getIv() {
        return iv.clone();
    }

    public byte[] getAuthTag() {
        return authTag.clone();
    }

    public byte[] getCiphertext() {
        return ciphertext.clone();
    }

    public int getCiphertextLength() {
        return ciphertext.length;
    }

    @Override
    public String toString() {
        return "EncryptedBlob{ciphertextLength=" + ciphertext.length + ", data=[PROTECTED]}";
    }
}
