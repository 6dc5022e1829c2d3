package com.phiprotection.infrastructure.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phiprotection.config.ConfigurationException;
import com.phiprotection.config.PhiProtectionProperties;
import com.phiprotection.infrastructure.crypto.CryptoException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Stateless, HMAC-signed, time-bound session credentials.
 *
 * Wire format: {@code base64url(JSON payload) "." hex(HMAC-SHA256(payload segment, secret))}.
 *
 * Verification order:
 * 1. Missing token
 * 2. Shape (exactly two non-empty segments)
 * 3. Signature, compared in constant time
 * 4. Payload decoding
 * 5. Expiry
 * 6. Revocation
 */
@Service
@Slf4j
public class SessionTokenManager {

    public static final int MIN_SECRET_LENGTH = 32;

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final Base64.Encoder PAYLOAD_ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder PAYLOAD_DECODER = Base64.getUrlDecoder();
    private static final HexFormat HEX = HexFormat.of();

    private final SecretKeySpec signingKey;
    private final Duration lifetime;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final TokenDenylist denylist;

    public SessionTokenManager(
            PhiProtectionProperties properties,
            Clock clock,
            ObjectMapper objectMapper,
            TokenDenylist denylist) {

        String secret = properties.getSession().getSecret();
        if (secret == null || secret.isBlank()) {
            throw new ConfigurationException(
                "Session secret is not configured (phi.session.secret / PHI_SESSION_SECRET)");
        }
        if (secret.length() < MIN_SECRET_LENGTH) {
            throw new ConfigurationException(
                "Session secret must be at least " + MIN_SECRET_LENGTH + " characters");
        }

        this.signingKey = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
        this.lifetime = properties.getSession().getLifetime();
        this.clock = clock;
        this.objectMapper = objectMapper;
        this.denylist = denylist;
    }

    public String createSessionToken(String subjectId, String displayName) {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("Subject id is required");
        }

        long now = clock.millis();
        SessionTokenPayload payload = new SessionTokenPayload(subjectId, displayName, now, now + lifetime.toMillis());

        String encoded;
        try {
            encoded = PAYLOAD_ENCODER.encodeToString(objectMapper.writeValueAsBytes(payload));
        } catch (JsonProcessingException e) {
            throw new CryptoException("Session payload could not be encoded", e);
        }

        log.debug("Session issued: subject={}, expiresAt={}", subjectId, Instant.ofEpochMilli(payload.expiresAt()));
        return encoded + "." + sign(encoded);
    }

    public TokenVerification verifySessionToken(String token) {
        if (token == null || token.isBlank()) {
            return TokenVerification.failure(TokenInvalidReason.MISSING);
        }

        int dot = token.indexOf('.');
        if (dot <= 0 || dot == token.length() - 1 || token.indexOf('.', dot + 1) >= 0) {
            return TokenVerification.failure(TokenInvalidReason.MALFORMED);
        }

        String encodedPayload = token.substring(0, dot);
        String signature = token.substring(dot + 1);

        byte[] expected = sign(encodedPayload).getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected, signature.getBytes(StandardCharsets.US_ASCII))) {
            return TokenVerification.failure(TokenInvalidReason.BAD_SIGNATURE);
        }

        SessionTokenPayload payload;
        try {
            payload = objectMapper.readValue(PAYLOAD_DECODER.decode(encodedPayload), SessionTokenPayload.class);
        } catch (IOException | IllegalArgumentException e) {
            return TokenVerification.failure(TokenInvalidReason.MALFORMED);
        }
        if (payload == null || payload.subjectId() == null || payload.subjectId().isBlank()) {
            return TokenVerification.failure(TokenInvalidReason.MALFORMED);
        }

        if (clock.millis() > payload.expiresAt()) {
            return TokenVerification.failure(TokenInvalidReason.EXPIRED);
        }

        if (denylist.isRevoked(tokenId(signature))) {
            return TokenVerification.failure(TokenInvalidReason.REVOKED);
        }

        return TokenVerification.success(payload);
    }

    /**
     * Issue a new token with a fresh expiry for the holder of a currently valid one.
     * The presented token stays valid until its own expiry.
     */
    public Optional<String> extendSession(String token) {
        TokenVerification verification = verifySessionToken(token);
        if (!verification.valid()) {
            log.debug("Session extension refused: reason={}", verification.reason());
            return Optional.empty();
        }
        SessionTokenPayload data = verification.data();
        return Optional.of(createSessionToken(data.subjectId(), data.displayName()));
    }

    /**
     * Deny a valid token for the rest of its lifetime.
     *
     * @return true if the token was valid and is now revoked
     */
    public boolean revokeSession(String token) {
        TokenVerification verification = verifySessionToken(token);
        if (!verification.valid()) {
            return false;
        }
        String signature = token.substring(token.indexOf('.') + 1);
        denylist.revoke(tokenId(signature), Instant.ofEpochMilli(verification.data().expiresAt()));
        log.info("Session revoked: subject={}", verification.data().subjectId());
        return true;
    }

    private String sign(String encodedPayload) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(signingKey);
            return HEX.formatHex(mac.doFinal(encodedPayload.getBytes(StandardCharsets.US_ASCII)));
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Session signature could not be computed", e);
        }
    }

    static String tokenId(String signature) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HEX.formatHex(digest.digest(signature.getBytes(StandardCharsets.US_ASCII)));
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Session id could not be computed", e);
        }
    }
}
