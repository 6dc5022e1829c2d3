package com.phiprotection.infrastructure.security;

/**
 * Outcome of verifying a session token: either the payload or the rejection reason.
 */
public record TokenVerification(boolean valid, SessionTokenPayload data, TokenInvalidReason reason) {

    public static TokenVerification success(SessionTokenPayload data) {
        return new TokenVerification(true, data, null);
    }

    public static TokenVerification failure(TokenInvalidReason reason) {
        return new TokenVerification(false, null, reason);
    }
}
