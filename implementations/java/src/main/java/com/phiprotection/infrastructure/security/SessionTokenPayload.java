package com.phiprotection.infrastructure.security;

/**
 * Signed portion of a session token. Timestamps are epoch milliseconds.
 */
public record SessionTokenPayload(String subjectId, String displayName, long createdAt, long expiresAt) {

    @Override
    public String toString() {
        return "SessionTokenPayload[subjectId=" + subjectId + ", displayName=[REDACTED], expiresAt=" + expiresAt + "]";
    }
}
