package com.phiprotection.infrastructure.security;

/**
 * Why a session credential was rejected. Logged internally only; callers outside see
 * the same redirect or 401 for every reason.
 */
public enum TokenInvalidReason {
    MISSING,
    MALFORMED,
    BAD_SIGNATURE,
    EXPIRED,
    REVOKED
}
