package com.phiprotection.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A freshly issued session token.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionTokenResponse {

    private String token;
    private Instant expiresAt;
}
