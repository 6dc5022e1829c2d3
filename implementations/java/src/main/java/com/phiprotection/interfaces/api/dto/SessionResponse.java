package com.phiprotection.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * The caller's own session: who they are and when the session ends.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionResponse {

    private String subjectId;
    private String displayName;
    private boolean admin;
    private Instant expiresAt;
}
