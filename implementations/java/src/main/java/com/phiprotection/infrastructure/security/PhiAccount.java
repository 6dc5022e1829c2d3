package com.phiprotection.infrastructure.security;

import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.User;

import java.util.List;

/**
 * A login account. The display name travels into the session token.
 */
public class PhiAccount extends User {

    private final String displayName;

    public PhiAccount(String subjectId, String passwordHash, String displayName) {
        super(subjectId, passwordHash, List.of(new SimpleGrantedAuthority("ROLE_USER")));
        this.displayName = displayName == null || displayName.isBlank() ? subjectId : displayName;
    }

    public String getSubjectId() {
        return getUsername();
    }

    public String getDisplayName() {
        return displayName;
    }
}
