package com.phiprotection.infrastructure.security;

import com.phiprotection.config.PhiProtectionProperties;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Finds the session token on a request: session cookie first, then a bearer header.
 */
@Component
public class SessionCredentialResolver {

    private static final String BEARER_PREFIX = "Bearer ";

    private final String cookieName;

    public SessionCredentialResolver(PhiProtectionProperties properties) {
        this.cookieName = properties.getSession().getCookieName();
    }

    public Optional<String> resolve(HttpServletRequest request) {
        Cookie[] cookies = request.getCookies();
        if (cookies != null) {
            for (Cookie cookie : cookies) {
                if (cookieName.equals(cookie.getName()) && cookie.getValue() != null && !cookie.getValue().isBlank()) {
                    return Optional.of(cookie.getValue());
                }
            }
        }

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            if (!token.isEmpty()) {
                return Optional.of(token);
            }
        }

        return Optional.empty();
    }

    public String getCookieName() {
        return cookieName;
    }

    /**
     * Session cookie carrying {@code value}; an empty value with a zero max age clears it.
     */
    public ResponseCookie sessionCookie(String value, Duration maxAge) {
        return ResponseCookie.from(cookieName, value)
            .httpOnly(true)
            .secure(true)
            .sameSite("Strict")
            .path("/")
            .maxAge(maxAge)
            .build();
    }
}
