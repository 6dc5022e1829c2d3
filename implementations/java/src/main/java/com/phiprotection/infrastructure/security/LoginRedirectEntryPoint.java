package com.phiprotection.infrastructure.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phiprotection.config.PhiProtectionProperties;
import com.phiprotection.interfaces.api.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;

/**
 * Answers unauthenticated requests to protected routes.
 *
 * Browser navigation is redirected to the login page with the original path and query in
 * {@code returnTo}; API calls get a 401 JSON error. Every rejection reason gets the same answer.
 */
@Component
@Slf4j
public class LoginRedirectEntryPoint implements AuthenticationEntryPoint {

    private static final String API_PREFIX = "/api";

    private final ObjectMapper objectMapper;
    private final String loginPath;

    public LoginRedirectEntryPoint(ObjectMapper objectMapper, PhiProtectionProperties properties) {
        this.objectMapper = objectMapper;
        this.loginPath = properties.getAccess().getLoginPath();
    }

    @Override
    public void commence(
            HttpServletRequest request,
            HttpServletResponse response,
            AuthenticationException authException) throws IOException {

        Object reason = request.getAttribute(SessionTokenAuthenticationFilter.REJECTION_ATTRIBUTE);
        String path = request.getRequestURI().substring(request.getContextPath().length());

        log.info("Unauthenticated request to protected route: path={}, reason={}",
            Encode.forJava(path), reason != null ? reason : TokenInvalidReason.MISSING);

        if (isApiRequest(request, path)) {
            ErrorResponse errorResponse = ErrorResponse.builder()
                .requestId(UUID.randomUUID())
                .timestamp(Instant.now())
                .status(HttpStatus.UNAUTHORIZED.value())
                .error("Unauthorized")
                .message("Authentication required")
                .path(request.getRequestURI())
                .build();

            response.setStatus(HttpStatus.UNAUTHORIZED.value());
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            objectMapper.writeValue(response.getOutputStream(), errorResponse);
            return;
        }

        response.sendRedirect(request.getContextPath() + loginLocation(path, request.getQueryString()));
    }

    String loginLocation(String path, String query) {
        String returnTo = query == null || query.isEmpty() ? path : path + "?" + query;
        return loginPath + "?returnTo=" + URLEncoder.encode(returnTo, StandardCharsets.UTF_8);
    }

    static boolean isApiRequest(HttpServletRequest request, String path) {
        if (path.equals(API_PREFIX) || path.startsWith(API_PREFIX + "/")) {
            return true;
        }
        String accept = request.getHeader(HttpHeaders.ACCEPT);
        return accept != null
            && accept.contains(MediaType.APPLICATION_JSON_VALUE)
            && !accept.contains(MediaType.TEXT_HTML_VALUE);
    }
}
