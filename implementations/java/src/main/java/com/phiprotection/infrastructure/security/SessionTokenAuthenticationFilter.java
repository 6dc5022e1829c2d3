package com.phiprotection.infrastructure.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Authenticates requests that carry a signed session token.
 *
 * Process Flow:
 * 1. Extract the token from the session cookie or a bearer header
 * 2. Verify signature, expiry and revocation
 * 3. Build the AuthorizationContext for the subject
 * 4. Install it as the Spring Security principal
 *
 * A rejected token leaves the request unauthenticated and records the reason as a request
 * attribute; whether that matters is decided by the route rules.
 */
@Slf4j
@RequiredArgsConstructor
public class SessionTokenAuthenticationFilter extends OncePerRequestFilter {

    public static final String REJECTION_ATTRIBUTE = SessionTokenAuthenticationFilter.class.getName() + ".REJECTION";

    private final SessionTokenManager tokenManager;
    private final SessionCredentialResolver credentialResolver;
    private final BiFunction<SessionTokenPayload, HttpServletRequest, AuthorizationContext> contextFactory;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {

        Optional<String> token = credentialResolver.resolve(request);

        if (token.isPresent() && SecurityContextHolder.getContext().getAuthentication() == null) {
            TokenVerification verification = tokenManager.verifySessionToken(token.get());

            if (verification.valid()) {
                AuthorizationContext context = contextFactory.apply(verification.data(), request);

                UsernamePasswordAuthenticationToken authentication =
                    new UsernamePasswordAuthenticationToken(context, null, authoritiesFor(context));
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));

                SecurityContext securityContext = SecurityContextHolder.createEmptyContext();
                securityContext.setAuthentication(authentication);
                SecurityContextHolder.setContext(securityContext);

                log.debug("Authenticated session: subject={}, path={}",
                    context.getSubjectId(), Encode.forJava(request.getRequestURI()));
            } else {
                request.setAttribute(REJECTION_ATTRIBUTE, verification.reason());
                log.debug("Session credential rejected: reason={}, path={}",
                    verification.reason(), Encode.forJava(request.getRequestURI()));
            }
        }

        filterChain.doFilter(request, response);
    }

    private static List<GrantedAuthority> authoritiesFor(AuthorizationContext context) {
        List<GrantedAuthority> authorities = new ArrayList<>();
        authorities.add(new SimpleGrantedAuthority("ROLE_USER"));
        if (context.isAdmin()) {
            authorities.add(new SimpleGrantedAuthority("ROLE_ADMIN"));
        }
        return authorities;
    }
}
