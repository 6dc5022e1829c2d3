package com.phiprotection.config;

import com.phiprotection.application.AuthorizationContextProvider;
import com.phiprotection.infrastructure.security.LoginRedirectEntryPoint;
import com.phiprotection.infrastructure.security.RoutePolicy;
import com.phiprotection.infrastructure.security.SessionCredentialResolver;
import com.phiprotection.infrastructure.security.SessionTokenAuthenticationFilter;
import com.phiprotection.infrastructure.security.SessionTokenManager;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter;
import org.springframework.security.web.util.matcher.AnyRequestMatcher;
import org.springframework.security.web.util.matcher.RequestMatcher;

/**
 * Spring Security configuration for the PHI service.
 *
 * Security architecture:
 * - Stateless authentication via signed session tokens (cookie or bearer header)
 * - Route classification: public prefixes open, everything else authenticated
 * - Unauthenticated browser requests redirected to login, API requests answered with 401
 * - Per-record ownership enforced by the AccessKernel in the controllers
 * - Security headers written on every response, whatever the auth outcome
 */
@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfiguration {

    private static final long HSTS_MAX_AGE_SECONDS = 31_536_000L;

    private final SessionTokenManager sessionTokenManager;
    private final SessionCredentialResolver credentialResolver;
    private final AuthorizationContextProvider contextProvider;
    private final RoutePolicy routePolicy;
    private final LoginRedirectEntryPoint loginRedirectEntryPoint;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        RequestMatcher publicRoutes = routePolicy::isPublic;

        http
            // Disable CSRF for stateless token authentication
            .csrf(csrf -> csrf.disable())

            .sessionManagement(session ->
                session.sessionCreationPolicy(SessionCreationPolicy.STATELESS)
            )

            // Unclassified routes fall through to authenticated
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(publicRoutes).permitAll()
                .anyRequest().authenticated()
            )

            .addFilterBefore(
                new SessionTokenAuthenticationFilter(
                    sessionTokenManager, credentialResolver, contextProvider::fromVerifiedSession),
                UsernamePasswordAuthenticationFilter.class
            )

            .exceptionHandling(exceptions -> exceptions
                .authenticationEntryPoint(loginRedirectEntryPoint)
            )

            .headers(headers -> headers
                .contentSecurityPolicy(csp ->
                    csp.policyDirectives("default-src 'self'; frame-ancestors 'none'")
                )
                .frameOptions(frame -> frame.deny())
                .contentTypeOptions(Customizer.withDefaults())
                .referrerPolicy(referrer -> referrer
                    .policy(ReferrerPolicyHeaderWriter.ReferrerPolicy.STRICT_ORIGIN_WHEN_CROSS_ORIGIN)
                )
                // Sent on plain HTTP too; TLS terminates upstream
                .httpStrictTransportSecurity(hsts -> hsts
                    .requestMatcher(AnyRequestMatcher.INSTANCE)
                    .includeSubDomains(true)
                    .maxAgeInSeconds(HSTS_MAX_AGE_SECONDS)
                )
            );

        return http.build();
    }
}
