package com.phiprotection.infrastructure.security;

import com.phiprotection.config.PhiProtectionProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

class RoutePolicyTest {

    private final RoutePolicy routePolicy = new RoutePolicy(new PhiProtectionProperties());

    @ParameterizedTest
    @ValueSource(strings = {"/", "/login", "/patient-login", "/shared/abc123", "/actuator/health", "/login?returnTo=%2F"})
    void publicRoutesNeedNoSession(String path) {
        assertThat(routePolicy.classify(path)).isEqualTo(RoutePolicy.RouteClass.PUBLIC);
        assertThat(routePolicy.requiresAuthentication(path)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"/api", "/api/patients/1", "/dashboard", "/dashboard/patients", "/admin/users", "/pumpdrive"})
    void protectedRoutesNeedSession(String path) {
        assertThat(routePolicy.classify(path)).isEqualTo(RoutePolicy.RouteClass.PROTECTED);
        assertThat(routePolicy.requiresAuthentication(path)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"/reports", "/internal/debug", "/loginx", "/apiary", "/sharedfiles"})
    void unclassifiedRoutesNeedSession(String path) {
        assertThat(routePolicy.classify(path)).isEqualTo(RoutePolicy.RouteClass.UNCLASSIFIED);
        assertThat(routePolicy.requiresAuthentication(path)).isTrue();
    }

    @Test
    void prefixMatchesOnlyAtSegmentBoundary() {
        assertThat(RoutePolicy.matches("/login", "/login")).isTrue();
        assertThat(RoutePolicy.matches("/login/help", "/login")).isTrue();
        assertThat(RoutePolicy.matches("/login?next=1", "/login")).isTrue();
        assertThat(RoutePolicy.matches("/login-page", "/login")).isFalse();
    }

    @Test
    void protectedTableWinsOverPublicTable() {
        PhiProtectionProperties properties = new PhiProtectionProperties();
        properties.getAccess().getPublicPaths().add("/staff/onboarding");

        RoutePolicy overlapping = new RoutePolicy(properties);

        assertThat(overlapping.classify("/staff/onboarding")).isEqualTo(RoutePolicy.RouteClass.PROTECTED);
    }

    @Test
    void contextPathIsStrippedForRequestMatching() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/phi/login");
        request.setContextPath("/phi");

        assertThat(routePolicy.isPublic(request)).isTrue();
    }
}
