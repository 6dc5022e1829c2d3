package com.phiprotection.infrastructure.security;

import com.phiprotection.config.PhiProtectionProperties;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

class SessionCredentialResolverTest {

    private final SessionCredentialResolver resolver = new SessionCredentialResolver(new PhiProtectionProperties());

    @Test
    void cookieTakesPrecedenceOverBearerHeader() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setCookies(new Cookie("phi_session", "from-cookie"));
        request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer from-header");

        assertThat(resolver.resolve(request)).contains("from-cookie");
    }

    @Test
    void bearerPrefixIsCaseInsensitive() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader(HttpHeaders.AUTHORIZATION, "bearer abc.def");

        assertThat(resolver.resolve(request)).contains("abc.def");
    }

    @Test
    void otherSchemesAndEmptyValuesAreIgnored() {
        MockHttpServletRequest basic = new MockHttpServletRequest();
        basic.addHeader(HttpHeaders.AUTHORIZATION, "Basic dXNlcjpwYXNz");
        MockHttpServletRequest emptyBearer = new MockHttpServletRequest();
        emptyBearer.addHeader(HttpHeaders.AUTHORIZATION, "Bearer   ");
        MockHttpServletRequest otherCookie = new MockHttpServletRequest();
        otherCookie.setCookies(new Cookie("JSESSIONID", "x"));

        assertThat(resolver.resolve(basic)).isEmpty();
        assertThat(resolver.resolve(emptyBearer)).isEmpty();
        assertThat(resolver.resolve(otherCookie)).isEmpty();
    }
}
