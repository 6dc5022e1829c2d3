package com.phiprotection.interfaces.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phiprotection.application.AuthorizationContextProvider;
import com.phiprotection.config.CacheConfiguration;
import com.phiprotection.config.PhiProtectionConfiguration;
import com.phiprotection.config.SecurityConfiguration;
import com.phiprotection.infrastructure.audit.AuditAction;
import com.phiprotection.infrastructure.audit.AuditLogger;
import com.phiprotection.infrastructure.security.LoginRedirectEntryPoint;
import com.phiprotection.infrastructure.security.RoutePolicy;
import com.phiprotection.infrastructure.security.SessionCredentialResolver;
import com.phiprotection.infrastructure.security.SessionTokenManager;
import com.phiprotection.infrastructure.security.TokenDenylist;
import com.phiprotection.infrastructure.security.TokenInvalidReason;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SessionController.class)
@ActiveProfiles("test")
@Import({
    SecurityConfiguration.class,
    PhiProtectionConfiguration.class,
    CacheConfiguration.class,
    SessionTokenManager.class,
    TokenDenylist.class,
    SessionCredentialResolver.class,
    AuthorizationContextProvider.class,
    RoutePolicy.class,
    LoginRedirectEntryPoint.class
})
class SessionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private SessionTokenManager sessionTokenManager;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private AuditLogger auditLogger;

    @Test
    void currentSessionShowsSubjectAndDisplayName() throws Exception {
        String token = sessionTokenManager.createSessionToken("user-1", "Dr. Jane Smith");

        mockMvc.perform(get("/api/session").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.subjectId").value("user-1"))
            .andExpect(jsonPath("$.displayName").value("Dr. Jane Smith"))
            .andExpect(jsonPath("$.admin").value(false));
    }

    @Test
    void extendIssuesNewTokenInHardenedCookie() throws Exception {
        String token = sessionTokenManager.createSessionToken("user-1", "Jane");
        Thread.sleep(5);

        MvcResult result = mockMvc.perform(post("/api/session/extend").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
            .andExpect(status().isOk())
            .andExpect(header().string(HttpHeaders.SET_COOKIE, allOf(
                containsString("phi_session="),
                containsString("HttpOnly"),
                containsString("Secure"),
                containsString("SameSite=Strict"))))
            .andReturn();

        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        String extended = body.get("token").asText();
        assertThat(extended).isNotEqualTo(token);
        assertThat(sessionTokenManager.verifySessionToken(extended).valid()).isTrue();
        assertThat(sessionTokenManager.verifySessionToken(token).valid()).isTrue();
    }

    @Test
    void logoutRevokesTokenAndClearsCookie() throws Exception {
        String token = sessionTokenManager.createSessionToken("user-1", "Jane");

        mockMvc.perform(post("/api/session/logout").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
            .andExpect(status().isNoContent())
            .andExpect(header().string(HttpHeaders.SET_COOKIE, containsString("Max-Age=0")));

        assertThat(sessionTokenManager.verifySessionToken(token).reason()).isEqualTo(TokenInvalidReason.REVOKED);
        verify(auditLogger).logAudit(eq("user-1"), eq("SESSION"), eq(AuditAction.LOGOUT), anyString(), eq(true), anyMap());

        mockMvc.perform(get("/api/session").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
            .andExpect(status().isUnauthorized());
    }
}
