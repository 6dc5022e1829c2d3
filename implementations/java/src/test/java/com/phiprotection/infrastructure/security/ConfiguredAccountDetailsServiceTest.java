package com.phiprotection.infrastructure.security;

import com.phiprotection.config.LoginConfiguration;
import com.phiprotection.config.PhiProtectionProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfiguredAccountDetailsServiceTest {

    private static final String PASSWORD = "correct-horse-battery-staple";

    private PhiProtectionProperties properties;

    @BeforeEach
    void setUp() {
        PhiProtectionProperties.Account account = new PhiProtectionProperties.Account();
        account.setSubjectId("user-1");
        account.setPasswordHash(new BCryptPasswordEncoder(4).encode(PASSWORD));
        account.setDisplayName("Dr. Jane Smith");

        PhiProtectionProperties.Account unnamed = new PhiProtectionProperties.Account();
        unnamed.setSubjectId("user-2");
        unnamed.setPasswordHash(new BCryptPasswordEncoder(4).encode(PASSWORD));

        properties = new PhiProtectionProperties();
        properties.getAccess().getAccounts().add(account);
        properties.getAccess().getAccounts().add(unnamed);
    }

    @Test
    void loadsConfiguredAccount() {
        PhiAccount account = (PhiAccount) new ConfiguredAccountDetailsService(properties).loadUserByUsername("user-1");

        assertThat(account.getSubjectId()).isEqualTo("user-1");
        assertThat(account.getDisplayName()).isEqualTo("Dr. Jane Smith");
        assertThat(account.getAuthorities()).extracting(Object::toString).containsExactly("ROLE_USER");
    }

    @Test
    void displayNameFallsBackToSubjectId() {
        PhiAccount account = (PhiAccount) new ConfiguredAccountDetailsService(properties).loadUserByUsername("user-2");

        assertThat(account.getDisplayName()).isEqualTo("user-2");
    }

    @Test
    void unknownAccountIsNotFound() {
        assertThatThrownBy(() -> new ConfiguredAccountDetailsService(properties).loadUserByUsername("nobody"))
            .isInstanceOf(UsernameNotFoundException.class);
    }

    @Test
    void authenticationManagerChecksBcryptHashes() {
        LoginConfiguration configuration = new LoginConfiguration();
        UserDetailsService accounts = configuration.accountDetailsService(properties);
        AuthenticationManager manager = configuration.loginAuthenticationManager(
            accounts, configuration.passwordEncoder());

        Authentication authenticated = manager.authenticate(
            UsernamePasswordAuthenticationToken.unauthenticated("user-1", PASSWORD));

        assertThat(authenticated.isAuthenticated()).isTrue();
        assertThat(authenticated.getPrincipal()).isInstanceOf(PhiAccount.class);
        assertThatThrownBy(() -> manager.authenticate(
                UsernamePasswordAuthenticationToken.unauthenticated("user-1", "wrong")))
            .isInstanceOf(BadCredentialsException.class);
        assertThatThrownBy(() -> manager.authenticate(
                UsernamePasswordAuthenticationToken.unauthenticated("nobody", PASSWORD)))
            .isInstanceOf(BadCredentialsException.class);
    }
}
