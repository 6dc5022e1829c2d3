package com.phiprotection.infrastructure.security;

import com.phiprotection.config.PhiProtectionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;

import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Login accounts from {@code phi.access.accounts}.
 *
 * Returns a fresh {@link PhiAccount} on every lookup; the authentication provider erases
 * credentials on the instance it is handed.
 */
@Slf4j
public class ConfiguredAccountDetailsService implements UserDetailsService {

    private final Map<String, PhiProtectionProperties.Account> accounts;

    public ConfiguredAccountDetailsService(PhiProtectionProperties properties) {
        this.accounts = properties.getAccess().getAccounts().stream()
            .collect(Collectors.toUnmodifiableMap(
                PhiProtectionProperties.Account::getSubjectId, Function.identity()));

        if (accounts.isEmpty()) {
            log.warn("No login accounts configured; POST /login will reject every request");
        } else {
            log.info("Login accounts loaded: count={}", accounts.size());
        }
    }

    @Override
    public UserDetails loadUserByUsername(String username) {
        PhiProtectionProperties.Account account = accounts.get(username);
        if (account == null) {
            throw new UsernameNotFoundException("Unknown account");
        }
        return new PhiAccount(account.getSubjectId(), account.getPasswordHash(), account.getDisplayName());
    }
}
