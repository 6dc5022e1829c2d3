package com.phiprotection.config;

import com.phiprotection.infrastructure.crypto.KeyDerivation;
import com.phiprotection.infrastructure.crypto.MasterKey;
import com.phiprotection.infrastructure.crypto.Pbkdf2KeyDerivation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Field encryption key material.
 *
 * Startup fails with {@link ConfigurationException} when no master key is configured.
 */
@Configuration
@Slf4j
public class CryptoConfiguration {

    @Bean
    public MasterKey masterKey(PhiProtectionProperties properties) {
        MasterKey masterKey = new MasterKey(properties.getEncryption().getMasterKey());
        log.info("PHI master key loaded");
        return masterKey;
    }

    @Bean
    public KeyDerivation keyDerivation(PhiProtectionProperties properties) {
        PhiProtectionProperties.Encryption encryption = properties.getEncryption();
        return new Pbkdf2KeyDerivation(encryption.getPbkdf2Iterations(), encryption.getMaxConcurrentDerivations());
    }
}
