package com.phiprotection.config;

import com.phiprotection.infrastructure.crypto.KeyDerivation;
import com.phiprotection.infrastructure.crypto.MasterKey;
import com.phiprotection.infrastructure.crypto.Pbkdf2KeyDerivation;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class CryptoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
        .withUserConfiguration(PhiProtectionConfiguration.class, CryptoConfiguration.class);

    @Test
    void startupIsRefusedWithoutMasterKey() {
        contextRunner.run(context -> {
            assertThat(context).hasFailed();
            assertThat(context.getStartupFailure()).rootCause().isInstanceOf(ConfigurationException.class);
        });
    }

    @Test
    void startupIsRefusedWithShortMasterKey() {
        contextRunner
            .withPropertyValues("phi.encryption.master-key=short")
            .run(context -> assertThat(context.getStartupFailure()).rootCause()
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("at least 32"));
    }

    @Test
    void configuredKeyAndIterationsAreWired() {
        contextRunner
            .withPropertyValues(
                "phi.encryption.master-key=config-test-master-key-0123456789abcdef",
                "phi.encryption.pbkdf2-iterations=5000")
            .run(context -> {
                assertThat(context).hasSingleBean(MasterKey.class);
                assertThat(context.getBean(KeyDerivation.class))
                    .isInstanceOfSatisfying(Pbkdf2KeyDerivation.class,
                        derivation -> assertThat(derivation.getIterations()).isEqualTo(5000));
            });
    }

    @Test
    void tooFewIterationsFailValidation() {
        contextRunner
            .withPropertyValues(
                "phi.encryption.master-key=config-test-master-key-0123456789abcdef",
                "phi.encryption.pbkdf2-iterations=10")
            .run(context -> {
                assertThat(context).hasFailed();
                assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(BindValidationException.class);
            });
    }

    @Test
    void auditDefaultsAreFailClosed() {
        contextRunner
            .withPropertyValues("phi.encryption.master-key=config-test-master-key-0123456789abcdef")
            .run(context -> {
                PhiProtectionProperties properties = context.getBean(PhiProtectionProperties.class);
                assertThat(properties.getAudit().getFailurePolicy().name()).isEqualTo("FAIL_CLOSED");
                assertThat(properties.getSession().getLifetime().toHours()).isEqualTo(12);
            });
    }
}
