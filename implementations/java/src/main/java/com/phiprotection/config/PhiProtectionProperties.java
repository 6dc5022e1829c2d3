package com.phiprotection.config;

import com.phiprotection.infrastructure.audit.AuditFailurePolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Externalized settings under the {@code phi} prefix.
 *
 * Secrets have no defaults; they are resolved from {@code PHI_MASTER_KEY} and
 * {@code PHI_SESSION_SECRET} in {@code application.yml}.
 */
@Validated
@ConfigurationProperties(prefix = "phi")
@Getter
@Setter
public class PhiProtectionProperties {

    @Valid
    @NotNull
    private Encryption encryption = new Encryption();

    @Valid
    @NotNull
    private Session session = new Session();

    @Valid
    @NotNull
    private Audit audit = new Audit();

    @Valid
    @NotNull
    private Access access = new Access();

    @Getter
    @Setter
    public static class Encryption {
        private String masterKey;

        @Min(1000)
        private int pbkdf2Iterations = 100_000;

        @Min(1)
        private int maxConcurrentDerivations = Runtime.getRuntime().availableProcessors();
    }

    @Getter
    @Setter
    public static class Session {
        private String secret;

        @NotNull
        private Duration lifetime = Duration.ofHours(12);

        @NotBlank
        private String cookieName = "phi_session";
    }

    @Getter
    @Setter
    public static class Audit {
        @NotNull
        private AuditFailurePolicy failurePolicy = AuditFailurePolicy.FAIL_CLOSED;

        @NotNull
        private Duration timeout = Duration.ofSeconds(5);

        @Min(1)
        private int poolSize = 4;

        @Min(0)
        private int queueCapacity = 500;
    }

    @Getter
    @Setter
    public static class Access {
        @NotBlank
        private String loginPath = "/login";

        private List<String> publicPaths = new ArrayList<>(List.of(
            "/", "/login", "/patient-login", "/auth-redirect", "/create-account",
            "/verify-account", "/shared", "/actuator/health", "/v3/api-docs", "/swagger-ui",
            "/swagger-ui.html", "/error"));

        private List<String> protectedPaths = new ArrayList<>(List.of(
            "/api", "/dashboard", "/staff", "/patients", "/dictation", "/admin", "/pumpdrive"));

        private Set<String> adminSubjects = new HashSet<>();

        /**
         * Accounts allowed to log in. Password hashes are BCrypt.
         */
        @Valid
        private List<Account> accounts = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Account {
        @NotBlank
        private String subjectId;

        @NotBlank
        private String passwordHash;

        private String displayName;
    }
}
