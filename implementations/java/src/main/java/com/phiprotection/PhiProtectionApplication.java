package com.phiprotection;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main application class for the PHI protection service.
 *
 * <p>Security features:
 *
 * <ul>
 *   <li><strong>Field-Level Encryption</strong>: AES-256-GCM, key derived per value with PBKDF2</li>
 *   <li><strong>Signed Sessions</strong>: HMAC-SHA256 tokens with expiry and revocation</li>
 *   <li><strong>Route Access Control</strong>: unclassified routes require authentication</li>
 *   <li><strong>Ownership Check</strong>: owner or admin only, denials audited</li>
 *   <li><strong>Audit Trail</strong>: every PHI access recorded, fail-closed by default</li>
 * </ul>
 *
 * <p>Startup is refused when the master key or the session secret is missing.
 *
 * @since 1.0.0
 */
@SpringBootApplication
@EnableTransactionManagement
@EnableAspectJAutoProxy
@Slf4j
public class PhiProtectionApplication {

    public static void main(String[] args) {
        SpringApplication.run(PhiProtectionApplication.class, args);

        log.info("""
            ╔═══════════════════════════════════════════════════════════╗
            ║  PHI Protection Service                                   ║
            ║  Encryption: AES-256-GCM / PBKDF2-SHA256                  ║
            ║  Sessions: HMAC-SHA256 SIGNED                             ║
            ║  Unclassified Routes: PROTECTED                           ║
            ║  Audit Trail: FAIL-CLOSED BY DEFAULT                      ║
            ╚═══════════════════════════════════════════════════════════╝
            """);
    }
}
