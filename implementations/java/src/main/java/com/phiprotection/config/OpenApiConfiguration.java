package com.phiprotection.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation metadata and the session token security scheme.
 */
@Configuration
public class OpenApiConfiguration {

    public static final String SESSION_SCHEME = "sessionToken";

    @Bean
    public OpenAPI phiProtectionOpenApi() {
        return new OpenAPI()
            .info(new Info()
                .title("PHI Protection API")
                .description("Audited, encrypted access to patient and visit records")
                .version("1.0.0"))
            .components(new Components()
                .addSecuritySchemes(SESSION_SCHEME, new SecurityScheme()
                    .type(SecurityScheme.Type.HTTP)
                    .scheme("bearer")
                    .description("Signed session token; also accepted from the phi_session cookie")));
    }
}
