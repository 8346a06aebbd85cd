package com.numaansystems.custody.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Swagger/OpenAPI configuration for API documentation.
 *
 * <h2>Access</h2>
 * <ul>
 *   <li>Swagger UI: /swagger-ui.html</li>
 *   <li>OpenAPI JSON: /api-docs</li>
 * </ul>
 *
 * <p>Both are internal endpoints and require the {@code X-API-Key} header.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Configuration
public class SwaggerConfig {

    /**
     * Configures OpenAPI documentation metadata.
     *
     * @return OpenAPI configuration with title, description, version, and the API key scheme
     */
    @Bean
    public OpenAPI custodyOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Token Custody API")
                .description("Holds Google OAuth credentials for users and hands out valid access tokens "
                    + "to internal services")
                .version("0.1.0")
                .contact(new Contact()
                    .name("Numaan Systems")
                    .email("support@numaansystems.com"))
                .license(new License()
                    .name("MIT License")
                    .url("https://opensource.org/licenses/MIT")))
            .components(new Components()
                .addSecuritySchemes("internalApiKey", new SecurityScheme()
                    .type(SecurityScheme.Type.APIKEY)
                    .in(SecurityScheme.In.HEADER)
                    .name("X-API-Key")));
    }
}
