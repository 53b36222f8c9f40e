package com.numaansystems.obo.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.security.SecurityRequirement;
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
 * <p>The document declares a bearer scheme so the user's access token can be
 * pasted into the UI and sent with every try-out request.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Configuration
public class SwaggerConfig {

    private static final String BEARER_SCHEME = "bearerAuth";

    /**
     * Configures OpenAPI documentation metadata.
     *
     * @return OpenAPI configuration with title, description, version, contact info and bearer scheme
     */
    @Bean
    public OpenAPI oboGatewayOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("OBO Search Gateway API")
                .description("On-Behalf-Of token exchange for Microsoft Graph and Azure AI Search with group based filtering")
                .version("0.1.0")
                .contact(new Contact()
                    .name("Numaan Systems")
                    .email("support@numaansystems.com"))
                .license(new License()
                    .name("MIT License")
                    .url("https://opensource.org/licenses/MIT")))
            .components(new Components()
                .addSecuritySchemes(BEARER_SCHEME, new SecurityScheme()
                    .type(SecurityScheme.Type.HTTP)
                    .scheme("bearer")
                    .bearerFormat("JWT")))
            .addSecurityItem(new SecurityRequirement().addList(BEARER_SCHEME));
    }
}
