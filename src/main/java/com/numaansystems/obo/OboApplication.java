package com.numaansystems.obo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * OBO Search Gateway Application
 *
 * <p>This Spring Boot application sits between a single-page application and
 * two Microsoft services. It accepts the user's delegated access token,
 * exchanges it through the On-Behalf-Of (OBO) flow for service-specific tokens,
 * and calls Microsoft Graph and Azure AI Search on the user's behalf.</p>
 *
 * <h2>Purpose</h2>
 * <ul>
 *   <li>Exchanges user tokens for Graph and Search tokens without user interaction</li>
 *   <li>Reads group and role claims from the incoming token</li>
 *   <li>Builds per-user security filters for search queries</li>
 *   <li>Supports query-time access control and API-key search modes</li>
 *   <li>Returns token diagnostics alongside every result</li>
 * </ul>
 *
 * <h2>Flow</h2>
 * <ol>
 *   <li>SPA acquires an access token for this API and calls /api/**</li>
 *   <li>Gateway decodes the token's claims (no signature check)</li>
 *   <li>Gateway exchanges the token at the Entra ID token endpoint</li>
 *   <li>Gateway calls the downstream service with the new token</li>
 *   <li>Results are merged with claim diagnostics and returned</li>
 * </ol>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class OboApplication {

    /**
     * Main entry point for the OBO Search Gateway.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(OboApplication.class, args);
    }
}
