package com.numaansystems.obo.config;

import com.numaansystems.obo.model.EmptyGroupsPolicy;
import com.numaansystems.obo.model.SearchAuthMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Static gateway configuration, bound once from the {@code obo.*} properties.
 *
 * <p>The record is immutable and passed to every component through its
 * constructor. Values usually come from environment variables referenced in
 * {@code application.yml}:</p>
 * <pre>
 * obo:
 *   azure-ad:
 *     tenant-id: ${AZURE_TENANT_ID}
 *     client-id: ${AZURE_CLIENT_ID}
 *     client-secret: ${AZURE_CLIENT_SECRET}
 *   search:
 *     endpoint: https://my-search.search.windows.net
 *     index: documents
 *     auth-mode: OBO
 * </pre>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@ConfigurationProperties(prefix = "obo")
public record OboProperties(AzureAd azureAd, Graph graph, Search search, Query query, Http http, Cors cors) {

    /**
     * Confidential client registration used for the OBO exchange.
     */
    public record AzureAd(String tenantId, String clientId, String clientSecret, String authority) {

        public String tokenEndpoint() {
            String base = authority.endsWith("/") ? authority.substring(0, authority.length() - 1) : authority;
            return base + "/oauth2/v2.0/token";
        }

        @Override
        public String toString() {
            return "AzureAd[tenantId=" + tenantId + ", clientId=" + clientId + ", authority=" + authority + "]";
        }
    }

    public record Graph(String baseUrl, List<String> scopes, int maxMembershipPages) {

        public Graph {
            scopes = scopes == null ? List.of() : List.copyOf(scopes);
            if (maxMembershipPages < 1) {
                maxMembershipPages = 1;
            }
        }
    }

    public record Search(String endpoint, String index, String apiVersion, List<String> scopes,
                         String apiKey, SearchAuthMode authMode, Filter filter) {

        public Search {
            scopes = scopes == null ? List.of() : List.copyOf(scopes);
            if (authMode == null) {
                authMode = SearchAuthMode.OBO;
            }
            if (filter == null) {
                filter = new Filter(null, true, null);
            }
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }

        public String searchUrl() {
            return String.format("%s/indexes/%s/docs/search?api-version=%s", endpoint, index, apiVersion);
        }

        @Override
        public String toString() {
            return "Search[endpoint=" + endpoint + ", index=" + index + ", apiVersion=" + apiVersion
                    + ", authMode=" + authMode + ", apiKeyConfigured=" + hasApiKey() + "]";
        }
    }

    /**
     * Settings for the manual group filter.
     *
     * @param field the collection field holding group ids on each document
     * @param escapeQuotes double single quotes inside group ids before building the filter
     * @param emptyGroupsPolicy what to do for users without groups
     */
    public record Filter(String field, boolean escapeQuotes, EmptyGroupsPolicy emptyGroupsPolicy) {

        public Filter {
            if (field == null || field.isBlank()) {
                field = "security_groups";
            }
            if (emptyGroupsPolicy == null) {
                emptyGroupsPolicy = EmptyGroupsPolicy.SHOW_ALL;
            }
        }
    }

    /**
     * Fixed query parameters sent with every search.
     */
    public record Query(int top, String queryType, String orderBy, String selectFields, boolean includeTotalCount) {

        public Query {
            if (top < 1) {
                top = 50;
            }
            if (queryType == null || queryType.isBlank()) {
                queryType = "simple";
            }
        }
    }

    public record Http(Duration connectTimeout, Duration responseTimeout, int maxConnections) {

        public Http {
            if (connectTimeout == null) {
                connectTimeout = Duration.ofSeconds(10);
            }
            if (responseTimeout == null) {
                responseTimeout = Duration.ofSeconds(30);
            }
            if (maxConnections < 1) {
                maxConnections = 50;
            }
        }
    }

    public record Cors(List<String> allowedOrigins) {

        public Cors {
            allowedOrigins = allowedOrigins == null ? List.of() : List.copyOf(allowedOrigins);
        }
    }
}
