package com.numaansystems.obo.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.numaansystems.obo.config.OboProperties;
import com.numaansystems.obo.exception.DownstreamException;
import com.numaansystems.obo.exception.TransportException;
import com.numaansystems.obo.model.AuthorizationFilter;
import com.numaansystems.obo.model.SearchCredential;
import com.numaansystems.obo.model.SearchQuery;
import com.numaansystems.obo.model.SearchResult;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Queries an Azure AI Search index.
 *
 * <h2>Credentials</h2>
 * <ul>
 *   <li>{@link SearchCredential.Bearer}: OBO token in {@code Authorization}. With
 *       query-time authorization the same token also goes into
 *       {@code x-ms-query-source-authorization}, and the index trims results to
 *       the documents the user may see.</li>
 *   <li>{@link SearchCredential.ApiKey}: static key in the {@code api-key} header.</li>
 * </ul>
 *
 * <p>A restricting {@link AuthorizationFilter} is sent as {@code filter}. Without
 * one no filter field is sent at all.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Component
public class SearchClient {

    private static final Logger logger = LoggerFactory.getLogger(SearchClient.class);

    static final String API_KEY_HEADER = "api-key";
    static final String QUERY_SOURCE_AUTHORIZATION_HEADER = "x-ms-query-source-authorization";
    static final String ODATA_COUNT = "@odata.count";

    private static final TypeReference<List<Map<String, Object>>> DOCUMENTS = new TypeReference<>() {
    };

    private final CloseableHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final OboProperties.Search search;
    private final boolean includeTotalCount;

    public SearchClient(CloseableHttpClient httpClient, ObjectMapper objectMapper, OboProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.search = properties.search();
        this.includeTotalCount = properties.query().includeTotalCount();
    }

    /**
     * Runs a search against the configured index.
     *
     * @param credential how to authenticate to the search service
     * @param query the query and its fixed parameters
     * @param filter security filter, null or unrestricted to send none
     * @return the normalised result
     * @throws DownstreamException if the search service answers with a non-200 status
     * @throws TransportException if the service cannot be reached or returns unreadable JSON
     */
    public SearchResult search(SearchCredential credential, SearchQuery query, AuthorizationFilter filter) {
        HttpPost post = new HttpPost(search.searchUrl());
        applyCredential(post, credential);
        post.setHeader(HttpHeaders.ACCEPT, "application/json");
        post.setEntity(new StringEntity(payload(query, filter), ContentType.APPLICATION_JSON));

        logger.info("Calling AI Search index '{}' with {} (filter {})", search.index(), credential.describe(),
                filter != null && filter.isRestricted() ? "applied" : "none");

        DownstreamResponse response;
        try {
            response = httpClient.execute(post, DownstreamResponse::read);
        } catch (IOException e) {
            logger.error("AI Search call failed: {}", e.getMessage());
            throw new TransportException("AI Search unreachable: " + e.getMessage(), e);
        }

        logger.info("AI Search response status: {}", response.status());
        if (!response.isOk()) {
            logger.warn("AI Search error ({}): {}", response.status(), response.body());
            throw new DownstreamException("AI Search request failed", response.status(), response.body(),
                    suggestionFor(response.status()));
        }
        return toResult(response);
    }

    private void applyCredential(HttpPost post, SearchCredential credential) {
        if (credential instanceof SearchCredential.Bearer bearer) {
            post.setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + bearer.accessToken());
            if (bearer.queryTimeAuthorization()) {
                post.setHeader(QUERY_SOURCE_AUTHORIZATION_HEADER, bearer.accessToken());
            }
        } else if (credential instanceof SearchCredential.ApiKey apiKey) {
            post.setHeader(API_KEY_HEADER, apiKey.key());
        }
    }

    String payload(SearchQuery query, AuthorizationFilter filter) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("search", query.text());
        body.put("select", query.select());
        body.put("top", query.top());
        body.put("queryType", query.queryType());
        if (query.orderBy() != null && !query.orderBy().isBlank()) {
            body.put("orderby", query.orderBy());
        }
        if (filter != null && filter.isRestricted()) {
            body.put("filter", filter.expression());
        }
        if (includeTotalCount) {
            body.put("count", true);
        }
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Search payload could not be serialized", e);
        }
    }

    private SearchResult toResult(DownstreamResponse response) {
        JsonNode json;
        try {
            json = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new TransportException("AI Search returned unreadable JSON", e);
        }
        List<Map<String, Object>> documents;
        try {
            documents = json.has("value") ? objectMapper.convertValue(json.get("value"), DOCUMENTS) : List.of();
        } catch (IllegalArgumentException e) {
            throw new TransportException("AI Search returned an unreadable result list", e);
        }
        Long reportedCount = json.hasNonNull(ODATA_COUNT) ? json.get(ODATA_COUNT).asLong() : null;
        return new SearchResult(response.status(), documents, reportedCount);
    }

    private static String suggestionFor(int status) {
        if (status == 403) {
            return "403 Forbidden: The OBO token doesn't have permission to access the search index. "
                    + "Ensure the user (or service principal) has 'Search Index Data Reader' role assigned on the "
                    + "Azure AI Search service. For user-based OBO, the signed-in user needs the role, not just the "
                    + "service principal.";
        }
        return "HTTP " + status + " error from Azure AI Search";
    }
}
