package com.numaansystems.obo.service;

import com.numaansystems.obo.client.GraphClient;
import com.numaansystems.obo.client.SearchClient;
import com.numaansystems.obo.config.OboProperties;
import com.numaansystems.obo.exception.DownstreamException;
import com.numaansystems.obo.exception.SearchNotConfiguredException;
import com.numaansystems.obo.exception.TokenExchangeException;
import com.numaansystems.obo.model.AuthorizationFilter;
import com.numaansystems.obo.model.ExchangeResult;
import com.numaansystems.obo.model.RequestState;
import com.numaansystems.obo.model.SearchAuthMode;
import com.numaansystems.obo.model.SearchCredential;
import com.numaansystems.obo.model.SearchQuery;
import com.numaansystems.obo.model.SearchResult;
import com.numaansystems.obo.model.TokenClaims;
import com.numaansystems.obo.model.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Drives one gateway request through claims extraction, token exchange,
 * filter construction and the downstream call.
 *
 * <h2>Routes</h2>
 * <table>
 *   <caption>Route variants</caption>
 *   <tr><th>Route</th><th>Exchange</th><th>Manual filter</th><th>Credential</th></tr>
 *   <tr><td>profile</td><td>Graph scopes</td><td>no</td><td>bearer</td></tr>
 *   <tr><td>search</td><td>Search scopes</td><td>yes</td><td>bearer</td></tr>
 *   <tr><td>search-simple</td><td>none</td><td>yes</td><td>API key</td></tr>
 *   <tr><td>search-unified</td><td>Search scopes in OBO mode</td><td>no</td><td>bearer + query-time header, or API key</td></tr>
 * </table>
 *
 * <p>Failures are thrown as {@link com.numaansystems.obo.exception.OboGatewayException}
 * subclasses and rendered by the controller advice. Nothing is retried. A
 * rejected exchange ends the request before any downstream call.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Service
public class OboOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(OboOrchestrator.class);

    static final String QUERY_TIME_DESCRIPTION =
            "Query-time access control: Azure AI Search evaluates GroupIds/UserIds based on user's token";

    private final ClaimsExtractor claimsExtractor;
    private final TokenExchangeService tokenExchangeService;
    private final AuthorizationFilterBuilder filterBuilder;
    private final GraphClient graphClient;
    private final SearchClient searchClient;
    private final OboProperties properties;

    public OboOrchestrator(ClaimsExtractor claimsExtractor,
                           TokenExchangeService tokenExchangeService,
                           AuthorizationFilterBuilder filterBuilder,
                           GraphClient graphClient,
                           SearchClient searchClient,
                           OboProperties properties) {
        this.claimsExtractor = claimsExtractor;
        this.tokenExchangeService = tokenExchangeService;
        this.filterBuilder = filterBuilder;
        this.graphClient = graphClient;
        this.searchClient = searchClient;
        this.properties = properties;
    }

    /**
     * Exchanges the token for Graph, reads the profile and group memberships and
     * compares the incoming token with the OBO token.
     *
     * @param userToken the caller's access token
     * @return the response body
     */
    public Map<String, Object> profile(String userToken) {
        return run("profile", trace -> {
            TokenClaims incoming = claimsExtractor.extract(userToken);
            trace.moveTo(RequestState.CLAIMS_EXTRACTED);

            List<String> scopes = properties.graph().scopes();
            String graphToken = exchange(trace, userToken, scopes, "OBO token acquisition failed",
                    "Check that the API registration has the delegated Microsoft Graph permissions and that they are consented");
            Optional<TokenClaims> obo = claimsExtractor.tryExtract(graphToken);

            trace.moveTo(RequestState.CALLING);
            UserProfile profile = graphClient.fetchProfile(graphToken);
            List<String> queriedGroups = graphClient.fetchGroupMemberships(graphToken);
            logger.info("Profile read for {} with {} group(s) in token and {} via Graph",
                    incoming.userPrincipalName(), incoming.groupCount(), queriedGroups.size());

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("message", "Hello World from the OBO API!");
            body.put("flow", "On-Behalf-Of (OBO) Flow Successful");
            body.put("user_info", userInfo(profile));

            Map<String, Object> incomingInfo = tokenInfo(incoming);
            incomingInfo.put("groups", incoming.groups());
            incomingInfo.put("roles", incoming.roles());
            incomingInfo.put("group_count", incoming.groupCount());
            incomingInfo.put("token_type", "Access token for the OBO API");
            body.put("incoming_token_info", incomingInfo);

            Map<String, Object> oboInfo = obo.map(this::tokenInfo).orElseGet(LinkedHashMap::new);
            List<String> groupsInToken = obo.map(TokenClaims::groups).orElse(List.of());
            oboInfo.put("groups_in_token", groupsInToken);
            oboInfo.put("groups_in_token_count", groupsInToken.size());
            oboInfo.put("groups_queried_via_api", queriedGroups);
            oboInfo.put("groups_queried_count", queriedGroups.size());
            oboInfo.put("roles", obo.map(TokenClaims::roles).orElse(List.of()));
            oboInfo.put("token_type", "OBO Access token for Microsoft Graph");
            oboInfo.put("obtained_via", "On-Behalf-Of flow");
            oboInfo.put("note", "Graph tokens don't include group claims. Groups must be queried via /me/memberOf API.");
            body.put("obo_token_info", oboInfo);

            Map<String, Object> comparison = new LinkedHashMap<>();
            Object oboAudience = obo.map(TokenClaims::audienceValue).orElse(null);
            comparison.put("same_user", obo.isPresent() && Objects.equals(incoming.objectId(), obo.get().objectId()));
            comparison.put("different_audience", !Objects.equals(incoming.audienceValue(), oboAudience));
            comparison.put("incoming_audience", incoming.audienceValue());
            comparison.put("obo_audience", oboAudience);
            body.put("token_comparison", comparison);
            body.put("description", "This shows both the incoming token and the OBO token (for Graph)");
            return body;
        });
    }

    /**
     * Exchanges the token for Search and filters results by the groups in the
     * incoming token.
     *
     * @param userToken the caller's access token
     * @param queryText free-text query, null for all documents
     * @return the response body
     */
    public Map<String, Object> search(String userToken, String queryText) {
        return run("search", trace -> {
            TokenClaims claims = claimsExtractor.extract(userToken);
            trace.moveTo(RequestState.CLAIMS_EXTRACTED);

            String searchToken = exchange(trace, userToken, properties.search().scopes(),
                    "OBO token acquisition failed for AI Search",
                    "Check if Azure AD permission 'https://search.azure.com/user_impersonation' is granted and consented");

            AuthorizationFilter filter = buildFilter(trace, claims);
            SearchQuery query = basicQuery(queryText);

            trace.moveTo(RequestState.CALLING);
            SearchResult result = searchClient.search(new SearchCredential.Bearer(searchToken, false), query, filter);

            return searchBody("AI Search completed successfully using OBO flow",
                    "SPA -> OBO API (OBO) -> Azure AI Search", userContext(claims), filterInfo(filter), query, result);
        });
    }

    /**
     * Filters results by the groups in the incoming token and queries the index
     * with the static API key. No token exchange takes place.
     *
     * @param userToken the caller's access token
     * @param queryText free-text query, null for all documents
     * @return the response body
     */
    public Map<String, Object> searchSimple(String userToken, String queryText) {
        return run("search-simple", trace -> {
            SearchCredential credential = apiKeyCredential(
                    "Set SEARCH_API_KEY environment variable with your AI Search admin or query key");

            TokenClaims claims = claimsExtractor.extract(userToken);
            trace.moveTo(RequestState.CLAIMS_EXTRACTED);
            logger.info("User: {}, Groups: {}", claims.userPrincipalName(), claims.groupCount());

            AuthorizationFilter filter = buildFilter(trace, claims);
            SearchQuery query = basicQuery(queryText);

            trace.moveTo(RequestState.CALLING);
            SearchResult result = searchClient.search(credential, query, filter);

            return searchBody("AI Search completed successfully (using API key)",
                    "SPA -> OBO API -> Azure AI Search (with API key)", userContext(claims), filterInfo(filter), query, result);
        });
    }

    /**
     * Queries the index without a manual filter, relying on query-time access
     * control. The credential depends on {@code obo.search.auth-mode}.
     *
     * @param userToken the caller's access token
     * @param queryText free-text query, null for all documents
     * @return the response body
     */
    public Map<String, Object> searchUnified(String userToken, String queryText) {
        SearchAuthMode mode = properties.search().authMode();
        return run("search-unified", trace -> {
            // Groups come from the incoming token; the Search OBO token carries none
            TokenClaims claims = claimsExtractor.extract(userToken);
            trace.moveTo(RequestState.CLAIMS_EXTRACTED);
            logger.info("Unified search with mode {}: user {} (OID: {}), groups from incoming token: {}",
                    mode, claims.userPrincipalName(), claims.objectId(), claims.groupCount());

            SearchCredential credential;
            Optional<TokenClaims> searchClaims = Optional.empty();
            if (mode == SearchAuthMode.OBO) {
                String searchToken = exchange(trace, userToken, properties.search().scopes(),
                        "OBO token acquisition failed for AI Search",
                        "The 'invalid_grant' error often means the Azure AD permission isn't configured or consented. "
                                + "Try setting SEARCH_AUTH_MODE=API_KEY as a workaround.");
                searchClaims = claimsExtractor.tryExtract(searchToken);
                credential = new SearchCredential.Bearer(searchToken, true);
            } else {
                credential = apiKeyCredential("Set SEARCH_API_KEY environment variable or use SEARCH_AUTH_MODE=OBO");
            }

            SearchQuery query = projectedQuery(queryText);
            trace.moveTo(RequestState.CALLING);
            SearchResult result;
            try {
                result = searchClient.search(credential, query, null);
            } catch (DownstreamException e) {
                throw e.withAuthMethod(credential.describe());
            }

            Map<String, Object> filtering = new LinkedHashMap<>();
            filtering.put("method", "query-time access control");
            filtering.put("description", QUERY_TIME_DESCRIPTION);
            filtering.put("note", "Azure AI Search evaluates access based on x-ms-query-source-authorization header");

            Map<String, Object> userContext = userContext(claims);
            userContext.put("groups_source", "Incoming token (not from OBO token)");
            Map<String, Object> body = searchBody("AI Search completed successfully",
                    "SPA -> OBO API (" + credential.describe() + ") -> Azure AI Search",
                    userContext, filtering, query, result);
            body.put("authentication", credential.describe());

            searchClaims.ifPresent(search -> {
                Map<String, Object> incomingInfo = tokenInfo(claims);
                incomingInfo.put("oid", claims.objectId());
                incomingInfo.put("upn", claims.userPrincipalName());
                incomingInfo.put("groups", claims.groups());
                incomingInfo.put("group_count", claims.groupCount());
                incomingInfo.put("token_type", "Incoming Access Token (contains groups)");
                body.put("incoming_token_info", incomingInfo);

                Map<String, Object> searchInfo = tokenInfo(search);
                searchInfo.put("oid", search.objectId());
                searchInfo.put("upn", search.userPrincipalName());
                searchInfo.put("roles", search.roles());
                searchInfo.put("groups", search.groups());
                searchInfo.put("exp", search.expiresAt());
                searchInfo.put("token_type", "OBO Access Token for Azure AI Search (scoped for search, no groups)");
                body.put("search_token_info", searchInfo);
            });
            return body;
        });
    }

    private Map<String, Object> run(String route, Function<RequestTrace, Map<String, Object>> steps) {
        RequestTrace trace = new RequestTrace(route);
        try {
            Map<String, Object> body = steps.apply(trace);
            trace.moveTo(RequestState.RESPONDED);
            return body;
        } catch (RuntimeException e) {
            trace.fail(e);
            throw e;
        }
    }

    private String exchange(RequestTrace trace, String userToken, List<String> scopes,
                            String error, String suggestion) {
        trace.moveTo(RequestState.EXCHANGING);
        ExchangeResult result = tokenExchangeService.exchange(userToken, scopes);
        if (result instanceof ExchangeResult.Success success) {
            trace.moveTo(RequestState.EXCHANGED);
            return success.accessToken();
        }
        trace.moveTo(RequestState.EXCHANGE_FAILED);
        ExchangeResult.Failure failure = (ExchangeResult.Failure) result;
        logger.warn("OBO error on {}: {} - {} (correlation id {})",
                trace.getRoute(), failure.errorCode(), failure.errorDescription(), failure.correlationId());
        throw new TokenExchangeException(error, failure, scopes, suggestion);
    }

    private AuthorizationFilter buildFilter(RequestTrace trace, TokenClaims claims) {
        if (claims.groupsOverage()) {
            logger.warn("Token for {} has a groups overage; the group filter only sees the groups in the token",
                    claims.userPrincipalName());
        }
        AuthorizationFilter filter = filterBuilder.buildFilter(claims.groups());
        trace.moveTo(RequestState.FILTER_BUILT);
        logger.info("Security filter: {}", filter.expression());
        return filter;
    }

    private SearchCredential apiKeyCredential(String instruction) {
        if (!properties.search().hasApiKey()) {
            logger.warn("API-key search requested but SEARCH_API_KEY is not configured");
            throw new SearchNotConfiguredException(instruction);
        }
        return new SearchCredential.ApiKey(properties.search().apiKey());
    }

    private SearchQuery basicQuery(String text) {
        OboProperties.Query defaults = properties.query();
        return new SearchQuery(text, SearchQuery.MATCH_ALL, defaults.top(), defaults.queryType(), null);
    }

    private SearchQuery projectedQuery(String text) {
        OboProperties.Query defaults = properties.query();
        return new SearchQuery(text, defaults.selectFields(), defaults.top(), defaults.queryType(), defaults.orderBy());
    }

    private Map<String, Object> searchBody(String message, String flow, Map<String, Object> userContext,
                                           Map<String, Object> filtering, SearchQuery query, SearchResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", message);
        body.put("flow", flow);
        body.put("user_context", userContext);
        body.put("security_filtering", filtering);
        body.put("search_query", query.text());
        body.put("result_count", result.resultCount());
        body.put("results", result.documents());
        return body;
    }

    private Map<String, Object> userContext(TokenClaims claims) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("oid", claims.objectId());
        context.put("upn", claims.userPrincipalName());
        context.put("groups", claims.groups());
        context.put("group_count", claims.groupCount());
        if (claims.groupsOverage()) {
            context.put("groups_overage", true);
        }
        return context;
    }

    private Map<String, Object> filterInfo(AuthorizationFilter filter) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("filter", filter.expression());
        info.put("description", filter.description());
        return info;
    }

    private Map<String, Object> tokenInfo(TokenClaims claims) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("aud", claims.audienceValue());
        info.put("iss", claims.issuer());
        info.put("scp", claims.scopes());
        info.put("appid", claims.appId());
        return info;
    }

    private Map<String, Object> userInfo(UserProfile profile) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("displayName", profile.displayName());
        info.put("userPrincipalName", profile.userPrincipalName());
        info.put("jobTitle", profile.jobTitle());
        info.put("mail", profile.mail());
        info.put("id", profile.id());
        return info;
    }
}
