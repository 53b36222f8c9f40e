package com.numaansystems.obo.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.numaansystems.obo.client.DownstreamResponse;
import com.numaansystems.obo.config.OboProperties;
import com.numaansystems.obo.exception.TransportException;
import com.numaansystems.obo.model.ExchangeResult;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.entity.UrlEncodedFormEntity;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.NameValuePair;
import org.apache.hc.core5.http.message.BasicNameValuePair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.oauth2.core.AuthorizationGrantType;
import org.springframework.security.oauth2.core.endpoint.OAuth2ParameterNames;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;

/**
 * Performs the OAuth 2.0 On-Behalf-Of token exchange against Entra ID.
 *
 * <p>The gateway authenticates as a confidential client (client id + secret)
 * and presents the user's access token as a JWT bearer assertion. Entra ID
 * answers with a new access token for the requested scopes, issued to the
 * same user, without any user interaction.</p>
 *
 * <h2>Request</h2>
 * <pre>
 * POST {authority}/oauth2/v2.0/token
 * grant_type=urn:ietf:params:oauth:grant-type:jwt-bearer
 * client_id=...&amp;client_secret=...
 * assertion={user token}
 * scope={space separated scopes}
 * requested_token_use=on_behalf_of
 * </pre>
 *
 * <h2>Outcome</h2>
 * <ul>
 *   <li>{@code access_token} in the response: {@link ExchangeResult.Success}</li>
 *   <li>{@code error} in the response: {@link ExchangeResult.Failure}, whatever the HTTP status</li>
 *   <li>Network failure, timeout or an unreadable response: {@link TransportException}</li>
 * </ul>
 *
 * <p>Each call makes exactly one attempt. Nothing is cached: every request
 * exchanges its own token.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Service
public class TokenExchangeService {

    private static final Logger logger = LoggerFactory.getLogger(TokenExchangeService.class);

    static final String REQUESTED_TOKEN_USE = "requested_token_use";
    static final String ON_BEHALF_OF = "on_behalf_of";
    static final String CORRELATION_ID = "correlation_id";

    private final CloseableHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final OboProperties.AzureAd azureAd;

    public TokenExchangeService(CloseableHttpClient httpClient, ObjectMapper objectMapper, OboProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.azureAd = properties.azureAd();
    }

    /**
     * Exchanges the user's token for a token scoped to a downstream resource.
     *
     * @param userToken the access token the caller presented to this API
     * @param targetScopes scopes of the downstream resource
     * @return success with the new token, or the provider's error
     * @throws TransportException if the token endpoint cannot be reached or its answer is not understood
     */
    public ExchangeResult exchange(String userToken, Collection<String> targetScopes) {
        String scope = String.join(" ", targetScopes);
        logger.info("Requesting OBO token for scopes [{}]", scope);

        HttpPost post = new HttpPost(azureAd.tokenEndpoint());
        post.setHeader(HttpHeaders.ACCEPT, "application/json");
        post.setEntity(new UrlEncodedFormEntity(formParameters(userToken, scope), StandardCharsets.UTF_8));

        DownstreamResponse response;
        try {
            response = httpClient.execute(post, DownstreamResponse::read);
        } catch (IOException e) {
            logger.error("OBO token request to {} failed: {}", azureAd.tokenEndpoint(), e.getMessage());
            throw new TransportException("Token endpoint unreachable: " + e.getMessage(), e);
        }

        return interpret(response, scope);
    }

    private List<NameValuePair> formParameters(String userToken, String scope) {
        return List.of(
                new BasicNameValuePair(OAuth2ParameterNames.GRANT_TYPE, AuthorizationGrantType.JWT_BEARER.getValue()),
                new BasicNameValuePair(OAuth2ParameterNames.CLIENT_ID, azureAd.clientId()),
                new BasicNameValuePair(OAuth2ParameterNames.CLIENT_SECRET, azureAd.clientSecret()),
                new BasicNameValuePair(OAuth2ParameterNames.ASSERTION, userToken),
                new BasicNameValuePair(OAuth2ParameterNames.SCOPE, scope),
                new BasicNameValuePair(REQUESTED_TOKEN_USE, ON_BEHALF_OF));
    }

    private ExchangeResult interpret(DownstreamResponse response, String scope) {
        JsonNode json;
        try {
            json = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new TransportException("Token endpoint returned a non-JSON response (HTTP " + response.status() + ")", e);
        }
        if (json == null || !json.isObject()) {
            throw new TransportException("Token endpoint returned an unexpected response (HTTP " + response.status() + ")");
        }

        String accessToken = text(json, OAuth2ParameterNames.ACCESS_TOKEN);
        if (accessToken != null && !accessToken.isBlank()) {
            logger.info("OBO token acquired for scopes [{}]", scope);
            return new ExchangeResult.Success(accessToken);
        }

        String error = text(json, OAuth2ParameterNames.ERROR);
        if (error != null) {
            ExchangeResult.Failure failure = new ExchangeResult.Failure(
                    error, text(json, OAuth2ParameterNames.ERROR_DESCRIPTION), text(json, CORRELATION_ID));
            logger.warn("OBO token request rejected: error={}, correlationId={}, scopes=[{}]",
                    failure.errorCode(), failure.correlationId(), scope);
            return failure;
        }

        throw new TransportException("Token endpoint response has neither access_token nor error (HTTP "
                + response.status() + ")");
    }

    private static String text(JsonNode json, String field) {
        JsonNode node = json.get(field);
        return node != null && !node.isNull() ? node.asText() : null;
    }
}
