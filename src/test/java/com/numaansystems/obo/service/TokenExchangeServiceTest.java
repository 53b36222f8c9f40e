package com.numaansystems.obo.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.numaansystems.obo.exception.TransportException;
import com.numaansystems.obo.model.ExchangeResult;
import com.numaansystems.obo.testing.TestOboProperties;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.ClassicHttpRequest;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.SocketTimeoutException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static com.numaansystems.obo.testing.HttpClientStubs.anyHandler;
import static com.numaansystems.obo.testing.HttpClientStubs.failWith;
import static com.numaansystems.obo.testing.HttpClientStubs.respondWith;
import static com.numaansystems.obo.testing.HttpClientStubs.response;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for TokenExchangeService.
 *
 * <p>Tests the OBO request sent to the token endpoint and the mapping of
 * provider answers to exchange results.</p>
 */
@ExtendWith(MockitoExtension.class)
class TokenExchangeServiceTest {

    private static final List<String> SEARCH_SCOPES = List.of("https://search.azure.com/.default");

    @Mock
    private CloseableHttpClient httpClient;

    private TokenExchangeService exchangeService;

    @BeforeEach
    void setUp() {
        exchangeService = new TokenExchangeService(httpClient, new ObjectMapper(), TestOboProperties.create());
    }

    @Test
    @DisplayName("Should return the access token on a successful exchange")
    void testSuccess() throws Exception {
        // Arrange
        respondWith(httpClient, response(200,
                "{\"token_type\":\"Bearer\",\"expires_in\":3599,\"access_token\":\"obo-token\"}"));

        // Act
        ExchangeResult result = exchangeService.exchange("user-token", SEARCH_SCOPES);

        // Assert
        ExchangeResult.Success success = assertInstanceOf(ExchangeResult.Success.class, result);
        assertEquals("obo-token", success.accessToken());
        assertTrue(result.isSuccess());
    }

    @Test
    @DisplayName("Should send a jwt-bearer on_behalf_of request to the tenant token endpoint")
    void testRequestShape() throws Exception {
        // Arrange
        respondWith(httpClient, response(200, "{\"access_token\":\"obo-token\"}"));

        // Act
        exchangeService.exchange("user-token", List.of("scope-a", "scope-b"));

        // Assert
        ArgumentCaptor<ClassicHttpRequest> captor = ArgumentCaptor.forClass(ClassicHttpRequest.class);
        verify(httpClient, times(1)).execute(captor.capture(), anyHandler());
        ClassicHttpRequest request = captor.getValue();
        assertEquals("POST", request.getMethod());
        assertEquals(TestOboProperties.TOKEN_ENDPOINT, request.getUri().toString());

        String form = URLDecoder.decode(EntityUtils.toString(request.getEntity()), StandardCharsets.UTF_8);
        assertTrue(form.contains("grant_type=urn:ietf:params:oauth:grant-type:jwt-bearer"));
        assertTrue(form.contains("client_id=client-123"));
        assertTrue(form.contains("client_secret=secret-123"));
        assertTrue(form.contains("assertion=user-token"));
        assertTrue(form.contains("scope=scope-a scope-b"));
        assertTrue(form.contains("requested_token_use=on_behalf_of"));
    }

    @Test
    @DisplayName("Should return the provider error instead of throwing")
    void testProviderError() throws Exception {
        // Arrange
        respondWith(httpClient, response(400, "{\"error\":\"invalid_grant\","
                + "\"error_description\":\"AADSTS65001: consent required\","
                + "\"correlation_id\":\"corr-1\"}"));

        // Act
        ExchangeResult result = exchangeService.exchange("user-token", SEARCH_SCOPES);

        // Assert
        ExchangeResult.Failure failure = assertInstanceOf(ExchangeResult.Failure.class, result);
        assertEquals("invalid_grant", failure.errorCode());
        assertEquals("AADSTS65001: consent required", failure.errorDescription());
        assertEquals("corr-1", failure.correlationId());
        assertFalse(result.isSuccess());
    }

    @Test
    @DisplayName("Should leave the correlation id empty when the provider omits it")
    void testProviderErrorWithoutCorrelationId() throws Exception {
        respondWith(httpClient, response(400, "{\"error\":\"invalid_scope\"}"));

        ExchangeResult.Failure failure =
                assertInstanceOf(ExchangeResult.Failure.class, exchangeService.exchange("user-token", SEARCH_SCOPES));

        assertEquals("invalid_scope", failure.errorCode());
        assertNull(failure.errorDescription());
        assertNull(failure.correlationId());
    }

    @Test
    @DisplayName("Should raise a transport error when the token endpoint times out")
    void testTimeout() throws Exception {
        failWith(httpClient, new SocketTimeoutException("Read timed out"));

        TransportException ex = assertThrows(TransportException.class,
                () -> exchangeService.exchange("user-token", SEARCH_SCOPES));
        assertEquals(500, ex.getStatus());
    }

    @Test
    @DisplayName("Should raise a transport error for a non-JSON answer")
    void testNonJsonResponse() throws Exception {
        respondWith(httpClient, response(502, "<html>Bad Gateway</html>"));

        assertThrows(TransportException.class, () -> exchangeService.exchange("user-token", SEARCH_SCOPES));
    }

    @Test
    @DisplayName("Should raise a transport error when the answer has neither token nor error")
    void testUnrecognizedResponse() throws Exception {
        respondWith(httpClient, response(200, "{\"token_type\":\"Bearer\"}"));

        assertThrows(TransportException.class, () -> exchangeService.exchange("user-token", SEARCH_SCOPES));
    }
}
