package com.numaansystems.obo.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.numaansystems.obo.exception.DownstreamException;
import com.numaansystems.obo.exception.TransportException;
import com.numaansystems.obo.model.UserProfile;
import com.numaansystems.obo.testing.TestOboProperties;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.ClassicHttpRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.ConnectException;
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
 * Unit tests for GraphClient.
 */
@ExtendWith(MockitoExtension.class)
class GraphClientTest {

    @Mock
    private CloseableHttpClient httpClient;

    private GraphClient graphClient;

    @BeforeEach
    void setUp() {
        graphClient = new GraphClient(httpClient, new ObjectMapper(), TestOboProperties.create());
    }

    @Test
    @DisplayName("Should read the profile with the OBO token as bearer credential")
    void testFetchProfile() throws Exception {
        // Arrange
        respondWith(httpClient, response(200, "{\"@odata.context\":\"ctx\",\"id\":\"user-1\","
                + "\"displayName\":\"Alice\",\"userPrincipalName\":\"alice@contoso.com\","
                + "\"jobTitle\":\"Engineer\",\"mail\":\"alice@contoso.com\",\"officeLocation\":\"HQ\"}"));

        // Act
        UserProfile profile = graphClient.fetchProfile("graph-token");

        // Assert
        assertEquals("user-1", profile.id());
        assertEquals("Alice", profile.displayName());
        assertEquals("alice@contoso.com", profile.userPrincipalName());
        assertEquals("Engineer", profile.jobTitle());

        ArgumentCaptor<ClassicHttpRequest> captor = ArgumentCaptor.forClass(ClassicHttpRequest.class);
        verify(httpClient).execute(captor.capture(), anyHandler());
        assertEquals("https://graph.test/v1.0/me", captor.getValue().getUri().toString());
        assertEquals("Bearer graph-token", captor.getValue().getFirstHeader("Authorization").getValue());
    }

    @Test
    @DisplayName("Should surface a non-200 profile answer as a downstream error")
    void testFetchProfileFailure() throws Exception {
        respondWith(httpClient, response(401, "{\"error\":{\"code\":\"InvalidAuthenticationToken\"}}"));

        DownstreamException ex = assertThrows(DownstreamException.class, () -> graphClient.fetchProfile("graph-token"));

        assertEquals(401, ex.getStatus());
        assertTrue(ex.getBody().contains("InvalidAuthenticationToken"));
        assertNotNull(ex.getSuggestion());
    }

    @Test
    @DisplayName("Should keep only group entries from memberOf")
    void testFetchGroupMemberships() throws Exception {
        // Arrange
        respondWith(httpClient, response(200, "{\"value\":["
                + "{\"@odata.type\":\"#microsoft.graph.group\",\"id\":\"g1\"},"
                + "{\"@odata.type\":\"#microsoft.graph.directoryRole\",\"id\":\"role-1\"},"
                + "{\"@odata.type\":\"#microsoft.graph.group\",\"id\":\"g2\"},"
                + "{\"@odata.type\":\"#microsoft.graph.administrativeUnit\",\"id\":\"au-1\"}]}"));

        // Act
        List<String> groups = graphClient.fetchGroupMemberships("graph-token");

        // Assert
        assertEquals(List.of("g1", "g2"), groups);
    }

    @Test
    @DisplayName("Should follow nextLink pages")
    void testFetchGroupMembershipsPaged() throws Exception {
        // Arrange
        respondWith(httpClient,
                response(200, "{\"value\":[{\"@odata.type\":\"#microsoft.graph.group\",\"id\":\"g1\"}],"
                        + "\"@odata.nextLink\":\"https://graph.test/v1.0/me/memberOf?$skiptoken=abc\"}"),
                response(200, "{\"value\":[{\"@odata.type\":\"#microsoft.graph.group\",\"id\":\"g2\"}]}"));

        // Act
        List<String> groups = graphClient.fetchGroupMemberships("graph-token");

        // Assert
        assertEquals(List.of("g1", "g2"), groups);
        ArgumentCaptor<ClassicHttpRequest> captor = ArgumentCaptor.forClass(ClassicHttpRequest.class);
        verify(httpClient, times(2)).execute(captor.capture(), anyHandler());
        assertEquals("https://graph.test/v1.0/me/memberOf?$skiptoken=abc",
                captor.getAllValues().get(1).getUri().toString());
    }

    @Test
    @DisplayName("Should stop after the configured number of pages")
    void testFetchGroupMembershipsPageLimit() throws Exception {
        // Arrange: every page links to another one
        respondWith(httpClient, response(200, "{\"value\":[{\"@odata.type\":\"#microsoft.graph.group\",\"id\":\"g\"}],"
                + "\"@odata.nextLink\":\"https://graph.test/v1.0/me/memberOf?$skiptoken=next\"}"));

        // Act
        List<String> groups = graphClient.fetchGroupMemberships("graph-token");

        // Assert
        assertEquals(3, groups.size());
        verify(httpClient, times(3)).execute(any(ClassicHttpRequest.class), anyHandler());
    }

    @Test
    @DisplayName("Should return no groups when memberOf is forbidden")
    void testFetchGroupMembershipsForbidden() throws Exception {
        respondWith(httpClient, response(403, "{\"error\":{\"code\":\"Authorization_RequestDenied\"}}"));

        assertTrue(graphClient.fetchGroupMemberships("graph-token").isEmpty());
    }

    @Test
    @DisplayName("Should raise a transport error when Graph is unreachable")
    void testUnreachable() throws Exception {
        failWith(httpClient, new ConnectException("Connection refused"));

        assertThrows(TransportException.class, () -> graphClient.fetchProfile("graph-token"));
    }
}
