package com.numaansystems.obo.config;

import com.numaansystems.obo.model.EmptyGroupsPolicy;
import com.numaansystems.obo.model.SearchAuthMode;
import com.numaansystems.obo.testing.TestOboProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the derived values and defaults of OboProperties.
 */
class OboPropertiesTest {

    @Test
    @DisplayName("Should derive the token endpoint from the authority")
    void testTokenEndpoint() {
        OboProperties.AzureAd azureAd = new OboProperties.AzureAd("t", "c", "s",
                "https://login.microsoftonline.com/tenant-123/");

        assertEquals(TestOboProperties.TOKEN_ENDPOINT, azureAd.tokenEndpoint());
    }

    @Test
    @DisplayName("Should build the search URL from endpoint, index and API version")
    void testSearchUrl() {
        assertEquals(TestOboProperties.SEARCH_URL, TestOboProperties.create().search().searchUrl());
    }

    @Test
    @DisplayName("Should treat a blank API key as not configured")
    void testHasApiKey() {
        assertFalse(TestOboProperties.with(SearchAuthMode.OBO, "  ").search().hasApiKey());
        assertFalse(TestOboProperties.with(SearchAuthMode.OBO, null).search().hasApiKey());
        assertTrue(TestOboProperties.with(SearchAuthMode.OBO, "k").search().hasApiKey());
    }

    @Test
    @DisplayName("Should apply defaults for omitted values")
    void testDefaults() {
        OboProperties.Search search = new OboProperties.Search("https://s", "i", "v", null, null, null, null);
        OboProperties.Query query = new OboProperties.Query(0, null, null, null, false);
        OboProperties.Http http = new OboProperties.Http(null, null, 0);

        assertEquals(SearchAuthMode.OBO, search.authMode());
        assertEquals(List.of(), search.scopes());
        assertEquals("security_groups", search.filter().field());
        assertTrue(search.filter().escapeQuotes());
        assertEquals(EmptyGroupsPolicy.SHOW_ALL, search.filter().emptyGroupsPolicy());
        assertEquals(50, query.top());
        assertEquals("simple", query.queryType());
        assertEquals(Duration.ofSeconds(10), http.connectTimeout());
        assertEquals(Duration.ofSeconds(30), http.responseTimeout());
        assertEquals(50, http.maxConnections());
    }

    @Test
    @DisplayName("Should not print secrets")
    void testToStringHidesSecrets() {
        OboProperties properties = TestOboProperties.create();

        assertFalse(properties.azureAd().toString().contains("secret-123"));
        assertFalse(properties.search().toString().contains(TestOboProperties.API_KEY));
    }
}
