package com.numaansystems.obo.testing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds unsigned-in-practice JWTs for tests. The signature segment is a
 * fixed placeholder because the gateway never verifies it.
 */
public final class TestTokens {

    public static final String USER_OID = "8f2c1a4e-0000-4000-8000-000000000001";
    public static final String USER_UPN = "alice@contoso.com";
    public static final String API_AUDIENCE = "api://obo-api";
    public static final String GRAPH_AUDIENCE = "00000003-0000-0000-c000-000000000000";
    public static final String SEARCH_AUDIENCE = "https://search.azure.com";
    public static final String ISSUER = "https://sts.windows.net/tenant-123/";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String SIGNATURE = "c2lnbmF0dXJl";

    private TestTokens() {
    }

    public static String jwt(Map<String, Object> claims) {
        return segment(Map.of("alg", "RS256", "typ", "JWT")) + "." + segment(claims) + "." + SIGNATURE;
    }

    /**
     * Access token for this API, as the SPA would send it.
     *
     * @param groups group claim values, null to omit the claim
     */
    public static String userToken(List<String> groups) {
        Map<String, Object> claims = baseClaims(API_AUDIENCE, "access_as_user");
        if (groups != null) {
            claims.put("groups", groups);
        }
        claims.put("roles", List.of("Reader"));
        return jwt(claims);
    }

    public static String graphToken() {
        return jwt(baseClaims(GRAPH_AUDIENCE, "User.Read GroupMember.Read.All"));
    }

    public static String searchToken() {
        Map<String, Object> claims = baseClaims(SEARCH_AUDIENCE, "user_impersonation");
        claims.put("exp", 1_900_000_000L);
        return jwt(claims);
    }

    public static String segment(Object json) {
        try {
            return Base64.getUrlEncoder().withoutPadding()
                    .encodeToString(MAPPER.writeValueAsString(json).getBytes(StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    public static String encode(String raw) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    private static Map<String, Object> baseClaims(String audience, String scopes) {
        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("aud", audience);
        claims.put("iss", ISSUER);
        claims.put("sub", "subject-1");
        claims.put("oid", USER_OID);
        claims.put("upn", USER_UPN);
        claims.put("appid", "spa-client-id");
        claims.put("scp", scopes);
        return claims;
    }
}
