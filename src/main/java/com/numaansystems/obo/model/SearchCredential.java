package com.numaansystems.obo.model;

/**
 * Credential presented to the search service.
 */
public sealed interface SearchCredential permits SearchCredential.Bearer, SearchCredential.ApiKey {

    /** Human readable name used in responses and logs. */
    String describe();

    /**
     * OBO access token sent as a bearer credential.
     *
     * @param accessToken the exchanged token
     * @param queryTimeAuthorization also send the token in
     *        {@code x-ms-query-source-authorization} so the index trims results per user
     */
    record Bearer(String accessToken, boolean queryTimeAuthorization) implements SearchCredential {

        @Override
        public String describe() {
            return queryTimeAuthorization ? "OBO Flow with Query-Time Access Control" : "OBO Flow";
        }

        @Override
        public String toString() {
            return "Bearer[queryTimeAuthorization=" + queryTimeAuthorization + "]";
        }
    }

    /**
     * Static admin or query key for the search service.
     */
    record ApiKey(String key) implements SearchCredential {

        @Override
        public String describe() {
            return "API Key";
        }

        @Override
        public String toString() {
            return "ApiKey[***]";
        }
    }
}
