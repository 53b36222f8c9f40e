package com.numaansystems.obo.model;

/**
 * Credential used by the unified search route.
 */
public enum SearchAuthMode {

    /** Exchange the user token and let the search service apply query-time access control. */
    OBO,

    /** Use the static search API key. */
    API_KEY
}
