package com.numaansystems.obo.model;

/**
 * Security filter attached to a search query.
 *
 * @param expression OData filter expression, or null when no restriction applies
 * @param description which policy branch produced the filter
 */
public record AuthorizationFilter(String expression, String description) {

    public static AuthorizationFilter unrestricted(String description) {
        return new AuthorizationFilter(null, description);
    }

    public boolean isRestricted() {
        return expression != null;
    }
}
