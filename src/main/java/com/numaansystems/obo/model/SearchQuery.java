package com.numaansystems.obo.model;

/**
 * A search request as sent to the search index.
 *
 * @param text free-text query, {@code *} matches everything
 * @param select comma separated fields to return, {@code *} for all
 * @param top maximum number of results
 * @param queryType {@code simple} or {@code full}
 * @param orderBy ordering clause, may be null
 */
public record SearchQuery(String text, String select, int top, String queryType, String orderBy) {

    public static final String MATCH_ALL = "*";

    public SearchQuery {
        if (text == null || text.isBlank()) {
            text = MATCH_ALL;
        }
        if (select == null || select.isBlank()) {
            select = MATCH_ALL;
        }
    }
}
