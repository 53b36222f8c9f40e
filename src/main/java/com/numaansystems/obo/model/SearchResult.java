package com.numaansystems.obo.model;

import java.util.List;
import java.util.Map;

/**
 * Normalised response of the search index.
 *
 * @param status HTTP status returned by the search service
 * @param documents result documents, untouched
 * @param reportedCount the {@code @odata.count} value, null when the service omitted it
 */
public record SearchResult(int status, List<Map<String, Object>> documents, Long reportedCount) {

    public SearchResult {
        documents = documents == null ? List.of() : List.copyOf(documents);
    }

    /**
     * Returns the total reported by the service, falling back to the number of
     * documents in this page.
     */
    public long resultCount() {
        return reportedCount != null ? reportedCount : documents.size();
    }
}
