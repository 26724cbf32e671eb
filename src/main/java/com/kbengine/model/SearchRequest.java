package com.kbengine.model;

public record SearchRequest(
    String query,
    RetrievalMode mode,
    SearchFilters filters,
    Integer limit,
    Double threshold
) {

    public SearchRequest {
        mode = mode == null ? RetrievalMode.VECTOR : mode;
        filters = filters == null ? SearchFilters.NONE : filters;
    }

    public static SearchRequest of(String query, RetrievalMode mode) {
        return new SearchRequest(query, mode, SearchFilters.NONE, null, null);
    }
}
