package com.querylab.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ExpandResponse {
    private String query;

    @JsonProperty("normalized_query")
    private String normalizedQuery;

    @JsonProperty("expanded_query")
    private String expandedQuery;

    public ExpandResponse() {
    }

    public ExpandResponse(String query, String normalizedQuery, String expandedQuery) {
        this.query = query;
        this.normalizedQuery = normalizedQuery;
        this.expandedQuery = expandedQuery;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public String getNormalizedQuery() {
        return normalizedQuery;
    }

    public void setNormalizedQuery(String normalizedQuery) {
        this.normalizedQuery = normalizedQuery;
    }

    public String getExpandedQuery() {
        return expandedQuery;
    }

    public void setExpandedQuery(String expandedQuery) {
        this.expandedQuery = expandedQuery;
    }
}
