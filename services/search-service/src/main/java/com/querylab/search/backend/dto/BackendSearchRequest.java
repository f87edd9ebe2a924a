package com.querylab.search.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.querylab.search.query.RangeFilter;
import java.util.List;
import java.util.Map;

public class BackendSearchRequest {
    private String query;

    @JsonProperty("expanded_query")
    private String expandedQuery;

    @JsonProperty("field_filters")
    private Map<String, List<String>> fieldFilters;

    @JsonProperty("range_filters")
    private Map<String, RangeFilter> rangeFilters;

    private List<String> exclusions;

    @JsonProperty("fuzzy_terms")
    private List<String> fuzzyTerms;

    @JsonProperty("prefix_terms")
    private List<String> prefixTerms;

    @JsonProperty("entity_types")
    private List<String> entityTypes;

    private int limit;

    @JsonProperty("active_only")
    private boolean activeOnly;

    @JsonProperty("prefer_exact_match")
    private boolean preferExactMatch;

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public String getExpandedQuery() {
        return expandedQuery;
    }

    public void setExpandedQuery(String expandedQuery) {
        this.expandedQuery = expandedQuery;
    }

    public Map<String, List<String>> getFieldFilters() {
        return fieldFilters;
    }

    public void setFieldFilters(Map<String, List<String>> fieldFilters) {
        this.fieldFilters = fieldFilters;
    }

    public Map<String, RangeFilter> getRangeFilters() {
        return rangeFilters;
    }

    public void setRangeFilters(Map<String, RangeFilter> rangeFilters) {
        this.rangeFilters = rangeFilters;
    }

    public List<String> getExclusions() {
        return exclusions;
    }

    public void setExclusions(List<String> exclusions) {
        this.exclusions = exclusions;
    }

    public List<String> getFuzzyTerms() {
        return fuzzyTerms;
    }

    public void setFuzzyTerms(List<String> fuzzyTerms) {
        this.fuzzyTerms = fuzzyTerms;
    }

    public List<String> getPrefixTerms() {
        return prefixTerms;
    }

    public void setPrefixTerms(List<String> prefixTerms) {
        this.prefixTerms = prefixTerms;
    }

    public List<String> getEntityTypes() {
        return entityTypes;
    }

    public void setEntityTypes(List<String> entityTypes) {
        this.entityTypes = entityTypes;
    }

    public int getLimit() {
        return limit;
    }

    public void setLimit(int limit) {
        this.limit = limit;
    }

    public boolean isActiveOnly() {
        return activeOnly;
    }

    public void setActiveOnly(boolean activeOnly) {
        this.activeOnly = activeOnly;
    }

    public boolean isPreferExactMatch() {
        return preferExactMatch;
    }

    public void setPreferExactMatch(boolean preferExactMatch) {
        this.preferExactMatch = preferExactMatch;
    }
}
