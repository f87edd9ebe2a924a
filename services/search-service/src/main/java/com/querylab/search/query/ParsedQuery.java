package com.querylab.search.query;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Structured form of a raw search string.
 *
 * <p>Free-text parts keep their order and phrases stay quoted. Field filters, range filters,
 * exclusions, prefix terms and fuzzy terms are handed to the backend separately from
 * {@link #getNormalizedQuery()}.
 */
public class ParsedQuery {
    private final String originalQuery;
    private final List<String> textParts = new ArrayList<>();
    private final FieldFilters fieldFilters = new FieldFilters();
    private final RangeFilters rangeFilters = new RangeFilters();
    private final List<String> exclusions = new ArrayList<>();
    private final List<String> prefixTerms = new ArrayList<>();
    private final List<String> fuzzyTerms = new ArrayList<>();
    private String normalizedQuery = "";

    ParsedQuery(String originalQuery) {
        this.originalQuery = originalQuery == null ? "" : originalQuery;
    }

    public static ParsedQuery empty(String originalQuery) {
        return new ParsedQuery(originalQuery);
    }

    void addTextPart(String part) {
        textParts.add(part);
    }

    void addFieldValue(String field, String value) {
        fieldFilters.add(field, value);
    }

    void putRange(String field, RangeFilter filter) {
        rangeFilters.put(field, filter);
    }

    void addExclusion(String term) {
        exclusions.add(term);
    }

    void addPrefixTerm(String term) {
        prefixTerms.add(term);
    }

    void addFuzzyTerm(String term) {
        fuzzyTerms.add(term);
    }

    void setNormalizedQuery(String normalizedQuery) {
        this.normalizedQuery = normalizedQuery;
    }

    @JsonProperty("original_query")
    public String getOriginalQuery() {
        return originalQuery;
    }

    @JsonProperty("text_parts")
    public List<String> getTextParts() {
        return Collections.unmodifiableList(textParts);
    }

    @JsonProperty("field_filters")
    public FieldFilters getFieldFilters() {
        return fieldFilters;
    }

    @JsonProperty("range_filters")
    public RangeFilters getRangeFilters() {
        return rangeFilters;
    }

    @JsonProperty("exclusions")
    public List<String> getExclusions() {
        return Collections.unmodifiableList(exclusions);
    }

    @JsonProperty("prefix_terms")
    public List<String> getPrefixTerms() {
        return Collections.unmodifiableList(prefixTerms);
    }

    @JsonProperty("fuzzy_terms")
    public List<String> getFuzzyTerms() {
        return Collections.unmodifiableList(fuzzyTerms);
    }

    @JsonProperty("normalized_query")
    public String getNormalizedQuery() {
        return normalizedQuery;
    }

    @JsonIgnore
    public boolean hasTextQuery() {
        return !textParts.isEmpty() || !normalizedQuery.isEmpty();
    }

    @JsonIgnore
    public boolean hasFieldFilters() {
        return !fieldFilters.isEmpty();
    }

    @JsonIgnore
    public boolean hasExclusions() {
        return !exclusions.isEmpty();
    }
}
