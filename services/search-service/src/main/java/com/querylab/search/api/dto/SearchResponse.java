package com.querylab.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.querylab.search.intent.QueryIntent;
import com.querylab.search.query.ParsedQuery;
import java.util.List;
import java.util.Map;

public class SearchResponse {
    @JsonProperty("trace_id")
    private String traceId;

    @JsonProperty("request_id")
    private String requestId;

    @JsonProperty("search_id")
    private Long searchId;

    private String query;

    @JsonProperty("expanded_query")
    private String expandedQuery;

    @JsonProperty("took_ms")
    private long tookMs;

    @JsonProperty("total_hits")
    private long totalHits;

    @JsonProperty("cache_hit")
    private boolean cacheHit;

    private Intent intent;
    private Experiment experiment;
    private Parsed parsed;
    private List<RankedHit> hits;

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public Long getSearchId() {
        return searchId;
    }

    public void setSearchId(Long searchId) {
        this.searchId = searchId;
    }

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

    public long getTookMs() {
        return tookMs;
    }

    public void setTookMs(long tookMs) {
        this.tookMs = tookMs;
    }

    public long getTotalHits() {
        return totalHits;
    }

    public void setTotalHits(long totalHits) {
        this.totalHits = totalHits;
    }

    public boolean isCacheHit() {
        return cacheHit;
    }

    public void setCacheHit(boolean cacheHit) {
        this.cacheHit = cacheHit;
    }

    public Intent getIntent() {
        return intent;
    }

    public void setIntent(Intent intent) {
        this.intent = intent;
    }

    public Experiment getExperiment() {
        return experiment;
    }

    public void setExperiment(Experiment experiment) {
        this.experiment = experiment;
    }

    public Parsed getParsed() {
        return parsed;
    }

    public void setParsed(Parsed parsed) {
        this.parsed = parsed;
    }

    public List<RankedHit> getHits() {
        return hits;
    }

    public void setHits(List<RankedHit> hits) {
        this.hits = hits;
    }

    public static class Intent {
        private String type;
        private double confidence;
        private List<String> signals;

        public Intent() {
        }

        public static Intent from(QueryIntent intent) {
            Intent result = new Intent();
            result.type = intent.getType().value();
            result.confidence = intent.getConfidence();
            result.signals = intent.getSignals();
            return result;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public double getConfidence() {
            return confidence;
        }

        public void setConfidence(double confidence) {
            this.confidence = confidence;
        }

        public List<String> getSignals() {
            return signals;
        }

        public void setSignals(List<String> signals) {
            this.signals = signals;
        }
    }

    public static class Experiment {
        private String name;
        private String variant;

        public Experiment() {
        }

        public Experiment(String name, String variant) {
            this.name = name;
            this.variant = variant;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getVariant() {
            return variant;
        }

        public void setVariant(String variant) {
            this.variant = variant;
        }
    }

    public static class Parsed {
        @JsonProperty("normalized_query")
        private String normalizedQuery;

        @JsonProperty("field_filters")
        private Map<String, List<String>> fieldFilters;

        private List<String> exclusions;

        public Parsed() {
        }

        public static Parsed from(ParsedQuery parsed) {
            Parsed result = new Parsed();
            result.normalizedQuery = parsed.getNormalizedQuery();
            result.fieldFilters = parsed.getFieldFilters().asMap();
            result.exclusions = parsed.getExclusions();
            return result;
        }

        public String getNormalizedQuery() {
            return normalizedQuery;
        }

        public void setNormalizedQuery(String normalizedQuery) {
            this.normalizedQuery = normalizedQuery;
        }

        public Map<String, List<String>> getFieldFilters() {
            return fieldFilters;
        }

        public void setFieldFilters(Map<String, List<String>> fieldFilters) {
            this.fieldFilters = fieldFilters;
        }

        public List<String> getExclusions() {
            return exclusions;
        }

        public void setExclusions(List<String> exclusions) {
            this.exclusions = exclusions;
        }
    }
}
