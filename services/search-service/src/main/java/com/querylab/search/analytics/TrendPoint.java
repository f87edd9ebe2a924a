package com.querylab.search.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TrendPoint(
    @JsonProperty("period") String period,
    @JsonProperty("count") long count,
    @JsonProperty("unique_queries") long uniqueQueries,
    @JsonProperty("zero_results") long zeroResults
) {
}
