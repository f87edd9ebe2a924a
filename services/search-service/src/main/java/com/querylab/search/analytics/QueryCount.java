package com.querylab.search.analytics;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryCount(
    @JsonProperty("query") String query,
    @JsonProperty("count") long count,
    @JsonProperty("avg_results") Double avgResults,
    @JsonProperty("avg_time_ms") Double avgTimeMs
) {
}
