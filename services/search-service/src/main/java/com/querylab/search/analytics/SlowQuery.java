package com.querylab.search.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SlowQuery(
    @JsonProperty("query") String query,
    @JsonProperty("count") long count,
    @JsonProperty("avg_time_ms") double avgTimeMs,
    @JsonProperty("max_time_ms") long maxTimeMs
) {
}
