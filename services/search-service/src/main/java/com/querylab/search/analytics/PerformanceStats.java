package com.querylab.search.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Latency summary over a window. Percentiles come from the most recent
 * {@code search.analytics.latency-sample-size} searches; the other figures cover the whole window.
 */
public record PerformanceStats(
    @JsonProperty("total_queries") long totalQueries,
    @JsonProperty("avg_time_ms") double avgTimeMs,
    @JsonProperty("min_time_ms") double minTimeMs,
    @JsonProperty("max_time_ms") double maxTimeMs,
    @JsonProperty("p50_time_ms") double p50TimeMs,
    @JsonProperty("p95_time_ms") double p95TimeMs,
    @JsonProperty("p99_time_ms") double p99TimeMs,
    @JsonProperty("slow_threshold_ms") long slowThresholdMs,
    @JsonProperty("slow_query_count") long slowQueryCount,
    @JsonProperty("slow_query_rate") double slowQueryRate
) {

    public static PerformanceStats empty(long slowThresholdMs) {
        return new PerformanceStats(0L, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, slowThresholdMs, 0L, 0.0);
    }
}
