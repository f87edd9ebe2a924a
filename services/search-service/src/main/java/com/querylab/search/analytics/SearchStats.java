package com.querylab.search.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class SearchStats {
    private final long totalSearches;
    private final long uniqueQueries;
    private final double zeroResultRate;
    private final double avgResultsCount;
    private final double avgResponseTimeMs;
    private final double clickThroughRate;
    private final List<QueryCount> topQueries;
    private final List<QueryCount> zeroResultQueries;

    public SearchStats(
        long totalSearches,
        long uniqueQueries,
        double zeroResultRate,
        double avgResultsCount,
        double avgResponseTimeMs,
        double clickThroughRate,
        List<QueryCount> topQueries,
        List<QueryCount> zeroResultQueries
    ) {
        this.totalSearches = totalSearches;
        this.uniqueQueries = uniqueQueries;
        this.zeroResultRate = zeroResultRate;
        this.avgResultsCount = avgResultsCount;
        this.avgResponseTimeMs = avgResponseTimeMs;
        this.clickThroughRate = clickThroughRate;
        this.topQueries = topQueries == null ? List.of() : List.copyOf(topQueries);
        this.zeroResultQueries = zeroResultQueries == null ? List.of() : List.copyOf(zeroResultQueries);
    }

    public static SearchStats empty() {
        return new SearchStats(0, 0, 0.0, 0.0, 0.0, 0.0, List.of(), List.of());
    }

    @JsonProperty("total_searches")
    public long getTotalSearches() {
        return totalSearches;
    }

    @JsonProperty("unique_queries")
    public long getUniqueQueries() {
        return uniqueQueries;
    }

    @JsonProperty("zero_result_rate")
    public double getZeroResultRate() {
        return zeroResultRate;
    }

    @JsonProperty("avg_results_count")
    public double getAvgResultsCount() {
        return avgResultsCount;
    }

    @JsonProperty("avg_response_time_ms")
    public double getAvgResponseTimeMs() {
        return avgResponseTimeMs;
    }

    @JsonProperty("click_through_rate")
    public double getClickThroughRate() {
        return clickThroughRate;
    }

    @JsonProperty("top_queries")
    public List<QueryCount> getTopQueries() {
        return topQueries;
    }

    @JsonProperty("zero_result_queries")
    public List<QueryCount> getZeroResultQueries() {
        return zeroResultQueries;
    }
}
