package com.querylab.search.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record SearchTrends(
    @JsonProperty("interval") TrendInterval interval,
    @JsonProperty("days") int days,
    @JsonProperty("trends") List<TrendPoint> trends,
    @JsonProperty("total_searches") long totalSearches,
    @JsonProperty("avg_daily_searches") double avgDailySearches
) {
}
