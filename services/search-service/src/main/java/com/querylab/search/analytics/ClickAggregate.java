package com.querylab.search.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record ClickAggregate(
    @JsonProperty("entity_id") String entityId,
    @JsonProperty("total_clicks") long totalClicks,
    @JsonProperty("unique_searches") long uniqueSearches,
    @JsonProperty("avg_position") Double avgPosition,
    @JsonProperty("last_clicked") Instant lastClicked
) {
}
