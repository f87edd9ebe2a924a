package com.querylab.search.analytics;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchInsight(
    @JsonProperty("type") String type,
    @JsonProperty("title") String title,
    @JsonProperty("description") String description,
    @JsonProperty("metric") String metric,
    @JsonProperty("value") Double value,
    @JsonProperty("recommendation") String recommendation
) {
}
