package com.querylab.search.experiment;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

public record VariantAssignment(
    @JsonProperty("variant") String variant,
    @JsonProperty("config") Map<String, Object> config,
    @JsonProperty("experiment") String experiment
) {
}
