package com.querylab.search.experiment;

import java.time.Instant;
import java.util.Map;

public record ExperimentEvent(
    String experimentName,
    String userId,
    String variant,
    String eventType,
    Double eventValue,
    Map<String, Object> metadata,
    Instant createdAt
) {
}
