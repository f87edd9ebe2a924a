package com.querylab.search.analytics;

import java.time.Instant;
import java.util.List;

public record SearchRecord(
    Long id,
    String queryText,
    String queryHash,
    String normalizedQuery,
    List<String> entityTypes,
    int resultsCount,
    long tookMs,
    String userId,
    String sessionId,
    String searchSyntax,
    boolean clickedResult,
    Integer clickedPosition,
    String clickedEntityId,
    Instant createdAt
) {
}
