package com.querylab.search.resilience;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record CircuitBreakerStats(
    @JsonProperty("name") String name,
    @JsonProperty("state") CircuitState state,
    @JsonProperty("failure_count") int failureCount,
    @JsonProperty("success_count") int successCount,
    @JsonProperty("half_open_calls") int halfOpenCalls,
    @JsonProperty("last_failure_time") Instant lastFailureTime,
    @JsonProperty("last_success_time") Instant lastSuccessTime,
    @JsonProperty("last_state_change") Instant lastStateChange,
    @JsonProperty("total_blocked") long totalBlocked,
    @JsonProperty("total_requests") long totalRequests,
    @JsonProperty("transition_count") long transitionCount
) {

    @JsonProperty("failure_rate")
    public double failureRate() {
        if (totalRequests == 0) {
            return 0.0;
        }
        return (double) failureCount / totalRequests;
    }
}
