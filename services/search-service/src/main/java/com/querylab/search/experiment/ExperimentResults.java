package com.querylab.search.experiment;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

public record ExperimentResults(
    @JsonProperty("experiment_name") String experimentName,
    @JsonProperty("status") ExperimentStatus status,
    @JsonProperty("start_date") Instant startDate,
    @JsonProperty("end_date") Instant endDate,
    @JsonProperty("duration_days") long durationDays,
    @JsonProperty("total_participants") long totalParticipants,
    @JsonProperty("variants") List<VariantStats> variants,
    @JsonProperty("winner") String winner,
    @JsonProperty("is_significant") boolean significant,
    @JsonProperty("p_value") Double pValue,
    @JsonProperty("confidence_level") double confidenceLevel,
    @JsonProperty("recommendation") String recommendation
) {
}
