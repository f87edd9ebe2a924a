package com.querylab.search.experiment;

import java.time.Instant;

public record ExperimentAssignment(String experimentName, String userId, String variant, Instant assignedAt) {
}
