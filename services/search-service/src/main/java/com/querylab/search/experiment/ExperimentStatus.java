package com.querylab.search.experiment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ExperimentStatus {
    DRAFT,
    RUNNING,
    PAUSED,
    COMPLETED,
    CANCELLED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ExperimentStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return ExperimentStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public boolean canStart() {
        return this == DRAFT || this == PAUSED;
    }

    public boolean canPause() {
        return this == RUNNING;
    }

    public boolean canStop() {
        return this == RUNNING || this == PAUSED;
    }

    public boolean canCancel() {
        return this == DRAFT || this == RUNNING || this == PAUSED;
    }
}
