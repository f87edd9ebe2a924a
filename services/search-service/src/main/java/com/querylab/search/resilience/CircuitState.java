package com.querylab.search.resilience;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
