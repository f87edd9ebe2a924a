package com.querylab.search.intent;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum IntentType {
    NAVIGATIONAL,
    INFORMATIONAL,
    TRANSACTIONAL,
    EXPLORATORY,
    UNKNOWN;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static IntentType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        return IntentType.valueOf(value.strip().toUpperCase(Locale.ROOT));
    }
}
