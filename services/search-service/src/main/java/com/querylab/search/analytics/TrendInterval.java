package com.querylab.search.analytics;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Bucket width for search volume trends, with the MySQL expression that renders a row's bucket.
 */
public enum TrendInterval {
    HOUR("hour", "DATE_FORMAT(created_at, '%Y-%m-%dT%H:00:00')"),
    DAY("day", "DATE_FORMAT(created_at, '%Y-%m-%d')"),
    WEEK("week", "DATE_FORMAT(DATE_SUB(DATE(created_at), INTERVAL WEEKDAY(created_at) DAY), '%Y-%m-%d')");

    private final String value;
    private final String periodExpression;

    TrendInterval(String value, String periodExpression) {
        this.value = value;
        this.periodExpression = periodExpression;
    }

    @JsonValue
    public String value() {
        return value;
    }

    String periodExpression() {
        return periodExpression;
    }

    /** Unknown or missing values fall back to {@link #DAY}. */
    public static TrendInterval fromValue(String raw) {
        if (raw != null) {
            String normalized = raw.trim().toLowerCase(Locale.ROOT);
            for (TrendInterval interval : values()) {
                if (interval.value.equals(normalized)) {
                    return interval;
                }
            }
        }
        return DAY;
    }
}
