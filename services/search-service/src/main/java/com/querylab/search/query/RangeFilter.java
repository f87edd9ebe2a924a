package com.querylab.search.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Bounds for a numeric or date field. A {@code null} bound is open.
 */
public class RangeFilter {
    private final String min;
    private final String max;
    private final boolean inclusive;

    public RangeFilter(String min, String max, boolean inclusive) {
        this.min = min;
        this.max = max;
        this.inclusive = inclusive;
    }

    @JsonProperty("min")
    public String getMin() {
        return min;
    }

    @JsonProperty("max")
    public String getMax() {
        return max;
    }

    @JsonProperty("inclusive")
    public boolean isInclusive() {
        return inclusive;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RangeFilter other)) {
            return false;
        }
        return inclusive == other.inclusive
            && Objects.equals(min, other.min)
            && Objects.equals(max, other.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(min, max, inclusive);
    }

    @Override
    public String toString() {
        return "(" + min + ", " + max + ", " + inclusive + ")";
    }
}
