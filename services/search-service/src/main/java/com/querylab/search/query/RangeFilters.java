package com.querylab.search.query;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Range filters keyed by field. A later range on the same field replaces the earlier one.
 */
public class RangeFilters {
    private final Map<String, RangeFilter> values = new LinkedHashMap<>();

    void put(String field, RangeFilter filter) {
        if (!FieldFilters.isValidFieldName(field)) {
            throw new IllegalArgumentException("invalid field name: " + field);
        }
        values.put(field, filter);
    }

    public RangeFilter get(String field) {
        return values.get(field);
    }

    public Set<String> fields() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @JsonValue
    public Map<String, RangeFilter> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
