package com.querylab.search.query;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Multi-valued field filters. Field order and value order follow the query.
 */
public class FieldFilters {
    private static final Pattern FIELD_NAME = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);

    private final Map<String, List<String>> values = new LinkedHashMap<>();

    public static boolean isValidFieldName(String field) {
        return field != null && FIELD_NAME.matcher(field).matches();
    }

    void add(String field, String value) {
        if (!isValidFieldName(field)) {
            throw new IllegalArgumentException("invalid field name: " + field);
        }
        values.computeIfAbsent(field, key -> new ArrayList<>()).add(value);
    }

    public List<String> get(String field) {
        List<String> list = values.get(field);
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    public Set<String> fields() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @JsonValue
    public Map<String, List<String>> asMap() {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : values.entrySet()) {
            copy.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
