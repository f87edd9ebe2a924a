package com.querylab.search.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Opaque key-value cache. Patterns use glob syntax ({@code *} and {@code ?}). Implementations
 * report failures by throwing; callers decide whether to degrade.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    long deletePattern(String pattern);

    Set<String> keys(String pattern);
}
