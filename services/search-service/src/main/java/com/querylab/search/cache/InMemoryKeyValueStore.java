package com.querylab.search.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * In-process TTL store. Keys are kept in write order; a rewrite moves the key to the newest
 * position and the oldest key is evicted once {@code maxEntries} is exceeded.
 */
public class InMemoryKeyValueStore implements KeyValueStore {
    private final LinkedHashMap<String, Entry> entries = new LinkedHashMap<>();
    private final int maxEntries;
    private final Clock clock;

    public InMemoryKeyValueStore(int maxEntries, Clock clock) {
        this.maxEntries = Math.max(1, maxEntries);
        this.clock = clock;
    }

    @Override
    public synchronized Optional<String> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.millis())) {
            entries.remove(key);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public synchronized void set(String key, String value, Duration ttl) {
        if (key == null || value == null || ttl == null || ttl.isZero() || ttl.isNegative()) {
            return;
        }
        entries.remove(key);
        entries.put(key, new Entry(value, clock.millis() + ttl.toMillis()));
        evictIfNeeded();
    }

    @Override
    public synchronized long deletePattern(String pattern) {
        Pattern regex = globToRegex(pattern);
        long deleted = 0;
        Iterator<String> keys = entries.keySet().iterator();
        while (keys.hasNext()) {
            if (regex.matcher(keys.next()).matches()) {
                keys.remove();
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public synchronized Set<String> keys(String pattern) {
        Pattern regex = globToRegex(pattern);
        long now = clock.millis();
        Set<String> result = new TreeSet<>();
        Iterator<Map.Entry<String, Entry>> iterator = entries.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, Entry> entry = iterator.next();
            if (entry.getValue().isExpired(now)) {
                iterator.remove();
            } else if (regex.matcher(entry.getKey()).matches()) {
                result.add(entry.getKey());
            }
        }
        return result;
    }

    public synchronized int size() {
        return entries.size();
    }

    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        String source = glob == null ? "*" : glob;
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '*') {
                regex.append(".*");
            } else if (c == '?') {
                regex.append('.');
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private void evictIfNeeded() {
        Iterator<String> oldest = entries.keySet().iterator();
        while (entries.size() > maxEntries && oldest.hasNext()) {
            oldest.next();
            oldest.remove();
        }
    }

    private record Entry(String value, long expiresAtMs) {
        boolean isExpired(long nowMs) {
            return nowMs > expiresAtMs;
        }
    }
}
