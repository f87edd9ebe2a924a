package com.querylab.search.resilience;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
public class CircuitBreakerRegistry {
    public static final String SEARCH_CACHE = "search_cache";

    private final SearchResilienceProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final ConcurrentMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(SearchResilienceProperties properties, Clock clock, MeterRegistry meterRegistry) {
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    public CircuitBreaker getOrCreate(String name) {
        return breakers.computeIfAbsent(name, this::create);
    }

    public CircuitBreaker get(String name) {
        return breakers.get(name);
    }

    public Map<String, CircuitBreakerStats> getAllStats() {
        Map<String, CircuitBreakerStats> stats = new TreeMap<>();
        for (Map.Entry<String, CircuitBreaker> entry : breakers.entrySet()) {
            stats.put(entry.getKey(), entry.getValue().getStats());
        }
        return stats;
    }

    public boolean reset(String name) {
        CircuitBreaker breaker = breakers.get(name);
        if (breaker == null) {
            return false;
        }
        breaker.reset();
        return true;
    }

    public void resetAll() {
        for (CircuitBreaker breaker : breakers.values()) {
            breaker.reset();
        }
    }

    public SearchResilienceProperties getProperties() {
        return properties;
    }

    private CircuitBreaker create(String name) {
        int threshold = properties.getFailureThreshold();
        long openTimeoutMs = properties.getOpenTimeoutMs();
        int halfOpenMaxCalls = properties.getHalfOpenMaxCalls();
        SearchResilienceProperties.Breaker override = properties.getBreakers().get(name);
        if (override != null) {
            if (override.getFailureThreshold() != null) {
                threshold = override.getFailureThreshold();
            }
            if (override.getOpenTimeoutMs() != null) {
                openTimeoutMs = override.getOpenTimeoutMs();
            }
            if (override.getHalfOpenMaxCalls() != null) {
                halfOpenMaxCalls = override.getHalfOpenMaxCalls();
            }
        }
        CircuitBreaker breaker =
            new CircuitBreaker(name, threshold, Duration.ofMillis(openTimeoutMs), halfOpenMaxCalls, clock);
        FunctionCounter.builder("qs_circuit_breaker_blocked_total", breaker, b -> b.getStats().totalBlocked())
            .tag("breaker", name)
            .register(meterRegistry);
        return breaker;
    }
}
