package com.querylab.search.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.querylab.search.api.dto.SearchRequest;
import com.querylab.search.api.dto.SearchResponse;
import com.querylab.search.resilience.CircuitBreaker;
import com.querylab.search.resilience.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Caches serialized search responses in the {@link KeyValueStore}. Every store call runs on the
 * search executor with a timeout and through the {@code search_cache} breaker; any failure is a
 * cache miss for the caller.
 */
@Service
public class SearchCacheService {
    private static final Logger log = LoggerFactory.getLogger(SearchCacheService.class);
    private static final int KEY_HASH_LENGTH = 16;

    private final SearchCacheProperties properties;
    private final KeyValueStore store;
    private final CircuitBreaker breaker;
    private final ObjectMapper objectMapper;
    private final ExecutorService executor;
    private final MeterRegistry meterRegistry;

    public SearchCacheService(
        SearchCacheProperties properties,
        KeyValueStore store,
        CircuitBreakerRegistry breakerRegistry,
        ObjectMapper objectMapper,
        @Qualifier("searchExecutor") ExecutorService executor,
        MeterRegistry meterRegistry
    ) {
        this.properties = properties;
        this.store = store;
        this.breaker = breakerRegistry.getOrCreate(CircuitBreakerRegistry.SEARCH_CACHE);
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
    }

    public boolean isEnabled() {
        return properties.isEnabled();
    }

    public Optional<SearchResponse> get(SearchRequest request) {
        if (!cacheable(request)) {
            return Optional.empty();
        }
        String key = buildKey(request);
        if (key == null) {
            return Optional.empty();
        }
        Optional<String> cached = breaker.execute(() -> timed("get", () -> store.get(key)), this::degradedMiss);
        if (cached.isEmpty()) {
            meterRegistry.counter("qs_search_cache_miss_total").increment();
            return Optional.empty();
        }
        try {
            SearchResponse response = objectMapper.readValue(cached.get(), SearchResponse.class);
            meterRegistry.counter("qs_search_cache_hit_total").increment();
            log.debug("search cache hit key={}", key);
            return Optional.of(response);
        } catch (JsonProcessingException e) {
            log.warn("unreadable search cache entry key={}: {}", key, e.getOriginalMessage());
            meterRegistry.counter("qs_search_cache_miss_total").increment();
            return Optional.empty();
        }
    }

    public boolean put(SearchRequest request, SearchResponse response) {
        if (!cacheable(request) || response == null) {
            return false;
        }
        long totalHits = response.getTotalHits();
        if (!properties.isCacheEmptyResults() && totalHits == 0) {
            return false;
        }
        if (totalHits < properties.getMinResultsToCache()) {
            return false;
        }
        String key = buildKey(request);
        if (key == null) {
            return false;
        }
        String payload;
        try {
            payload = objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            log.warn("search response not serializable for cache: {}", e.getOriginalMessage());
            return false;
        }
        Duration ttl = Duration.ofMillis(properties.getTtlMs());
        return breaker.execute(
            () -> timed("set", () -> {
                store.set(key, payload, ttl);
                return true;
            }),
            () -> {
                meterRegistry.counter("qs_search_cache_degraded_total").increment();
                return false;
            }
        );
    }

    public long invalidateResults() {
        return invalidate(properties.getKeyPrefix() + ":results:*");
    }

    public long invalidateAll() {
        return invalidate(properties.getKeyPrefix() + ":*");
    }

    /**
     * {@code <prefix>:results:<first 16 hex chars of the MD5 of the request's canonical JSON>}.
     */
    public String buildKey(SearchRequest request) {
        if (request == null) {
            return null;
        }
        Map<String, Object> fields = new TreeMap<>();
        fields.put("query", request.getQuery() == null ? "" : request.getQuery().strip());
        List<String> entityTypes = new ArrayList<>();
        if (request.getEntityTypes() != null) {
            for (String type : request.getEntityTypes()) {
                if (type != null && !type.isBlank()) {
                    entityTypes.add(type.strip().toLowerCase(Locale.ROOT));
                }
            }
        }
        entityTypes.sort(null);
        fields.put("entity_types", entityTypes);
        fields.put("limit", request.getLimit());
        fields.put("user_id", request.getUserId());
        String hash = CacheKeyUtil.hashJson(objectMapper, fields, KEY_HASH_LENGTH);
        if (hash == null) {
            return null;
        }
        return properties.getKeyPrefix() + ":results:" + hash;
    }

    private long invalidate(String pattern) {
        long deleted = breaker.execute(() -> timed("delete", () -> store.deletePattern(pattern)), () -> 0L);
        log.info("search cache invalidated pattern={} deleted={}", pattern, deleted);
        return deleted;
    }

    private boolean cacheable(SearchRequest request) {
        if (!properties.isEnabled() || request == null || request.getQuery() == null) {
            return false;
        }
        return request.getQuery().length() <= properties.getMaxQueryLength();
    }

    private Optional<String> degradedMiss() {
        meterRegistry.counter("qs_search_cache_degraded_total").increment();
        return Optional.empty();
    }

    private <T> T timed(String operation, Supplier<T> call) {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(call, executor);
        long timeoutMs = properties.getOperationTimeoutMs();
        try {
            if (timeoutMs > 0) {
                return future.get(timeoutMs, TimeUnit.MILLISECONDS);
            }
            return future.get();
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new CacheOperationException("cache " + operation + " timed out after " + timeoutMs + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new CacheOperationException("cache " + operation + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CacheOperationException("cache " + operation + " interrupted", e);
        }
    }
}
