package com.querylab.search.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "search.cache")
public class SearchCacheProperties {
    private boolean enabled = true;
    private long ttlMs = 300000;
    private int maxEntries = 1000;
    private int maxQueryLength = 200;
    private String keyPrefix = "search";
    private int minResultsToCache = 0;
    private boolean cacheEmptyResults = true;
    private long operationTimeoutMs = 100;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getTtlMs() {
        return ttlMs;
    }

    public void setTtlMs(long ttlMs) {
        this.ttlMs = ttlMs;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public void setMaxEntries(int maxEntries) {
        this.maxEntries = maxEntries;
    }

    public int getMaxQueryLength() {
        return maxQueryLength;
    }

    public void setMaxQueryLength(int maxQueryLength) {
        this.maxQueryLength = maxQueryLength;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public int getMinResultsToCache() {
        return minResultsToCache;
    }

    public void setMinResultsToCache(int minResultsToCache) {
        this.minResultsToCache = minResultsToCache;
    }

    public boolean isCacheEmptyResults() {
        return cacheEmptyResults;
    }

    public void setCacheEmptyResults(boolean cacheEmptyResults) {
        this.cacheEmptyResults = cacheEmptyResults;
    }

    public long getOperationTimeoutMs() {
        return operationTimeoutMs;
    }

    public void setOperationTimeoutMs(long operationTimeoutMs) {
        this.operationTimeoutMs = operationTimeoutMs;
    }
}
