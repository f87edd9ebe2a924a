package com.querylab.search.resilience;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "search.resilience")
public class SearchResilienceProperties {
    private int failureThreshold = 5;
    private long openTimeoutMs = 30000;
    private int halfOpenMaxCalls = 1;
    private Map<String, Breaker> breakers = new LinkedHashMap<>();

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public void setFailureThreshold(int failureThreshold) {
        this.failureThreshold = failureThreshold;
    }

    public long getOpenTimeoutMs() {
        return openTimeoutMs;
    }

    public void setOpenTimeoutMs(long openTimeoutMs) {
        this.openTimeoutMs = openTimeoutMs;
    }

    public int getHalfOpenMaxCalls() {
        return halfOpenMaxCalls;
    }

    public void setHalfOpenMaxCalls(int halfOpenMaxCalls) {
        this.halfOpenMaxCalls = halfOpenMaxCalls;
    }

    public Map<String, Breaker> getBreakers() {
        return breakers;
    }

    public void setBreakers(Map<String, Breaker> breakers) {
        this.breakers = breakers;
    }

    /**
     * Per-breaker overrides; unset values fall back to the shared defaults.
     */
    public static class Breaker {
        private Integer failureThreshold;
        private Long openTimeoutMs;
        private Integer halfOpenMaxCalls;

        public Integer getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(Integer failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Long getOpenTimeoutMs() {
            return openTimeoutMs;
        }

        public void setOpenTimeoutMs(Long openTimeoutMs) {
            this.openTimeoutMs = openTimeoutMs;
        }

        public Integer getHalfOpenMaxCalls() {
            return halfOpenMaxCalls;
        }

        public void setHalfOpenMaxCalls(Integer halfOpenMaxCalls) {
            this.halfOpenMaxCalls = halfOpenMaxCalls;
        }
    }
}
