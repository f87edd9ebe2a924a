package com.querylab.search.analytics;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "search.analytics")
public class AnalyticsProperties {
    private long slowQueryThresholdMs = 500;
    private int latencySampleSize = 10000;
    private int retentionDays = 90;

    public long getSlowQueryThresholdMs() {
        return slowQueryThresholdMs;
    }

    public void setSlowQueryThresholdMs(long slowQueryThresholdMs) {
        this.slowQueryThresholdMs = slowQueryThresholdMs;
    }

    public int getLatencySampleSize() {
        return latencySampleSize;
    }

    public void setLatencySampleSize(int latencySampleSize) {
        this.latencySampleSize = latencySampleSize;
    }

    public int getRetentionDays() {
        return retentionDays;
    }

    public void setRetentionDays(int retentionDays) {
        this.retentionDays = retentionDays;
    }
}
