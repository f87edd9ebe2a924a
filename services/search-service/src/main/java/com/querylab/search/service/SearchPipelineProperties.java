package com.querylab.search.service;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "search.pipeline")
public class SearchPipelineProperties {
    private int maxQueryLength = 500;
    private int defaultLimit = 20;
    private int maxLimit = 100;
    private String rankingExperiment;
    private int recencyWindowDays = 30;

    public int getMaxQueryLength() {
        return maxQueryLength;
    }

    public void setMaxQueryLength(int maxQueryLength) {
        this.maxQueryLength = maxQueryLength;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }

    public void setMaxLimit(int maxLimit) {
        this.maxLimit = maxLimit;
    }

    public String getRankingExperiment() {
        return rankingExperiment;
    }

    public void setRankingExperiment(String rankingExperiment) {
        this.rankingExperiment = rankingExperiment;
    }

    public int getRecencyWindowDays() {
        return recencyWindowDays;
    }

    public void setRecencyWindowDays(int recencyWindowDays) {
        this.recencyWindowDays = recencyWindowDays;
    }
}
