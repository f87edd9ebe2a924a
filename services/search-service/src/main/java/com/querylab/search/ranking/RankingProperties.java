package com.querylab.search.ranking;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "search.ranking")
public class RankingProperties {
    private boolean enableClickBoost = true;
    private double clickBoostWeight = 0.2;
    private int minClicksForBoost = 3;
    private int clickDecayDays = 30;
    private Map<String, Double> entityBoosts = new LinkedHashMap<>();
    private boolean enableFreshnessBoost = false;
    private int freshnessDecayDays = 7;
    private double freshnessWeight = 0.1;

    public boolean isEnableClickBoost() {
        return enableClickBoost;
    }

    public void setEnableClickBoost(boolean enableClickBoost) {
        this.enableClickBoost = enableClickBoost;
    }

    public double getClickBoostWeight() {
        return clickBoostWeight;
    }

    public void setClickBoostWeight(double clickBoostWeight) {
        this.clickBoostWeight = clickBoostWeight;
    }

    public int getMinClicksForBoost() {
        return minClicksForBoost;
    }

    public void setMinClicksForBoost(int minClicksForBoost) {
        this.minClicksForBoost = minClicksForBoost;
    }

    public int getClickDecayDays() {
        return clickDecayDays;
    }

    public void setClickDecayDays(int clickDecayDays) {
        this.clickDecayDays = clickDecayDays;
    }

    public Map<String, Double> getEntityBoosts() {
        return entityBoosts;
    }

    public void setEntityBoosts(Map<String, Double> entityBoosts) {
        this.entityBoosts = entityBoosts;
    }

    public boolean isEnableFreshnessBoost() {
        return enableFreshnessBoost;
    }

    public void setEnableFreshnessBoost(boolean enableFreshnessBoost) {
        this.enableFreshnessBoost = enableFreshnessBoost;
    }

    public int getFreshnessDecayDays() {
        return freshnessDecayDays;
    }

    public void setFreshnessDecayDays(int freshnessDecayDays) {
        this.freshnessDecayDays = freshnessDecayDays;
    }

    public double getFreshnessWeight() {
        return freshnessWeight;
    }

    public void setFreshnessWeight(double freshnessWeight) {
        this.freshnessWeight = freshnessWeight;
    }
}
