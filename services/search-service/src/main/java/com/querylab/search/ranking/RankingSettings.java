package com.querylab.search.ranking;

import java.util.Map;

/**
 * Immutable view of the ranking configuration for one request. Experiment variants derive a copy
 * with their own click-boost weight or click threshold.
 */
public final class RankingSettings {
    private final boolean enableClickBoost;
    private final double clickBoostWeight;
    private final int minClicksForBoost;
    private final int clickDecayDays;
    private final Map<String, Double> entityBoosts;
    private final boolean enableFreshnessBoost;
    private final int freshnessDecayDays;
    private final double freshnessWeight;

    private RankingSettings(
        boolean enableClickBoost,
        double clickBoostWeight,
        int minClicksForBoost,
        int clickDecayDays,
        Map<String, Double> entityBoosts,
        boolean enableFreshnessBoost,
        int freshnessDecayDays,
        double freshnessWeight
    ) {
        this.enableClickBoost = enableClickBoost;
        this.clickBoostWeight = clickBoostWeight;
        this.minClicksForBoost = minClicksForBoost;
        this.clickDecayDays = Math.max(1, clickDecayDays);
        this.entityBoosts = entityBoosts == null ? Map.of() : Map.copyOf(entityBoosts);
        this.enableFreshnessBoost = enableFreshnessBoost;
        this.freshnessDecayDays = Math.max(1, freshnessDecayDays);
        this.freshnessWeight = freshnessWeight;
    }

    public static RankingSettings from(RankingProperties properties) {
        return new RankingSettings(
            properties.isEnableClickBoost(),
            properties.getClickBoostWeight(),
            properties.getMinClicksForBoost(),
            properties.getClickDecayDays(),
            properties.getEntityBoosts(),
            properties.isEnableFreshnessBoost(),
            properties.getFreshnessDecayDays(),
            properties.getFreshnessWeight()
        );
    }

    /**
     * Applies {@code click_boost_weight} and {@code min_clicks_for_boost} from a variant config.
     * Unknown keys and values of the wrong type are ignored.
     */
    public RankingSettings withOverrides(Map<String, Object> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        double weight = clickBoostWeight;
        int minClicks = minClicksForBoost;
        if (overrides.get("click_boost_weight") instanceof Number number) {
            weight = number.doubleValue();
        }
        if (overrides.get("min_clicks_for_boost") instanceof Number number) {
            minClicks = number.intValue();
        }
        return new RankingSettings(
            enableClickBoost,
            weight,
            minClicks,
            clickDecayDays,
            entityBoosts,
            enableFreshnessBoost,
            freshnessDecayDays,
            freshnessWeight
        );
    }

    public boolean isEnableClickBoost() {
        return enableClickBoost;
    }

    public double getClickBoostWeight() {
        return clickBoostWeight;
    }

    public int getMinClicksForBoost() {
        return minClicksForBoost;
    }

    public int getClickDecayDays() {
        return clickDecayDays;
    }

    public Map<String, Double> getEntityBoosts() {
        return entityBoosts;
    }

    public boolean isEnableFreshnessBoost() {
        return enableFreshnessBoost;
    }

    public int getFreshnessDecayDays() {
        return freshnessDecayDays;
    }

    public double getFreshnessWeight() {
        return freshnessWeight;
    }
}
