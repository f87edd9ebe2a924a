package com.querylab.search.ranking;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public class ClickSignal {
    private final String entityType;
    private final String entityId;
    private final long totalClicks;
    private final long uniqueSearches;
    private final double avgClickPosition;
    private final Instant lastClicked;
    private final double ctr;

    public ClickSignal(
        String entityType,
        String entityId,
        long totalClicks,
        long uniqueSearches,
        double avgClickPosition,
        Instant lastClicked,
        double ctr
    ) {
        this.entityType = entityType;
        this.entityId = entityId;
        this.totalClicks = totalClicks;
        this.uniqueSearches = uniqueSearches;
        this.avgClickPosition = avgClickPosition;
        this.lastClicked = lastClicked;
        this.ctr = ctr;
    }

    /**
     * Boost in [0, 1]: CTR contribution capped at 1, discounted for entities already clicked near the top.
     */
    @JsonProperty("click_boost")
    public double clickBoost() {
        if (totalClicks == 0) {
            return 0.0;
        }
        double ctrBoost = Math.min(ctr * 2, 1.0);
        double positionFactor = 1.0 / (1.0 + Math.log1p(Math.max(0.0, avgClickPosition)));
        return Math.max(0.0, ctrBoost * positionFactor);
    }

    @JsonProperty("entity_type")
    public String getEntityType() {
        return entityType;
    }

    @JsonProperty("entity_id")
    public String getEntityId() {
        return entityId;
    }

    @JsonProperty("total_clicks")
    public long getTotalClicks() {
        return totalClicks;
    }

    @JsonProperty("unique_searches")
    public long getUniqueSearches() {
        return uniqueSearches;
    }

    @JsonProperty("avg_click_position")
    public double getAvgClickPosition() {
        return avgClickPosition;
    }

    @JsonProperty("last_clicked")
    public Instant getLastClicked() {
        return lastClicked;
    }

    @JsonProperty("ctr")
    public double getCtr() {
        return ctr;
    }
}
