package com.querylab.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class RankedHit {
    @JsonProperty("entity_type")
    private String entityType;

    @JsonProperty("entity_id")
    private String entityId;

    private String title;
    private String snippet;
    private int rank;

    @JsonProperty("base_score")
    private double baseScore;

    @JsonProperty("click_boost")
    private double clickBoost;

    private double score;

    public String getEntityType() {
        return entityType;
    }

    public void setEntityType(String entityType) {
        this.entityType = entityType;
    }

    public String getEntityId() {
        return entityId;
    }

    public void setEntityId(String entityId) {
        this.entityId = entityId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getSnippet() {
        return snippet;
    }

    public void setSnippet(String snippet) {
        this.snippet = snippet;
    }

    public int getRank() {
        return rank;
    }

    public void setRank(int rank) {
        this.rank = rank;
    }

    public double getBaseScore() {
        return baseScore;
    }

    public void setBaseScore(double baseScore) {
        this.baseScore = baseScore;
    }

    public double getClickBoost() {
        return clickBoost;
    }

    public void setClickBoost(double clickBoost) {
        this.clickBoost = clickBoost;
    }

    public double getScore() {
        return score;
    }

    public void setScore(double score) {
        this.score = score;
    }
}
