package com.querylab.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

public class CreateExperimentRequest {
    private String name;
    private String description;
    private Map<String, Map<String, Object>> variants;

    @JsonProperty("traffic_percentage")
    private Double trafficPercentage;

    @JsonProperty("primary_metric")
    private String primaryMetric;

    private String owner;
    private String hypothesis;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Map<String, Map<String, Object>> getVariants() {
        return variants;
    }

    public void setVariants(Map<String, Map<String, Object>> variants) {
        this.variants = variants;
    }

    public Double getTrafficPercentage() {
        return trafficPercentage;
    }

    public void setTrafficPercentage(Double trafficPercentage) {
        this.trafficPercentage = trafficPercentage;
    }

    public String getPrimaryMetric() {
        return primaryMetric;
    }

    public void setPrimaryMetric(String primaryMetric) {
        this.primaryMetric = primaryMetric;
    }

    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }

    public String getHypothesis() {
        return hypothesis;
    }

    public void setHypothesis(String hypothesis) {
        this.hypothesis = hypothesis;
    }
}
