package com.querylab.search.experiment;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class Experiment {
    @JsonProperty("id")
    private final Long id;

    @JsonProperty("name")
    private final String name;

    @JsonProperty("description")
    private final String description;

    @JsonProperty("variants")
    private final Map<String, Map<String, Object>> variants;

    @JsonProperty("status")
    private final ExperimentStatus status;

    @JsonProperty("traffic_percentage")
    private final double trafficPercentage;

    @JsonProperty("start_date")
    private final Instant startDate;

    @JsonProperty("end_date")
    private final Instant endDate;

    @JsonProperty("primary_metric")
    private final String primaryMetric;

    @JsonProperty("owner")
    private final String owner;

    @JsonProperty("hypothesis")
    private final String hypothesis;

    @JsonProperty("created_at")
    private final Instant createdAt;

    public Experiment(
        Long id,
        String name,
        String description,
        Map<String, Map<String, Object>> variants,
        ExperimentStatus status,
        double trafficPercentage,
        Instant startDate,
        Instant endDate,
        String primaryMetric,
        String owner,
        String hypothesis,
        Instant createdAt
    ) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.variants = variants == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(variants));
        this.status = status == null ? ExperimentStatus.DRAFT : status;
        this.trafficPercentage = trafficPercentage;
        this.startDate = startDate;
        this.endDate = endDate;
        this.primaryMetric = primaryMetric;
        this.owner = owner;
        this.hypothesis = hypothesis;
        this.createdAt = createdAt;
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, Map<String, Object>> getVariants() {
        return variants;
    }

    public ExperimentStatus getStatus() {
        return status;
    }

    public double getTrafficPercentage() {
        return trafficPercentage;
    }

    public Instant getStartDate() {
        return startDate;
    }

    public Instant getEndDate() {
        return endDate;
    }

    public String getPrimaryMetric() {
        return primaryMetric;
    }

    public String getOwner() {
        return owner;
    }

    public String getHypothesis() {
        return hypothesis;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @JsonIgnore
    public boolean isRunning() {
        return status == ExperimentStatus.RUNNING;
    }

    @JsonIgnore
    public List<String> getVariantNames() {
        return List.copyOf(variants.keySet());
    }

    public Map<String, Object> variantConfig(String variant) {
        Map<String, Object> config = variants.get(variant);
        return config == null ? Collections.emptyMap() : config;
    }
}
