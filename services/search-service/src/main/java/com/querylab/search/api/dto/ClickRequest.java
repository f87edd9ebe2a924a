package com.querylab.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ClickRequest {
    @JsonProperty("search_id")
    private Long searchId;

    private Integer position;

    @JsonProperty("entity_id")
    private String entityId;

    @JsonProperty("user_id")
    private String userId;

    private String experiment;

    public Long getSearchId() {
        return searchId;
    }

    public void setSearchId(Long searchId) {
        this.searchId = searchId;
    }

    public Integer getPosition() {
        return position;
    }

    public void setPosition(Integer position) {
        this.position = position;
    }

    public String getEntityId() {
        return entityId;
    }

    public void setEntityId(String entityId) {
        this.entityId = entityId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getExperiment() {
        return experiment;
    }

    public void setExperiment(String experiment) {
        this.experiment = experiment;
    }
}
