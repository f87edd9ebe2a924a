package com.querylab.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

public class TrackEventRequest {
    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("event_type")
    private String eventType;

    private Double value;
    private Map<String, Object> metadata;

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getEventType() {
        return eventType;
    }

    public void setEventType(String eventType) {
        this.eventType = eventType;
    }

    public Double getValue() {
        return value;
    }

    public void setValue(Double value) {
        this.value = value;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata;
    }
}
