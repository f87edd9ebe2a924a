package com.querylab.search.backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class BackendSearchResponse {
    private List<Hit> hits;
    private long total;

    public List<Hit> getHits() {
        return hits;
    }

    public void setHits(List<Hit> hits) {
        this.hits = hits;
    }

    public long getTotal() {
        return total;
    }

    public void setTotal(long total) {
        this.total = total;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Hit {
        @JsonProperty("entity_type")
        private String entityType;

        @JsonProperty("entity_id")
        private String entityId;

        private double score;
        private String title;
        private String snippet;

        @JsonProperty("freshness_days")
        private Integer freshnessDays;

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

        public double getScore() {
            return score;
        }

        public void setScore(double score) {
            this.score = score;
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

        public Integer getFreshnessDays() {
            return freshnessDays;
        }

        public void setFreshnessDays(Integer freshnessDays) {
            this.freshnessDays = freshnessDays;
        }
    }
}
