package com.querylab.search.api.dto;

public class QueryTextRequest {
    private String query;

    public QueryTextRequest() {
    }

    public QueryTextRequest(String query) {
        this.query = query;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }
}
