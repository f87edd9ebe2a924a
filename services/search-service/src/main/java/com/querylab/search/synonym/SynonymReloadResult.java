package com.querylab.search.synonym;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class SynonymReloadResult {
    private final boolean reloaded;
    private final String dictionary;
    private final int groups;
    private final String error;

    public SynonymReloadResult(boolean reloaded, String dictionary, int groups, String error) {
        this.reloaded = reloaded;
        this.dictionary = dictionary;
        this.groups = groups;
        this.error = error;
    }

    @JsonProperty("reloaded")
    public boolean isReloaded() {
        return reloaded;
    }

    @JsonProperty("dictionary")
    public String getDictionary() {
        return dictionary;
    }

    @JsonProperty("groups")
    public int getGroups() {
        return groups;
    }

    @JsonProperty("error")
    public String getError() {
        return error;
    }
}
