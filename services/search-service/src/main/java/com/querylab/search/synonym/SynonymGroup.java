package com.querylab.search.synonym;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class SynonymGroup {
    private final List<String> terms;
    private final String canonical;
    private final boolean bidirectional;
    private final double weight;

    SynonymGroup(List<String> terms, String canonical, boolean bidirectional, double weight) {
        this.terms = List.copyOf(terms);
        this.canonical = canonical == null ? this.terms.get(0) : canonical;
        this.bidirectional = bidirectional;
        this.weight = weight;
    }

    @JsonProperty("terms")
    public List<String> getTerms() {
        return terms;
    }

    @JsonProperty("canonical")
    public String getCanonical() {
        return canonical;
    }

    @JsonProperty("bidirectional")
    public boolean isBidirectional() {
        return bidirectional;
    }

    @JsonProperty("weight")
    public double getWeight() {
        return weight;
    }

    public boolean contains(String term) {
        return terms.contains(term);
    }
}
