package com.querylab.search.experiment;

import com.fasterxml.jackson.annotation.JsonProperty;

public record VariantStats(
    @JsonProperty("variant") String variant,
    @JsonProperty("participants") long participants,
    @JsonProperty("conversions") long conversions,
    @JsonProperty("conversion_rate") double conversionRate,
    @JsonProperty("avg_value") Double avgValue,
    @JsonProperty("total_value") double totalValue
) {
    public static VariantStats of(String variant, long participants, long conversions, Double avgValue, double totalValue) {
        double rate = participants > 0 ? (double) conversions / participants : 0.0;
        return new VariantStats(variant, participants, conversions, rate, avgValue, totalValue);
    }
}
