package com.querylab.search.intent;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class QueryIntent {
    public static final double HIGH_CONFIDENCE = 0.7;

    private final IntentType type;
    private final double confidence;
    private final List<String> signals;
    private final RankingHints suggestedAdjustments;

    public QueryIntent(IntentType type, double confidence, List<String> signals, RankingHints suggestedAdjustments) {
        this.type = type;
        this.confidence = confidence;
        this.signals = signals == null ? List.of() : List.copyOf(signals);
        this.suggestedAdjustments = suggestedAdjustments == null
            ? RankingHints.forIntent(type)
            : suggestedAdjustments;
    }

    public static QueryIntent unknown() {
        return new QueryIntent(IntentType.UNKNOWN, 0.0, List.of(), RankingHints.forIntent(IntentType.UNKNOWN));
    }

    @JsonProperty("type")
    public IntentType getType() {
        return type;
    }

    @JsonProperty("confidence")
    public double getConfidence() {
        return confidence;
    }

    @JsonProperty("signals")
    public List<String> getSignals() {
        return signals;
    }

    @JsonProperty("suggested_adjustments")
    public RankingHints getSuggestedAdjustments() {
        return suggestedAdjustments;
    }

    @JsonProperty("is_high_confidence")
    public boolean isHighConfidence() {
        return confidence >= HIGH_CONFIDENCE;
    }
}
