package com.querylab.search.intent;

import java.util.regex.Pattern;

public class IntentPattern {
    private final Pattern pattern;
    private final IntentType intent;
    private final double weight;
    private final String signal;

    public IntentPattern(Pattern pattern, IntentType intent, double weight, String signal) {
        this.pattern = pattern;
        this.intent = intent;
        this.weight = weight;
        this.signal = signal == null ? "" : signal;
    }

    public static IntentPattern of(String regex, IntentType intent, double weight, String signal) {
        return new IntentPattern(
            Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS),
            intent,
            weight,
            signal
        );
    }

    public boolean matches(String query) {
        return pattern.matcher(query).find();
    }

    public Pattern getPattern() {
        return pattern;
    }

    public IntentType getIntent() {
        return intent;
    }

    public double getWeight() {
        return weight;
    }

    public String getSignal() {
        return signal;
    }
}
