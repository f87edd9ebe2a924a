package com.querylab.search.intent;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "search.intent")
public class IntentProperties {
    private boolean enabled = true;
    private IntentType defaultIntent = IntentType.INFORMATIONAL;
    private double minConfidence = 0.3;
    private long timeoutMs = 50;
    private List<CustomPattern> customPatterns = new ArrayList<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public IntentType getDefaultIntent() {
        return defaultIntent;
    }

    public void setDefaultIntent(IntentType defaultIntent) {
        this.defaultIntent = defaultIntent;
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    public void setMinConfidence(double minConfidence) {
        this.minConfidence = minConfidence;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public List<CustomPattern> getCustomPatterns() {
        return customPatterns;
    }

    public void setCustomPatterns(List<CustomPattern> customPatterns) {
        this.customPatterns = customPatterns;
    }

    public static class CustomPattern {
        private IntentType intent;
        private String regex;
        private double weight = 1.0;
        private String signal;

        public IntentType getIntent() {
            return intent;
        }

        public void setIntent(IntentType intent) {
            this.intent = intent;
        }

        public String getRegex() {
            return regex;
        }

        public void setRegex(String regex) {
            this.regex = regex;
        }

        public double getWeight() {
            return weight;
        }

        public void setWeight(double weight) {
            this.weight = weight;
        }

        public String getSignal() {
            return signal;
        }

        public void setSignal(String signal) {
            this.signal = signal;
        }
    }
}
