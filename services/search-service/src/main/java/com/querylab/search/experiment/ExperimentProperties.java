package com.querylab.search.experiment;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.experiments")
public class ExperimentProperties {
    private boolean enabled = true;
    private double defaultTrafficPercentage = 100.0;
    private int minSampleSize = 100;
    private double confidenceLevel = 0.95;
    private boolean autoStopOnSignificance = false;
    private String controlVariant = "control";
    private List<String> conversionEventTypes = new ArrayList<>(List.of("click", "conversion"));

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public double getDefaultTrafficPercentage() {
        return defaultTrafficPercentage;
    }

    public void setDefaultTrafficPercentage(double defaultTrafficPercentage) {
        this.defaultTrafficPercentage = defaultTrafficPercentage;
    }

    public int getMinSampleSize() {
        return minSampleSize;
    }

    public void setMinSampleSize(int minSampleSize) {
        this.minSampleSize = minSampleSize;
    }

    public double getConfidenceLevel() {
        return confidenceLevel;
    }

    public void setConfidenceLevel(double confidenceLevel) {
        this.confidenceLevel = confidenceLevel;
    }

    public boolean isAutoStopOnSignificance() {
        return autoStopOnSignificance;
    }

    public void setAutoStopOnSignificance(boolean autoStopOnSignificance) {
        this.autoStopOnSignificance = autoStopOnSignificance;
    }

    public String getControlVariant() {
        return controlVariant;
    }

    public void setControlVariant(String controlVariant) {
        this.controlVariant = controlVariant;
    }

    public List<String> getConversionEventTypes() {
        return conversionEventTypes;
    }

    public void setConversionEventTypes(List<String> conversionEventTypes) {
        this.conversionEventTypes = conversionEventTypes;
    }
}
