package com.querylab.search.query;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "search.query")
public class QueryParserProperties {
    private boolean enablePrefix = true;
    private boolean enableFuzzy = true;
    private int minWordLength = 2;
    private List<String> stopWords = new ArrayList<>();

    public boolean isEnablePrefix() {
        return enablePrefix;
    }

    public void setEnablePrefix(boolean enablePrefix) {
        this.enablePrefix = enablePrefix;
    }

    public boolean isEnableFuzzy() {
        return enableFuzzy;
    }

    public void setEnableFuzzy(boolean enableFuzzy) {
        this.enableFuzzy = enableFuzzy;
    }

    public int getMinWordLength() {
        return minWordLength;
    }

    public void setMinWordLength(int minWordLength) {
        this.minWordLength = minWordLength;
    }

    public List<String> getStopWords() {
        return stopWords;
    }

    public void setStopWords(List<String> stopWords) {
        this.stopWords = stopWords;
    }
}
