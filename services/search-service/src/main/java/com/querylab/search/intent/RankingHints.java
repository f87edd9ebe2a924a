package com.querylab.search.intent;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Ranking adjustments suggested for an intent. Absent values leave the default behavior alone.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RankingHints {
    private Boolean preferExactMatch;
    private Double boostTitleMatches;
    private Integer limitResults;
    private Boolean skipFuzzy;
    private Double boostContentMatches;
    private Boolean includeRelated;
    private Boolean expandSynonyms;
    private Double boostRecent;
    private Boolean filterActiveOnly;
    private Boolean includeFacets;
    private Boolean increaseLimit;
    private Boolean showCategories;
    private Boolean useDefaults;

    public static RankingHints forIntent(IntentType intent) {
        RankingHints hints = new RankingHints();
        switch (intent) {
            case NAVIGATIONAL -> {
                hints.preferExactMatch = true;
                hints.boostTitleMatches = 1.5;
                hints.limitResults = 5;
                hints.skipFuzzy = true;
            }
            case INFORMATIONAL -> {
                hints.preferExactMatch = false;
                hints.boostContentMatches = 1.2;
                hints.includeRelated = true;
                hints.expandSynonyms = true;
            }
            case TRANSACTIONAL -> {
                hints.preferExactMatch = true;
                hints.boostRecent = 1.3;
                hints.filterActiveOnly = true;
            }
            case EXPLORATORY -> {
                hints.preferExactMatch = false;
                hints.includeFacets = true;
                hints.increaseLimit = true;
                hints.showCategories = true;
            }
            case UNKNOWN -> hints.useDefaults = true;
        }
        return hints;
    }

    public boolean prefersExactMatch() {
        return Boolean.TRUE.equals(preferExactMatch);
    }

    public boolean skipsFuzzy() {
        return Boolean.TRUE.equals(skipFuzzy);
    }

    public boolean filtersActiveOnly() {
        return Boolean.TRUE.equals(filterActiveOnly);
    }

    public boolean increasesLimit() {
        return Boolean.TRUE.equals(increaseLimit);
    }

    @JsonProperty("prefer_exact_match")
    public Boolean getPreferExactMatch() {
        return preferExactMatch;
    }

    @JsonProperty("boost_title_matches")
    public Double getBoostTitleMatches() {
        return boostTitleMatches;
    }

    @JsonProperty("limit_results")
    public Integer getLimitResults() {
        return limitResults;
    }

    @JsonProperty("skip_fuzzy")
    public Boolean getSkipFuzzy() {
        return skipFuzzy;
    }

    @JsonProperty("boost_content_matches")
    public Double getBoostContentMatches() {
        return boostContentMatches;
    }

    @JsonProperty("include_related")
    public Boolean getIncludeRelated() {
        return includeRelated;
    }

    @JsonProperty("expand_synonyms")
    public Boolean getExpandSynonyms() {
        return expandSynonyms;
    }

    @JsonProperty("boost_recent")
    public Double getBoostRecent() {
        return boostRecent;
    }

    @JsonProperty("filter_active_only")
    public Boolean getFilterActiveOnly() {
        return filterActiveOnly;
    }

    @JsonProperty("include_facets")
    public Boolean getIncludeFacets() {
        return includeFacets;
    }

    @JsonProperty("increase_limit")
    public Boolean getIncreaseLimit() {
        return increaseLimit;
    }

    @JsonProperty("show_categories")
    public Boolean getShowCategories() {
        return showCategories;
    }

    @JsonProperty("use_defaults")
    public Boolean getUseDefaults() {
        return useDefaults;
    }
}
