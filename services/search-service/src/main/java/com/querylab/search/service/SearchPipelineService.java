package com.querylab.search.service;

import com.querylab.search.analytics.SearchAnalyticsService;
import com.querylab.search.api.dto.RankedHit;
import com.querylab.search.api.dto.SearchRequest;
import com.querylab.search.api.dto.SearchResponse;
import com.querylab.search.backend.SearchBackendGateway;
import com.querylab.search.backend.dto.BackendSearchRequest;
import com.querylab.search.backend.dto.BackendSearchResponse;
import com.querylab.search.cache.SearchCacheService;
import com.querylab.search.experiment.ExperimentManager;
import com.querylab.search.experiment.VariantAssignment;
import com.querylab.search.intent.IntentClassifier;
import com.querylab.search.intent.IntentProperties;
import com.querylab.search.intent.QueryIntent;
import com.querylab.search.intent.RankingHints;
import com.querylab.search.query.ParsedQuery;
import com.querylab.search.query.QueryRewriter;
import com.querylab.search.query.SearchQueryParser;
import com.querylab.search.ranking.ClickBoostRanker;
import com.querylab.search.ranking.RankingSettings;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class SearchPipelineService {
    private static final Logger log = LoggerFactory.getLogger(SearchPipelineService.class);
    static final String CLICK_EVENT = "click";

    private final SearchQueryParser queryParser;
    private final QueryRewriter queryRewriter;
    private final IntentClassifier intentClassifier;
    private final IntentProperties intentProperties;
    private final ClickBoostRanker clickBoostRanker;
    private final ExperimentManager experimentManager;
    private final SearchBackendGateway backendGateway;
    private final SearchCacheService cacheService;
    private final SearchAnalyticsService analyticsService;
    private final SearchPipelineProperties properties;
    private final ExecutorService searchExecutor;
    private final MeterRegistry meterRegistry;

    public SearchPipelineService(
        SearchQueryParser queryParser,
        QueryRewriter queryRewriter,
        IntentClassifier intentClassifier,
        IntentProperties intentProperties,
        ClickBoostRanker clickBoostRanker,
        ExperimentManager experimentManager,
        SearchBackendGateway backendGateway,
        SearchCacheService cacheService,
        SearchAnalyticsService analyticsService,
        SearchPipelineProperties properties,
        @Qualifier("searchExecutor") ExecutorService searchExecutor,
        MeterRegistry meterRegistry
    ) {
        this.queryParser = queryParser;
        this.queryRewriter = queryRewriter;
        this.intentClassifier = intentClassifier;
        this.intentProperties = intentProperties;
        this.clickBoostRanker = clickBoostRanker;
        this.experimentManager = experimentManager;
        this.backendGateway = backendGateway;
        this.cacheService = cacheService;
        this.analyticsService = analyticsService;
        this.properties = properties;
        this.searchExecutor = searchExecutor;
        this.meterRegistry = meterRegistry;
    }

    public SearchResponse search(SearchRequest request, String traceId, String requestId) {
        long started = System.nanoTime();
        int limit = validate(request);
        String query = request.getQuery().strip();
        meterRegistry.counter("qs_search_requests_total").increment();

        Optional<SearchResponse> cached = cacheService.get(request);
        if (cached.isPresent()) {
            SearchResponse response = cached.get();
            response.setTraceId(traceId);
            response.setRequestId(requestId);
            response.setCacheHit(true);
            response.setTookMs(elapsedMs(started));
            response.setSearchId(recordSearch(request, query, (int) response.getTotalHits(), response.getTookMs(), null));
            return response;
        }

        CompletableFuture<QueryIntent> intentFuture = classifyAsync(query);
        ParsedQuery parsed = parse(query);
        String expandedQuery = expand(parsed);
        QueryIntent intent = awaitIntent(intentFuture);
        RankingHints hints = intent.getSuggestedAdjustments();

        VariantAssignment variant = resolveVariant(request.getUserId());
        RankingSettings settings = clickBoostRanker.defaultSettings();
        if (variant != null) {
            settings = settings.withOverrides(variant.config());
        }

        BackendSearchRequest backendRequest = toBackendRequest(request, parsed, expandedQuery, hints, limit);
        BackendSearchResponse backendResponse = backendGateway.search(backendRequest, traceId, requestId);

        List<RankedHit> hits = rescore(backendResponse.getHits(), parsed, hints, settings);
        int cap = limit;
        if (hints.getLimitResults() != null) {
            cap = Math.min(cap, hints.getLimitResults());
        }
        if (hits.size() > cap) {
            hits = new ArrayList<>(hits.subList(0, cap));
        }
        for (int i = 0; i < hits.size(); i++) {
            hits.get(i).setRank(i + 1);
        }

        SearchResponse response = new SearchResponse();
        response.setTraceId(traceId);
        response.setRequestId(requestId);
        response.setQuery(query);
        response.setExpandedQuery(expandedQuery);
        response.setTotalHits(Math.max(backendResponse.getTotal(), hits.size()));
        response.setCacheHit(false);
        response.setIntent(SearchResponse.Intent.from(intent));
        response.setParsed(SearchResponse.Parsed.from(parsed));
        response.setHits(hits);
        if (variant != null) {
            response.setExperiment(new SearchResponse.Experiment(variant.experiment(), variant.variant()));
        }
        response.setTookMs(elapsedMs(started));
        response.setSearchId(recordSearch(request, query, (int) response.getTotalHits(), response.getTookMs(), parsed));

        storeInCache(request, response);
        return response;
    }

    /**
     * Marks the search as clicked and, when an experiment is named, tracks a click event for the user.
     */
    public boolean recordClick(long searchId, int position, String entityId, String userId, String experimentName) {
        if (searchId <= 0 || position < 1) {
            throw new InvalidSearchRequestException("search_id and position must be positive");
        }
        boolean recorded = analyticsService.recordClick(searchId, position, entityId);
        if (experimentName != null && !experimentName.isBlank() && userId != null && !userId.isBlank()) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("search_id", searchId);
            metadata.put("position", position);
            if (entityId != null) {
                metadata.put("entity_id", entityId);
            }
            try {
                experimentManager.trackEvent(experimentName, userId, CLICK_EVENT, 1.0, metadata);
            } catch (RuntimeException e) {
                degraded("experiment_event", e);
            }
        }
        return recorded;
    }

    int validate(SearchRequest request) {
        if (request == null || request.getQuery() == null || request.getQuery().isBlank()) {
            throw new InvalidSearchRequestException("query is required");
        }
        if (request.getQuery().strip().length() > properties.getMaxQueryLength()) {
            throw new InvalidSearchRequestException(
                "query must be at most " + properties.getMaxQueryLength() + " characters"
            );
        }
        Integer limit = request.getLimit();
        if (limit == null) {
            return properties.getDefaultLimit();
        }
        if (limit < 1 || limit > properties.getMaxLimit()) {
            throw new InvalidSearchRequestException("limit must be between 1 and " + properties.getMaxLimit());
        }
        return limit;
    }

    private CompletableFuture<QueryIntent> classifyAsync(String query) {
        if (!intentProperties.isEnabled()) {
            return CompletableFuture.completedFuture(QueryIntent.unknown());
        }
        return CompletableFuture.supplyAsync(() -> intentClassifier.classify(query), searchExecutor);
    }

    private QueryIntent awaitIntent(CompletableFuture<QueryIntent> future) {
        try {
            long timeoutMs = intentProperties.getTimeoutMs();
            QueryIntent intent = timeoutMs > 0 ? future.get(timeoutMs, TimeUnit.MILLISECONDS) : future.get();
            return intent == null ? QueryIntent.unknown() : intent;
        } catch (TimeoutException e) {
            future.cancel(true);
            degraded("intent", e);
        } catch (ExecutionException e) {
            degraded("intent", e.getCause() == null ? e : e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            degraded("intent", e);
        }
        return QueryIntent.unknown();
    }

    private ParsedQuery parse(String query) {
        try {
            return queryParser.parse(query);
        } catch (RuntimeException e) {
            degraded("parser", e);
            return ParsedQuery.empty(query);
        }
    }

    private String expand(ParsedQuery parsed) {
        String base = parsed.getNormalizedQuery();
        if (base == null || base.isBlank()) {
            return base;
        }
        try {
            return queryRewriter.expandSynonyms(base);
        } catch (RuntimeException e) {
            degraded("synonyms", e);
            return base;
        }
    }

    private VariantAssignment resolveVariant(String userId) {
        String experimentName = properties.getRankingExperiment();
        if (experimentName == null || experimentName.isBlank() || userId == null || userId.isBlank()) {
            return null;
        }
        try {
            return experimentManager.getVariant(experimentName, userId);
        } catch (RuntimeException e) {
            degraded("experiment", e);
            return null;
        }
    }

    private BackendSearchRequest toBackendRequest(
        SearchRequest request,
        ParsedQuery parsed,
        String expandedQuery,
        RankingHints hints,
        int limit
    ) {
        BackendSearchRequest backendRequest = new BackendSearchRequest();
        backendRequest.setQuery(parsed.getNormalizedQuery());
        backendRequest.setExpandedQuery(expandedQuery);
        backendRequest.setFieldFilters(parsed.getFieldFilters().asMap());
        backendRequest.setRangeFilters(parsed.getRangeFilters().asMap());
        backendRequest.setExclusions(parsed.getExclusions());
        backendRequest.setFuzzyTerms(hints.skipsFuzzy() ? List.of() : parsed.getFuzzyTerms());
        backendRequest.setPrefixTerms(parsed.getPrefixTerms());
        backendRequest.setEntityTypes(request.getEntityTypes());
        int fetchLimit = hints.increasesLimit() ? limit * 2 : limit;
        backendRequest.setLimit(Math.min(fetchLimit, Math.max(limit, backendGateway.getMaxFetchSize())));
        backendRequest.setActiveOnly(hints.filtersActiveOnly());
        backendRequest.setPreferExactMatch(hints.prefersExactMatch());
        return backendRequest;
    }

    private List<RankedHit> rescore(
        List<BackendSearchResponse.Hit> backendHits,
        ParsedQuery parsed,
        RankingHints hints,
        RankingSettings settings
    ) {
        List<RankedHit> ranked = new ArrayList<>();
        if (backendHits == null || backendHits.isEmpty()) {
            return ranked;
        }

        Map<String, Set<String>> idsByType = new LinkedHashMap<>();
        for (BackendSearchResponse.Hit hit : backendHits) {
            if (hit != null && hit.getEntityId() != null) {
                idsByType.computeIfAbsent(typeKey(hit.getEntityType()), key -> new LinkedHashSet<>()).add(hit.getEntityId());
            }
        }
        Map<String, Map<String, Double>> boostsByType = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : idsByType.entrySet()) {
            boostsByType.put(
                entry.getKey(),
                clickBoostRanker.getBatchClickBoosts(entry.getKey(), entry.getValue(), settings)
            );
        }

        List<String> terms = matchTerms(parsed);
        for (BackendSearchResponse.Hit hit : backendHits) {
            if (hit == null) {
                continue;
            }
            String type = typeKey(hit.getEntityType());
            double clickBoost = boostsByType.getOrDefault(type, Map.of()).getOrDefault(hit.getEntityId(), 0.0);
            double score = clickBoostRanker.calculateFinalRank(
                hit.getScore(),
                hit.getEntityType(),
                clickBoost,
                hit.getFreshnessDays(),
                settings
            );
            score *= hintMultiplier(hit, terms, hints);

            RankedHit rankedHit = new RankedHit();
            rankedHit.setEntityType(hit.getEntityType());
            rankedHit.setEntityId(hit.getEntityId());
            rankedHit.setTitle(hit.getTitle());
            rankedHit.setSnippet(hit.getSnippet());
            rankedHit.setBaseScore(hit.getScore());
            rankedHit.setClickBoost(clickBoost);
            rankedHit.setScore(score);
            ranked.add(rankedHit);
        }
        ranked.sort(Comparator.comparingDouble(RankedHit::getScore).reversed());
        return ranked;
    }

    double hintMultiplier(BackendSearchResponse.Hit hit, List<String> terms, RankingHints hints) {
        double multiplier = 1.0;
        if (hints.getBoostTitleMatches() != null && containsAny(hit.getTitle(), terms)) {
            multiplier *= hints.getBoostTitleMatches();
        }
        if (hints.getBoostContentMatches() != null && containsAny(hit.getSnippet(), terms)) {
            multiplier *= hints.getBoostContentMatches();
        }
        Integer freshnessDays = hit.getFreshnessDays();
        if (hints.getBoostRecent() != null && freshnessDays != null && freshnessDays >= 0
            && freshnessDays <= properties.getRecencyWindowDays()) {
            multiplier *= hints.getBoostRecent();
        }
        return multiplier;
    }

    private static List<String> matchTerms(ParsedQuery parsed) {
        List<String> terms = new ArrayList<>();
        for (String part : parsed.getTextParts()) {
            String unquoted = part.replace("\"", " ").toLowerCase(Locale.ROOT);
            for (String term : unquoted.split("\\s+")) {
                if (!term.isBlank()) {
                    terms.add(term);
                }
            }
        }
        return terms;
    }

    private static boolean containsAny(String text, List<String> terms) {
        if (text == null || terms.isEmpty()) {
            return false;
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        for (String term : terms) {
            if (lowered.contains(term)) {
                return true;
            }
        }
        return false;
    }

    private Long recordSearch(SearchRequest request, String query, int resultsCount, long tookMs, ParsedQuery parsed) {
        try {
            long id = analyticsService.recordSearch(
                query,
                resultsCount,
                tookMs,
                request.getEntityTypes(),
                request.getUserId(),
                request.getSessionId(),
                parsed == null ? null : searchSyntax(parsed)
            );
            return id > 0 ? id : null;
        } catch (RuntimeException e) {
            degraded("history", e);
            return null;
        }
    }

    private void storeInCache(SearchRequest request, SearchResponse response) {
        try {
            cacheService.put(request, response);
        } catch (RuntimeException e) {
            degraded("cache", e);
        }
    }

    private static String searchSyntax(ParsedQuery parsed) {
        List<String> features = new ArrayList<>();
        if (parsed.hasFieldFilters()) {
            features.add("field");
        }
        if (!parsed.getRangeFilters().isEmpty()) {
            features.add("range");
        }
        if (parsed.hasExclusions()) {
            features.add("exclude");
        }
        if (!parsed.getPrefixTerms().isEmpty()) {
            features.add("prefix");
        }
        if (!parsed.getFuzzyTerms().isEmpty()) {
            features.add("fuzzy");
        }
        return features.isEmpty() ? null : String.join(",", features);
    }

    private void degraded(String stage, Throwable error) {
        meterRegistry.counter("qs_search_enhancement_degraded_total", "stage", stage).increment();
        log.warn("search enhancement degraded stage={}: {}", stage, error == null ? null : error.toString());
    }

    private static String typeKey(String entityType) {
        return entityType == null ? "" : entityType;
    }

    private static long elapsedMs(long started) {
        return (System.nanoTime() - started) / 1_000_000L;
    }
}
