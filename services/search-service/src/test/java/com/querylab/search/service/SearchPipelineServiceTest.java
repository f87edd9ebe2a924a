package com.querylab.search.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.querylab.search.analytics.ClickAggregate;
import com.querylab.search.analytics.SearchAnalyticsService;
import com.querylab.search.analytics.SearchHistoryRepository;
import com.querylab.search.api.dto.RankedHit;
import com.querylab.search.api.dto.SearchRequest;
import com.querylab.search.api.dto.SearchResponse;
import com.querylab.search.backend.SearchBackendGateway;
import com.querylab.search.backend.SearchBackendUnavailableException;
import com.querylab.search.backend.dto.BackendSearchRequest;
import com.querylab.search.backend.dto.BackendSearchResponse;
import com.querylab.search.cache.SearchCacheService;
import com.querylab.search.experiment.ExperimentManager;
import com.querylab.search.experiment.VariantAssignment;
import com.querylab.search.intent.IntentClassifier;
import com.querylab.search.intent.IntentProperties;
import com.querylab.search.intent.IntentType;
import com.querylab.search.intent.RankingHints;
import com.querylab.search.query.QueryParserProperties;
import com.querylab.search.query.QueryRewriter;
import com.querylab.search.query.SearchQueryParser;
import com.querylab.search.ranking.ClickBoostRanker;
import com.querylab.search.ranking.RankingProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SearchPipelineServiceTest {
    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");

    @Mock
    private QueryRewriter queryRewriter;

    @Mock
    private SearchHistoryRepository historyRepository;

    @Mock
    private ExperimentManager experimentManager;

    @Mock
    private SearchBackendGateway backendGateway;

    @Mock
    private SearchCacheService cacheService;

    @Mock
    private SearchAnalyticsService analyticsService;

    private ExecutorService executor;
    private SimpleMeterRegistry meterRegistry;
    private IntentProperties intentProperties;
    private SearchPipelineProperties pipelineProperties;
    private SearchPipelineService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        meterRegistry = new SimpleMeterRegistry();
        intentProperties = new IntentProperties();
        intentProperties.setEnabled(false);
        intentProperties.setTimeoutMs(2000);
        pipelineProperties = new SearchPipelineProperties();
        ClickBoostRanker ranker = new ClickBoostRanker(
            historyRepository,
            new RankingProperties(),
            Clock.fixed(NOW, ZoneOffset.UTC)
        );
        service = new SearchPipelineService(
            new SearchQueryParser(new QueryParserProperties()),
            queryRewriter,
            new IntentClassifier(intentProperties),
            intentProperties,
            ranker,
            experimentManager,
            backendGateway,
            cacheService,
            analyticsService,
            pipelineProperties,
            executor,
            meterRegistry
        );
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void rejectsInvalidRequests() {
        assertThatThrownBy(() -> service.search(request(null, null), null, null))
            .isInstanceOf(InvalidSearchRequestException.class)
            .hasMessage("query is required");
        assertThatThrownBy(() -> service.search(request("rust", 0), null, null))
            .isInstanceOf(InvalidSearchRequestException.class)
            .hasMessage("limit must be between 1 and 100");
        pipelineProperties.setMaxQueryLength(3);
        assertThatThrownBy(() -> service.search(request("rust", null), null, null))
            .isInstanceOf(InvalidSearchRequestException.class)
            .hasMessage("query must be at most 3 characters");
        verify(backendGateway, never()).search(any(), any(), any());
    }

    @Test
    void cacheHitSkipsBackendAndStillRecordsHistory() {
        SearchResponse cached = new SearchResponse();
        cached.setQuery("rust book");
        cached.setTotalHits(4);
        cached.setHits(List.of());
        SearchRequest request = request("rust book", null);
        when(cacheService.get(request)).thenReturn(Optional.of(cached));
        when(analyticsService.recordSearch(eq("rust book"), eq(4), anyLong(), isNull(), eq("u1"), isNull(), isNull()))
            .thenReturn(11L);

        SearchResponse response = service.search(request, "trace-1", "req-1");

        assertThat(response.isCacheHit()).isTrue();
        assertThat(response.getSearchId()).isEqualTo(11L);
        assertThat(response.getTraceId()).isEqualTo("trace-1");
        assertThat(response.getRequestId()).isEqualTo("req-1");
        verify(backendGateway, never()).search(any(), any(), any());
    }

    @Test
    void rescoresBackendHitsWithClickBoosts() {
        when(queryRewriter.expandSynonyms("rust book")).thenReturn("(rust OR rustlang) book");
        when(backendGateway.search(any(BackendSearchRequest.class), eq("trace-1"), eq("req-1")))
            .thenReturn(backendResponse(2, hit("d1", 1.4, "First"), hit("d2", 2.0, "Second"), hit("d3", 1.5, "Third")));
        stubClicksFor("d1");
        when(analyticsService.recordSearch(eq("rust book"), eq(3), anyLong(), isNull(), eq("u1"), isNull(), isNull()))
            .thenReturn(5L);

        SearchResponse response = service.search(request("rust book", null), "trace-1", "req-1");

        assertThat(response.getHits()).extracting(RankedHit::getEntityId).containsExactly("d2", "d1", "d3");
        assertThat(response.getHits()).extracting(RankedHit::getRank).containsExactly(1, 2, 3);
        assertThat(response.getHits().get(1).getClickBoost()).isGreaterThan(0.0);
        assertThat(response.getHits().get(1).getBaseScore()).isEqualTo(1.4);
        assertThat(response.getTotalHits()).isEqualTo(3L);
        assertThat(response.getExpandedQuery()).isEqualTo("(rust OR rustlang) book");
        assertThat(response.getSearchId()).isEqualTo(5L);
        assertThat(response.isCacheHit()).isFalse();
        assertThat(response.getIntent().getType()).isEqualTo("unknown");
        assertThat(response.getExperiment()).isNull();

        ArgumentCaptor<BackendSearchRequest> captor = ArgumentCaptor.forClass(BackendSearchRequest.class);
        verify(backendGateway).search(captor.capture(), eq("trace-1"), eq("req-1"));
        assertThat(captor.getValue().getQuery()).isEqualTo("rust book");
        assertThat(captor.getValue().getLimit()).isEqualTo(20);
        verify(cacheService).put(any(SearchRequest.class), eq(response));
    }

    @Test
    void parsedSyntaxIsRecorded() {
        when(queryRewriter.expandSynonyms("rust")).thenReturn("rust");
        when(backendGateway.search(any(BackendSearchRequest.class), any(), any())).thenReturn(backendResponse(0));

        service.search(request("rust author:klabnik -java", null), null, null);

        verify(analyticsService).recordSearch(
            eq("rust author:klabnik -java"), eq(0), anyLong(), isNull(), eq("u1"), isNull(), eq("field,exclude")
        );
    }

    @Test
    void variantOverridesClickWeight() {
        pipelineProperties.setRankingExperiment("ranking_v2");
        when(experimentManager.getVariant("ranking_v2", "u1"))
            .thenReturn(new VariantAssignment("treatment", Map.of("click_boost_weight", 1.0), "ranking_v2"));
        when(queryRewriter.expandSynonyms("rust book")).thenReturn("rust book");
        when(backendGateway.search(any(BackendSearchRequest.class), any(), any()))
            .thenReturn(backendResponse(2, hit("d1", 1.4, "First"), hit("d2", 2.0, "Second")));
        stubClicksFor("d1");

        SearchResponse response = service.search(request("rust book", null), null, null);

        assertThat(response.getHits()).extracting(RankedHit::getEntityId).containsExactly("d1", "d2");
        assertThat(response.getExperiment().getName()).isEqualTo("ranking_v2");
        assertThat(response.getExperiment().getVariant()).isEqualTo("treatment");
    }

    @Test
    void navigationalIntentPrefersTitlesAndCapsResults() {
        intentProperties.setEnabled(true);
        when(queryRewriter.expandSynonyms("dashboard")).thenReturn("dashboard");
        List<BackendSearchResponse.Hit> hits = new ArrayList<>();
        hits.add(hit("plain", 1.4, "Settings"));
        hits.add(hit("titled", 1.0, "Admin Dashboard"));
        for (int i = 0; i < 6; i++) {
            hits.add(hit("filler-" + i, 0.5, "Other"));
        }
        when(backendGateway.search(any(BackendSearchRequest.class), any(), any()))
            .thenReturn(backendResponse(8, hits.toArray(new BackendSearchResponse.Hit[0])));

        SearchResponse response = service.search(request("dashboard", null), null, null);

        assertThat(response.getIntent().getType()).isEqualTo("navigational");
        assertThat(response.getHits()).hasSize(5);
        assertThat(response.getHits().get(0).getEntityId()).isEqualTo("titled");
        assertThat(response.getTotalHits()).isEqualTo(8L);
        ArgumentCaptor<BackendSearchRequest> captor = ArgumentCaptor.forClass(BackendSearchRequest.class);
        verify(backendGateway).search(captor.capture(), any(), any());
        assertThat(captor.getValue().isPreferExactMatch()).isTrue();
        assertThat(captor.getValue().getFuzzyTerms()).isEmpty();
    }

    @Test
    void enhancementFailuresDegradeInsteadOfFailing() {
        when(queryRewriter.expandSynonyms("rust")).thenThrow(new IllegalStateException("dictionary broken"));
        when(backendGateway.search(any(BackendSearchRequest.class), any(), any()))
            .thenReturn(backendResponse(1, hit("d1", 1.0, "Rust")));
        when(historyRepository.findClickAggregates(anyCollection(), any(Instant.class)))
            .thenThrow(new IllegalStateException("db down"));
        when(analyticsService.recordSearch(anyString(), anyInt(), anyLong(), any(), any(), any(), any()))
            .thenThrow(new IllegalStateException("db down"));
        when(cacheService.put(any(SearchRequest.class), any(SearchResponse.class)))
            .thenThrow(new IllegalStateException("cache down"));

        SearchResponse response = service.search(request("rust", null), null, null);

        assertThat(response.getExpandedQuery()).isEqualTo("rust");
        assertThat(response.getHits()).extracting(RankedHit::getEntityId).containsExactly("d1");
        assertThat(response.getSearchId()).isNull();
        assertThat(degradedCount("synonyms")).isEqualTo(1.0);
        assertThat(degradedCount("history")).isEqualTo(1.0);
        assertThat(degradedCount("cache")).isEqualTo(1.0);
    }

    @Test
    void backendOutagePropagates() {
        when(queryRewriter.expandSynonyms("rust")).thenReturn("rust");
        when(backendGateway.search(any(BackendSearchRequest.class), any(), any()))
            .thenThrow(new SearchBackendUnavailableException("Search backend unavailable"));

        assertThatThrownBy(() -> service.search(request("rust", null), null, null))
            .isInstanceOf(SearchBackendUnavailableException.class);
    }

    @Test
    void clickTracksExperimentEvent() {
        when(analyticsService.recordClick(5L, 2, "d1")).thenReturn(true);

        assertThat(service.recordClick(5L, 2, "d1", "u1", "ranking_v2")).isTrue();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> metadata = ArgumentCaptor.forClass(Map.class);
        verify(experimentManager).trackEvent(eq("ranking_v2"), eq("u1"), eq("click"), eq(1.0), metadata.capture());
        assertThat(metadata.getValue()).containsEntry("search_id", 5L).containsEntry("position", 2)
            .containsEntry("entity_id", "d1");
    }

    @Test
    void clickSurvivesExperimentFailure() {
        when(analyticsService.recordClick(5L, 1, "d1")).thenReturn(true);
        when(experimentManager.trackEvent(anyString(), anyString(), anyString(), any(), any()))
            .thenThrow(new IllegalStateException("db down"));

        assertThat(service.recordClick(5L, 1, "d1", "u1", "ranking_v2")).isTrue();
        assertThat(degradedCount("experiment_event")).isEqualTo(1.0);
    }

    @Test
    void clickRequiresPositiveIds() {
        assertThatThrownBy(() -> service.recordClick(0L, 1, "d1", null, null))
            .isInstanceOf(InvalidSearchRequestException.class);
        assertThatThrownBy(() -> service.recordClick(3L, 0, "d1", null, null))
            .isInstanceOf(InvalidSearchRequestException.class);
    }

    @Test
    void recencyBoostAppliesInsideWindowOnly() {
        RankingHints hints = RankingHints.forIntent(IntentType.TRANSACTIONAL);
        BackendSearchResponse.Hit recent = hit("a", 1.0, "A");
        recent.setFreshnessDays(10);
        BackendSearchResponse.Hit old = hit("b", 1.0, "B");
        old.setFreshnessDays(45);

        assertThat(service.hintMultiplier(recent, List.of("a"), hints)).isEqualTo(1.3);
        assertThat(service.hintMultiplier(old, List.of("a"), hints)).isEqualTo(1.0);
    }

    private void stubClicksFor(String entityId) {
        when(historyRepository.findClickAggregates(anyCollection(), any(Instant.class)))
            .thenReturn(List.of(new ClickAggregate(entityId, 5, 4, 1.0, NOW)));
        when(historyRepository.countImpressions(any(Instant.class))).thenReturn(10L);
    }

    private double degradedCount(String stage) {
        return meterRegistry.counter("qs_search_enhancement_degraded_total", "stage", stage).count();
    }

    private static SearchRequest request(String query, Integer limit) {
        SearchRequest request = new SearchRequest();
        request.setQuery(query);
        request.setLimit(limit);
        request.setUserId("u1");
        return request;
    }

    private static BackendSearchResponse backendResponse(long total, BackendSearchResponse.Hit... hits) {
        BackendSearchResponse response = new BackendSearchResponse();
        response.setTotal(total);
        response.setHits(List.of(hits));
        return response;
    }

    private static BackendSearchResponse.Hit hit(String id, double score, String title) {
        BackendSearchResponse.Hit hit = new BackendSearchResponse.Hit();
        hit.setEntityType("doc");
        hit.setEntityId(id);
        hit.setScore(score);
        hit.setTitle(title);
        return hit;
    }
}
