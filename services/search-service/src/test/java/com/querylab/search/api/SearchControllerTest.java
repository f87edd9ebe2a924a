package com.querylab.search.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.querylab.search.analytics.ClickAggregate;
import com.querylab.search.analytics.PerformanceStats;
import com.querylab.search.analytics.QueryCount;
import com.querylab.search.analytics.SearchAnalyticsService;
import com.querylab.search.analytics.SearchInsight;
import com.querylab.search.analytics.SearchStats;
import com.querylab.search.analytics.SearchTrends;
import com.querylab.search.analytics.SlowQuery;
import com.querylab.search.analytics.TrendInterval;
import com.querylab.search.analytics.TrendPoint;
import com.querylab.search.api.dto.RankedHit;
import com.querylab.search.api.dto.SearchResponse;
import com.querylab.search.backend.SearchBackendUnavailableException;
import com.querylab.search.ranking.ClickBoostRanker;
import com.querylab.search.service.InvalidSearchRequestException;
import com.querylab.search.service.SearchPipelineService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(SearchController.class)
class SearchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SearchPipelineService pipelineService;

    @MockBean
    private SearchAnalyticsService analyticsService;

    @MockBean
    private ClickBoostRanker clickBoostRanker;

    @Test
    void healthReturnsOk() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    void searchReturnsRankedHits() throws Exception {
        SearchResponse response = new SearchResponse();
        response.setTraceId("trace-1");
        response.setRequestId("req-1");
        response.setSearchId(9L);
        response.setQuery("rust book");
        response.setTotalHits(1);
        RankedHit hit = new RankedHit();
        hit.setEntityType("doc");
        hit.setEntityId("d1");
        hit.setRank(1);
        hit.setScore(1.2);
        response.setHits(List.of(hit));
        when(pipelineService.search(any(), eq("trace-1"), eq("req-1"))).thenReturn(response);

        mockMvc.perform(post("/search")
                .header("x-trace-id", "trace-1")
                .header("x-request-id", "req-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"rust book\",\"entity_types\":[\"doc\"],\"limit\":5}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.trace_id").value("trace-1"))
            .andExpect(jsonPath("$.search_id").value(9))
            .andExpect(jsonPath("$.total_hits").value(1))
            .andExpect(jsonPath("$.cache_hit").value(false))
            .andExpect(jsonPath("$.hits[0].entity_id").value("d1"));
    }

    @Test
    void invalidSearchIsBadRequest() throws Exception {
        when(pipelineService.search(any(), anyString(), anyString()))
            .thenThrow(new InvalidSearchRequestException("query is required"));

        mockMvc.perform(post("/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"))
            .andExpect(jsonPath("$.error.message").value("query is required"));
    }

    @Test
    void backendOutageIsServiceUnavailable() throws Exception {
        when(pipelineService.search(any(), anyString(), anyString()))
            .thenThrow(new SearchBackendUnavailableException("Search backend unavailable"));

        mockMvc.perform(post("/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"rust\"}"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error.code").value("backend_unavailable"));
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"));
    }

    @Test
    void clickRequiresSearchIdAndPosition() throws Exception {
        mockMvc.perform(post("/search/click")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"entity_id\":\"d1\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.message").value("search_id and position are required"));
    }

    @Test
    void clickIsRecorded() throws Exception {
        when(pipelineService.recordClick(9L, 2, "d1", "u1", null)).thenReturn(true);

        mockMvc.perform(post("/search/click")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"search_id\":9,\"position\":2,\"entity_id\":\"d1\",\"user_id\":\"u1\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.recorded").value(true));
    }

    @Test
    void analyticsUsesDayWindow() throws Exception {
        when(analyticsService.getStats(30)).thenReturn(
            new SearchStats(10, 6, 0.2, 4.5, 20.0, 0.3, List.of(new QueryCount("rust", 4, 5.0, 12.0)), List.of())
        );

        mockMvc.perform(get("/search/analytics").param("days", "30"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_searches").value(10))
            .andExpect(jsonPath("$.unique_queries").value(6));
    }

    @Test
    void popularSearchesPassParameters() throws Exception {
        when(analyticsService.getPopularSearches(7, 5, 2)).thenReturn(List.of(new QueryCount("rust", 4, 5.0, 12.0)));

        mockMvc.perform(get("/search/popular").param("limit", "5").param("min_count", "2"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].query").value("rust"))
            .andExpect(jsonPath("$[0].count").value(4));
    }

    @Test
    void zeroResultQueriesOmitAverages() throws Exception {
        when(analyticsService.getZeroResultQueries(7, 20)).thenReturn(List.of(new QueryCount("zig", 3, null, null)));

        mockMvc.perform(get("/search/zero-results"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].query").value("zig"))
            .andExpect(jsonPath("$[0].avg_results").doesNotExist());
        verify(analyticsService).getZeroResultQueries(eq(7), eq(20));
    }

    @Test
    void missingClickFieldsNeverReachPipeline() throws Exception {
        mockMvc.perform(post("/search/click")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"search_id\":9}"))
            .andExpect(status().isBadRequest());
        verifyNoInteractions(pipelineService);
    }

    @Test
    void slowQueriesUseConfiguredThresholdUnlessGiven() throws Exception {
        when(analyticsService.getSlowQueries(7, null, 20)).thenReturn(List.of(new SlowQuery("graph db", 3, 812.5, 1204)));

        mockMvc.perform(get("/search/analytics/slow"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].query").value("graph db"))
            .andExpect(jsonPath("$[0].avg_time_ms").value(812.5))
            .andExpect(jsonPath("$[0].max_time_ms").value(1204));

        mockMvc.perform(get("/search/analytics/slow").param("min_time_ms", "250").param("limit", "5"))
            .andExpect(status().isOk());
        verify(analyticsService).getSlowQueries(7, 250L, 5);
    }

    @Test
    void performanceExposesPercentiles() throws Exception {
        when(analyticsService.getPerformanceStats(1))
            .thenReturn(new PerformanceStats(5, 30.0, 10.0, 50.0, 30.0, 48.0, 49.6, 500, 1, 0.2));

        mockMvc.perform(get("/search/analytics/performance").param("days", "1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_queries").value(5))
            .andExpect(jsonPath("$.p95_time_ms").value(48.0))
            .andExpect(jsonPath("$.slow_threshold_ms").value(500))
            .andExpect(jsonPath("$.slow_query_rate").value(0.2));
    }

    @Test
    void trendsRenderIntervalName() throws Exception {
        when(analyticsService.getTrends(14, "week")).thenReturn(new SearchTrends(
            TrendInterval.WEEK, 14, List.of(new TrendPoint("2024-03-04", 12, 9, 2)), 12, 0.86
        ));

        mockMvc.perform(get("/search/analytics/trends").param("days", "14").param("interval", "week"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.interval").value("week"))
            .andExpect(jsonPath("$.trends[0].period").value("2024-03-04"))
            .andExpect(jsonPath("$.trends[0].unique_queries").value(9))
            .andExpect(jsonPath("$.avg_daily_searches").value(0.86));
    }

    @Test
    void insightsOmitMissingFields() throws Exception {
        when(analyticsService.generateInsights(30)).thenReturn(List.of(new SearchInsight(
            "improvement", "Content Gaps Detected", "Frequently searched but no results: \"zig\"",
            null, null, "Consider adding content or synonyms for these terms"
        )));

        mockMvc.perform(get("/search/analytics/insights"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].type").value("improvement"))
            .andExpect(jsonPath("$[0].metric").doesNotExist())
            .andExpect(jsonPath("$[0].value").doesNotExist());
    }

    @Test
    void topClickedComesFromClickSignals() throws Exception {
        when(clickBoostRanker.getTopClickedEntities(30, 3))
            .thenReturn(List.of(new ClickAggregate("doc-7", 11, 6, 1.5, null)));

        mockMvc.perform(get("/search/top-clicked").param("limit", "3"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].entity_id").value("doc-7"))
            .andExpect(jsonPath("$[0].total_clicks").value(11))
            .andExpect(jsonPath("$[0].avg_position").value(1.5));
    }
}
