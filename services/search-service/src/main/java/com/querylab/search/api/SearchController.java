package com.querylab.search.api;

import com.querylab.search.analytics.ClickAggregate;
import com.querylab.search.analytics.PerformanceStats;
import com.querylab.search.analytics.QueryCount;
import com.querylab.search.analytics.SearchAnalyticsService;
import com.querylab.search.analytics.SearchInsight;
import com.querylab.search.analytics.SearchStats;
import com.querylab.search.analytics.SearchTrends;
import com.querylab.search.analytics.SlowQuery;
import com.querylab.search.api.dto.ClickRequest;
import com.querylab.search.api.dto.ErrorResponse;
import com.querylab.search.api.dto.SearchRequest;
import com.querylab.search.api.dto.SearchResponse;
import com.querylab.search.backend.SearchBackendUnavailableException;
import com.querylab.search.ranking.ClickBoostRanker;
import com.querylab.search.service.InvalidSearchRequestException;
import com.querylab.search.service.SearchPipelineService;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SearchController {
    private static final Logger log = LoggerFactory.getLogger(SearchController.class);

    private final SearchPipelineService pipelineService;
    private final SearchAnalyticsService analyticsService;
    private final ClickBoostRanker clickBoostRanker;

    public SearchController(
        SearchPipelineService pipelineService,
        SearchAnalyticsService analyticsService,
        ClickBoostRanker clickBoostRanker
    ) {
        this.pipelineService = pipelineService;
        this.analyticsService = analyticsService;
        this.clickBoostRanker = clickBoostRanker;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @PostMapping("/search")
    public ResponseEntity<?> search(
        @RequestBody(required = false) SearchRequest request,
        @RequestHeader(value = RequestIds.TRACE_HEADER, required = false) String traceIdHeader,
        @RequestHeader(value = RequestIds.REQUEST_HEADER, required = false) String requestIdHeader
    ) {
        String traceId = RequestIds.resolve(traceIdHeader);
        String requestId = RequestIds.resolve(requestIdHeader);

        if (request == null) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", "request body is required", traceId, requestId)
            );
        }

        try {
            SearchResponse response = pipelineService.search(request, traceId, requestId);
            return ResponseEntity.ok(response);
        } catch (InvalidSearchRequestException e) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", e.getMessage(), traceId, requestId)
            );
        } catch (SearchBackendUnavailableException e) {
            log.warn("search backend unavailable request_id={}: {}", requestId, e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(
                new ErrorResponse("backend_unavailable", "Search backend is unavailable", traceId, requestId)
            );
        } catch (Exception e) {
            log.error("search failed request_id={}", requestId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                new ErrorResponse("internal_error", "Unexpected error", traceId, requestId)
            );
        }
    }

    @PostMapping("/search/click")
    public ResponseEntity<?> click(
        @RequestBody(required = false) ClickRequest request,
        @RequestHeader(value = RequestIds.TRACE_HEADER, required = false) String traceIdHeader,
        @RequestHeader(value = RequestIds.REQUEST_HEADER, required = false) String requestIdHeader
    ) {
        if (request == null || request.getSearchId() == null || request.getPosition() == null) {
            return ResponseEntity.badRequest().body(RequestIds.error(
                "bad_request",
                "search_id and position are required",
                traceIdHeader,
                requestIdHeader
            ));
        }
        boolean recorded = pipelineService.recordClick(
            request.getSearchId(),
            request.getPosition(),
            request.getEntityId(),
            request.getUserId(),
            request.getExperiment()
        );
        return ResponseEntity.ok(Map.of("recorded", recorded));
    }

    @GetMapping("/search/analytics")
    public SearchStats analytics(@RequestParam(value = "days", defaultValue = "7") int days) {
        return analyticsService.getStats(days);
    }

    @GetMapping("/search/popular")
    public List<QueryCount> popular(
        @RequestParam(value = "days", defaultValue = "7") int days,
        @RequestParam(value = "limit", defaultValue = "20") int limit,
        @RequestParam(value = "min_count", defaultValue = "1") int minCount
    ) {
        return analyticsService.getPopularSearches(days, limit, minCount);
    }

    @GetMapping("/search/zero-results")
    public List<QueryCount> zeroResults(
        @RequestParam(value = "days", defaultValue = "7") int days,
        @RequestParam(value = "limit", defaultValue = "20") int limit
    ) {
        return analyticsService.getZeroResultQueries(days, limit);
    }

    @GetMapping("/search/analytics/slow")
    public List<SlowQuery> slowQueries(
        @RequestParam(value = "days", defaultValue = "7") int days,
        @RequestParam(value = "min_time_ms", required = false) Long minTimeMs,
        @RequestParam(value = "limit", defaultValue = "20") int limit
    ) {
        return analyticsService.getSlowQueries(days, minTimeMs, limit);
    }

    @GetMapping("/search/analytics/performance")
    public PerformanceStats performance(@RequestParam(value = "days", defaultValue = "7") int days) {
        return analyticsService.getPerformanceStats(days);
    }

    @GetMapping("/search/analytics/trends")
    public SearchTrends trends(
        @RequestParam(value = "days", defaultValue = "30") int days,
        @RequestParam(value = "interval", defaultValue = "day") String interval
    ) {
        return analyticsService.getTrends(days, interval);
    }

    @GetMapping("/search/analytics/insights")
    public List<SearchInsight> insights(@RequestParam(value = "days", defaultValue = "30") int days) {
        return analyticsService.generateInsights(days);
    }

    @GetMapping("/search/top-clicked")
    public List<ClickAggregate> topClicked(
        @RequestParam(value = "days", defaultValue = "30") int days,
        @RequestParam(value = "limit", defaultValue = "20") int limit
    ) {
        return clickBoostRanker.getTopClickedEntities(days, limit);
    }
}
