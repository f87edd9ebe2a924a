package com.querylab.search.analytics;

import com.querylab.search.cache.CacheKeyUtil;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SearchAnalyticsService {
    private static final Logger log = LoggerFactory.getLogger(SearchAnalyticsService.class);
    private static final int TOP_QUERY_LIMIT = 10;
    private static final int CONTENT_GAP_SAMPLE = 3;

    private final SearchHistoryRepository repository;
    private final AnalyticsProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public SearchAnalyticsService(
        SearchHistoryRepository repository,
        AnalyticsProperties properties,
        Clock clock,
        MeterRegistry meterRegistry
    ) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    public static String normalizeQuery(String query) {
        if (query == null || query.isBlank()) {
            return "";
        }
        return String.join(" ", query.strip().toLowerCase(Locale.ROOT).split("\\s+"));
    }

    public static String hashQuery(String query) {
        return CacheKeyUtil.sha256(normalizeQuery(query));
    }

    public long recordSearch(
        String query,
        int resultsCount,
        long tookMs,
        List<String> entityTypes,
        String userId,
        String sessionId,
        String searchSyntax
    ) {
        if (isSlow(tookMs)) {
            meterRegistry.counter("qs_search_slow_total").increment();
            log.warn("slow search query='{}' took_ms={} threshold_ms={} results={}",
                query, tookMs, properties.getSlowQueryThresholdMs(), resultsCount);
        }
        SearchRecord record = new SearchRecord(
            null,
            query,
            hashQuery(query),
            normalizeQuery(query),
            entityTypes,
            resultsCount,
            tookMs,
            userId,
            sessionId,
            searchSyntax,
            false,
            null,
            null,
            clock.instant()
        );
        return repository.insertSearch(record);
    }

    public boolean recordClick(long searchId, int position, String entityId) {
        return repository.markClicked(searchId, position, entityId) > 0;
    }

    public boolean isSlow(long tookMs) {
        return tookMs >= properties.getSlowQueryThresholdMs();
    }

    public SearchStats getStats(int days) {
        Instant since = since(days);
        Map<String, Object> row = repository.aggregateStats(since);
        long total = SearchHistoryRepository.toLong(row.get("total_searches"));
        if (total == 0) {
            return SearchStats.empty();
        }
        long zeroResults = SearchHistoryRepository.toLong(row.get("zero_results"));
        long clicked = SearchHistoryRepository.toLong(row.get("clicked"));
        return new SearchStats(
            total,
            SearchHistoryRepository.toLong(row.get("unique_queries")),
            (double) zeroResults / total,
            SearchHistoryRepository.toDouble(row.get("avg_results"), 0.0),
            SearchHistoryRepository.toDouble(row.get("avg_took_ms"), 0.0),
            (double) clicked / total,
            repository.findPopularQueries(since, TOP_QUERY_LIMIT, 1),
            repository.findZeroResultQueries(since, TOP_QUERY_LIMIT)
        );
    }

    public List<QueryCount> getPopularSearches(int days, int limit, int minCount) {
        return repository.findPopularQueries(since(days), limit, minCount);
    }

    public List<QueryCount> getZeroResultQueries(int days, int limit) {
        return repository.findZeroResultQueries(since(days), limit);
    }

    /**
     * Queries whose latency reached {@code minTimeMs} (the configured slow threshold when null),
     * slowest average first.
     */
    public List<SlowQuery> getSlowQueries(int days, Long minTimeMs, int limit) {
        long threshold = minTimeMs == null ? properties.getSlowQueryThresholdMs() : Math.max(0L, minTimeMs);
        return repository.findSlowQueries(since(days), threshold, Math.max(1, limit));
    }

    public PerformanceStats getPerformanceStats(int days) {
        Instant since = since(days);
        long threshold = properties.getSlowQueryThresholdMs();
        Map<String, Object> row = repository.latencySummary(since, threshold);
        long total = SearchHistoryRepository.toLong(row.get("total_searches"));
        if (total == 0) {
            return PerformanceStats.empty(threshold);
        }
        List<Long> latencies = repository.findRecentLatencies(since, Math.max(1, properties.getLatencySampleSize()));
        double[] sample = latencies.stream().mapToDouble(Long::doubleValue).toArray();
        long slow = SearchHistoryRepository.toLong(row.get("slow_searches"));
        return new PerformanceStats(
            total,
            SearchHistoryRepository.toDouble(row.get("avg_took_ms"), 0.0),
            SearchHistoryRepository.toDouble(row.get("min_took_ms"), 0.0),
            SearchHistoryRepository.toDouble(row.get("max_took_ms"), 0.0),
            percentile(sample, 50.0),
            percentile(sample, 95.0),
            percentile(sample, 99.0),
            threshold,
            slow,
            (double) slow / total
        );
    }

    public SearchTrends getTrends(int days, String interval) {
        TrendInterval resolved = TrendInterval.fromValue(interval);
        int window = Math.max(0, days);
        List<TrendPoint> points = repository.findTrends(since(window), resolved);
        long total = 0L;
        for (TrendPoint point : points) {
            total += point.count();
        }
        double avgDaily = window > 0 ? Math.round(total * 100.0 / window) / 100.0 : 0.0;
        return new SearchTrends(resolved, window, points, total, avgDaily);
    }

    /**
     * Rule-based observations over {@link #getStats(int)}. An empty window yields no insights.
     */
    public List<SearchInsight> generateInsights(int days) {
        SearchStats stats = getStats(days);
        List<SearchInsight> insights = new ArrayList<>();
        if (stats.getTotalSearches() == 0) {
            return insights;
        }

        double zeroRate = stats.getZeroResultRate();
        if (zeroRate > 0.2) {
            insights.add(new SearchInsight(
                "warning",
                "High Zero-Result Rate",
                percent(zeroRate) + " of searches return no results",
                "zero_result_rate",
                zeroRate,
                "Review zero-result queries to identify content gaps or add synonyms and spelling corrections"
            ));
        } else if (zeroRate < 0.05) {
            insights.add(new SearchInsight(
                "info",
                "Excellent Search Coverage",
                "Only " + percent(zeroRate) + " of searches return no results",
                "zero_result_rate",
                zeroRate,
                null
            ));
        }

        double ctr = stats.getClickThroughRate();
        if (ctr < 0.3) {
            insights.add(new SearchInsight(
                "improvement",
                "Low Click-Through Rate",
                "Only " + percent(ctr) + " of searches lead to clicks",
                "click_through_rate",
                ctr,
                "Improve result ranking or snippets to make results more relevant and appealing"
            ));
        }

        double avgMs = stats.getAvgResponseTimeMs();
        if (avgMs > properties.getSlowQueryThresholdMs()) {
            insights.add(new SearchInsight(
                "warning",
                "Slow Search Response",
                String.format(Locale.ROOT, "Average search takes %.0fms", avgMs),
                "avg_response_time_ms",
                avgMs,
                "Consider adding more indexes or optimizing the search query for better performance"
            ));
        }

        if (!stats.getTopQueries().isEmpty()) {
            QueryCount top = stats.getTopQueries().get(0);
            insights.add(new SearchInsight(
                "info",
                "Most Popular Search",
                "\"" + top.query() + "\" searched " + top.count() + " times",
                "top_query_count",
                (double) top.count(),
                null
            ));
        }

        if (!stats.getZeroResultQueries().isEmpty()) {
            String gaps = stats.getZeroResultQueries().stream()
                .limit(CONTENT_GAP_SAMPLE)
                .map(query -> "\"" + query.query() + "\"")
                .collect(Collectors.joining(", "));
            insights.add(new SearchInsight(
                "improvement",
                "Content Gaps Detected",
                "Frequently searched but no results: " + gaps,
                null,
                null,
                "Consider adding content or synonyms for these terms"
            ));
        }
        return insights;
    }

    /**
     * Deletes history rows older than {@code days} (the configured retention when null).
     */
    public int cleanupHistory(Integer days) {
        int retention = Math.max(1, days == null ? properties.getRetentionDays() : days);
        int deleted = repository.deleteOlderThan(since(retention));
        log.info("deleted {} search history rows older than {} days", deleted, retention);
        return deleted;
    }

    static double percentile(double[] sample, double quantile) {
        if (sample.length == 0) {
            return 0.0;
        }
        Percentile estimator = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        return estimator.evaluate(sample, quantile);
    }

    private static String percent(double rate) {
        return String.format(Locale.ROOT, "%.1f%%", rate * 100.0);
    }

    private Instant since(int days) {
        return clock.instant().minus(Duration.ofDays(Math.max(0, days)));
    }
}
