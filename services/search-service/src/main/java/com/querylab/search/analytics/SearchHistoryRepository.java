package com.querylab.search.analytics;

import java.sql.PreparedStatement;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

@Repository
public class SearchHistoryRepository {
    private final JdbcTemplate jdbcTemplate;

    public SearchHistoryRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public long insertSearch(SearchRecord record) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO search_queries (query_text, query_hash, normalized_query, entity_types, results_count, "
                    + "took_ms, user_id, session_id, search_syntax, clicked_result, created_at) "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, 0, ?)",
                Statement.RETURN_GENERATED_KEYS
            );
            ps.setString(1, record.queryText());
            ps.setString(2, record.queryHash());
            ps.setString(3, record.normalizedQuery());
            if (record.entityTypes() == null || record.entityTypes().isEmpty()) {
                ps.setNull(4, Types.VARCHAR);
            } else {
                ps.setString(4, String.join(",", record.entityTypes()));
            }
            ps.setInt(5, record.resultsCount());
            ps.setLong(6, record.tookMs());
            ps.setString(7, record.userId());
            ps.setString(8, record.sessionId());
            ps.setString(9, record.searchSyntax());
            ps.setTimestamp(10, Timestamp.from(record.createdAt()));
            return ps;
        }, keyHolder);
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    public int markClicked(long searchId, int position, String entityId) {
        return jdbcTemplate.update(
            "UPDATE search_queries SET clicked_result = 1, clicked_position = ?, clicked_entity_id = ? WHERE id = ?",
            position,
            entityId,
            searchId
        );
    }

    public ClickAggregate findClickAggregate(String entityId, Instant since) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT clicked_entity_id, COUNT(*) AS total_clicks, COUNT(DISTINCT query_hash) AS unique_searches, "
                + "AVG(clicked_position) AS avg_position, MAX(created_at) AS last_clicked "
                + "FROM search_queries WHERE clicked_entity_id = ? AND clicked_result = 1 AND created_at >= ? "
                + "GROUP BY clicked_entity_id",
            new Object[] {entityId, Timestamp.from(since)}
        );
        if (rows.isEmpty()) {
            return null;
        }
        ClickAggregate aggregate = toClickAggregate(rows.get(0));
        return aggregate.totalClicks() == 0 ? null : aggregate;
    }

    public List<ClickAggregate> findClickAggregates(Collection<String> entityIds, Instant since) {
        if (entityIds == null || entityIds.isEmpty()) {
            return List.of();
        }
        List<Object> args = new ArrayList<>(entityIds);
        args.add(Timestamp.from(since));
        String placeholders = String.join(", ", Collections.nCopies(entityIds.size(), "?"));
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT clicked_entity_id, COUNT(*) AS total_clicks, COUNT(DISTINCT query_hash) AS unique_searches, "
                + "AVG(clicked_position) AS avg_position, MAX(created_at) AS last_clicked "
                + "FROM search_queries WHERE clicked_entity_id IN (" + placeholders + ") "
                + "AND clicked_result = 1 AND created_at >= ? GROUP BY clicked_entity_id",
            args.toArray()
        );
        List<ClickAggregate> result = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            result.add(toClickAggregate(row));
        }
        return result;
    }

    public long countImpressions(Instant since) {
        Long value = jdbcTemplate.queryForObject(
            "SELECT COUNT(DISTINCT query_hash) FROM search_queries WHERE results_count > 0 AND created_at >= ?",
            Long.class,
            Timestamp.from(since)
        );
        return value == null ? 0L : value;
    }

    public List<ClickAggregate> findTopClicked(Instant since, int limit) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT clicked_entity_id, COUNT(*) AS total_clicks, COUNT(DISTINCT query_hash) AS unique_searches, "
                + "AVG(clicked_position) AS avg_position, MAX(created_at) AS last_clicked "
                + "FROM search_queries WHERE clicked_result = 1 AND created_at >= ? "
                + "GROUP BY clicked_entity_id ORDER BY total_clicks DESC LIMIT ?",
            new Object[] {Timestamp.from(since), limit}
        );
        List<ClickAggregate> result = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            result.add(toClickAggregate(row));
        }
        return result;
    }

    public Map<String, Object> aggregateStats(Instant since) {
        return jdbcTemplate.queryForMap(
            "SELECT COUNT(*) AS total_searches, COUNT(DISTINCT query_hash) AS unique_queries, "
                + "COALESCE(SUM(CASE WHEN results_count = 0 THEN 1 ELSE 0 END), 0) AS zero_results, "
                + "AVG(results_count) AS avg_results, AVG(took_ms) AS avg_took_ms, "
                + "COALESCE(SUM(CASE WHEN clicked_result = 1 THEN 1 ELSE 0 END), 0) AS clicked "
                + "FROM search_queries WHERE created_at >= ?",
            Timestamp.from(since)
        );
    }

    public List<QueryCount> findPopularQueries(Instant since, int limit, int minCount) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT normalized_query, COUNT(*) AS query_count, AVG(results_count) AS avg_results, "
                + "AVG(took_ms) AS avg_took_ms FROM search_queries WHERE created_at >= ? "
                + "GROUP BY normalized_query HAVING COUNT(*) >= ? ORDER BY query_count DESC LIMIT ?",
            new Object[] {Timestamp.from(since), minCount, limit}
        );
        List<QueryCount> result = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            result.add(new QueryCount(
                (String) row.get("normalized_query"),
                toLong(row.get("query_count")),
                toDouble(row.get("avg_results"), 0.0),
                toDouble(row.get("avg_took_ms"), 0.0)
            ));
        }
        return result;
    }

    public List<QueryCount> findZeroResultQueries(Instant since, int limit) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT normalized_query, COUNT(*) AS query_count FROM search_queries "
                + "WHERE created_at >= ? AND results_count = 0 "
                + "GROUP BY normalized_query ORDER BY query_count DESC LIMIT ?",
            new Object[] {Timestamp.from(since), limit}
        );
        List<QueryCount> result = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            result.add(new QueryCount((String) row.get("normalized_query"), toLong(row.get("query_count")), null, null));
        }
        return result;
    }

    public List<SlowQuery> findSlowQueries(Instant since, long minTookMs, int limit) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT normalized_query, COUNT(*) AS query_count, AVG(took_ms) AS avg_took_ms, MAX(took_ms) AS max_took_ms "
                + "FROM search_queries WHERE created_at >= ? AND took_ms >= ? "
                + "GROUP BY normalized_query ORDER BY avg_took_ms DESC LIMIT ?",
            new Object[] {Timestamp.from(since), minTookMs, limit}
        );
        List<SlowQuery> result = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            result.add(new SlowQuery(
                (String) row.get("normalized_query"),
                toLong(row.get("query_count")),
                toDouble(row.get("avg_took_ms"), 0.0),
                toLong(row.get("max_took_ms"))
            ));
        }
        return result;
    }

    public Map<String, Object> latencySummary(Instant since, long slowThresholdMs) {
        return jdbcTemplate.queryForMap(
            "SELECT COUNT(*) AS total_searches, AVG(took_ms) AS avg_took_ms, MIN(took_ms) AS min_took_ms, "
                + "MAX(took_ms) AS max_took_ms, "
                + "COALESCE(SUM(CASE WHEN took_ms >= ? THEN 1 ELSE 0 END), 0) AS slow_searches "
                + "FROM search_queries WHERE created_at >= ?",
            slowThresholdMs,
            Timestamp.from(since)
        );
    }

    public List<Long> findRecentLatencies(Instant since, int limit) {
        return jdbcTemplate.queryForList(
            "SELECT took_ms FROM search_queries WHERE created_at >= ? ORDER BY created_at DESC LIMIT ?",
            Long.class,
            Timestamp.from(since),
            limit
        );
    }

    public List<TrendPoint> findTrends(Instant since, TrendInterval interval) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT " + interval.periodExpression() + " AS period, COUNT(*) AS query_count, "
                + "COUNT(DISTINCT query_hash) AS unique_queries, "
                + "COALESCE(SUM(CASE WHEN results_count = 0 THEN 1 ELSE 0 END), 0) AS zero_results "
                + "FROM search_queries WHERE created_at >= ? GROUP BY period ORDER BY period",
            new Object[] {Timestamp.from(since)}
        );
        List<TrendPoint> result = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            result.add(new TrendPoint(
                row.get("period") == null ? "" : String.valueOf(row.get("period")),
                toLong(row.get("query_count")),
                toLong(row.get("unique_queries")),
                toLong(row.get("zero_results"))
            ));
        }
        return result;
    }

    public int deleteOlderThan(Instant cutoff) {
        return jdbcTemplate.update("DELETE FROM search_queries WHERE created_at < ?", Timestamp.from(cutoff));
    }

    private static ClickAggregate toClickAggregate(Map<String, Object> row) {
        return new ClickAggregate(
            row.get("clicked_entity_id") == null ? null : String.valueOf(row.get("clicked_entity_id")),
            toLong(row.get("total_clicks")),
            toLong(row.get("unique_searches")),
            toDouble(row.get("avg_position"), null),
            toInstant(row.get("last_clicked"))
        );
    }

    static long toLong(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        return 0L;
    }

    static Double toDouble(Object value, Double fallback) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return fallback;
    }

    static Instant toInstant(Object value) {
        if (value instanceof Timestamp timestamp) {
            return timestamp.toInstant();
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toInstant(ZoneOffset.UTC);
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        return null;
    }
}
