package com.querylab.search.experiment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

@Repository
public class ExperimentRepository {
    private static final TypeReference<LinkedHashMap<String, Map<String, Object>>> VARIANTS_TYPE =
        new TypeReference<>() {};

    private static final String EXPERIMENT_COLUMNS =
        "id, name, description, variants, status, traffic_percentage, start_date, end_date, "
            + "primary_metric, owner, hypothesis, created_at";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public ExperimentRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public long insertExperiment(Experiment experiment) {
        String variantsJson = writeJson(experiment.getVariants());
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO search_experiments (name, description, variants, status, traffic_percentage, "
                    + "primary_metric, owner, hypothesis, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                Statement.RETURN_GENERATED_KEYS
            );
            ps.setString(1, experiment.getName());
            ps.setString(2, experiment.getDescription());
            ps.setString(3, variantsJson);
            ps.setString(4, experiment.getStatus().value());
            ps.setDouble(5, experiment.getTrafficPercentage());
            ps.setString(6, experiment.getPrimaryMetric());
            ps.setString(7, experiment.getOwner());
            ps.setString(8, experiment.getHypothesis());
            ps.setTimestamp(9, experiment.getCreatedAt() == null ? null : Timestamp.from(experiment.getCreatedAt()));
            return ps;
        }, keyHolder);
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    public Experiment findByName(String name) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT " + EXPERIMENT_COLUMNS + " FROM search_experiments WHERE name = ?",
            new Object[] {name}
        );
        if (rows.isEmpty()) {
            return null;
        }
        return toExperiment(rows.get(0));
    }

    public List<Experiment> findAll(ExperimentStatus status) {
        List<Map<String, Object>> rows;
        if (status == null) {
            rows = jdbcTemplate.queryForList(
                "SELECT " + EXPERIMENT_COLUMNS + " FROM search_experiments ORDER BY created_at DESC, id DESC"
            );
        } else {
            rows = jdbcTemplate.queryForList(
                "SELECT " + EXPERIMENT_COLUMNS + " FROM search_experiments WHERE status = ? "
                    + "ORDER BY created_at DESC, id DESC",
                new Object[] {status.value()}
            );
        }
        List<Experiment> result = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            result.add(toExperiment(row));
        }
        return result;
    }

    public int updateStatus(String name, ExperimentStatus status, Instant startDate, Instant endDate) {
        return jdbcTemplate.update(
            "UPDATE search_experiments SET status = ?, start_date = ?, end_date = ? WHERE name = ?",
            status.value(),
            startDate == null ? null : Timestamp.from(startDate),
            endDate == null ? null : Timestamp.from(endDate),
            name
        );
    }

    public ExperimentAssignment findAssignment(String experimentName, String userId) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT experiment_name, user_id, variant, assigned_at FROM search_experiment_assignments "
                + "WHERE experiment_name = ? AND user_id = ?",
            new Object[] {experimentName, userId}
        );
        if (rows.isEmpty()) {
            return null;
        }
        Map<String, Object> row = rows.get(0);
        return new ExperimentAssignment(
            (String) row.get("experiment_name"),
            (String) row.get("user_id"),
            (String) row.get("variant"),
            toInstant(row.get("assigned_at"))
        );
    }

    /**
     * Throws {@link org.springframework.dao.DuplicateKeyException} when the user already holds an
     * assignment for the experiment.
     */
    public void insertAssignment(ExperimentAssignment assignment) {
        jdbcTemplate.update(
            "INSERT INTO search_experiment_assignments (experiment_name, user_id, variant, assigned_at) "
                + "VALUES (?, ?, ?, ?)",
            assignment.experimentName(),
            assignment.userId(),
            assignment.variant(),
            Timestamp.from(assignment.assignedAt())
        );
    }

    public void insertEvent(ExperimentEvent event) {
        jdbcTemplate.update(
            "INSERT INTO search_experiment_events (experiment_name, user_id, variant, event_type, event_value, "
                + "metadata, created_at) VALUES (?, ?, ?, ?, ?, ?, ?)",
            event.experimentName(),
            event.userId(),
            event.variant(),
            event.eventType(),
            event.eventValue(),
            event.metadata() == null || event.metadata().isEmpty() ? null : writeJson(event.metadata()),
            Timestamp.from(event.createdAt())
        );
    }

    public long countParticipants(String experimentName, String variant) {
        Long value = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM search_experiment_assignments WHERE experiment_name = ? AND variant = ?",
            Long.class,
            experimentName,
            variant
        );
        return value == null ? 0L : value;
    }

    public EventSummary summarizeEvents(String experimentName, String variant, Collection<String> conversionTypes) {
        List<Object> args = new ArrayList<>();
        String conversionClause;
        if (conversionTypes == null || conversionTypes.isEmpty()) {
            conversionClause = "NULL";
        } else {
            conversionClause = "CASE WHEN event_type IN ("
                + String.join(", ", Collections.nCopies(conversionTypes.size(), "?"))
                + ") THEN user_id END";
            args.addAll(conversionTypes);
        }
        args.add(experimentName);
        args.add(variant);
        Map<String, Object> row = jdbcTemplate.queryForMap(
            "SELECT COUNT(DISTINCT " + conversionClause + ") AS conversions, AVG(event_value) AS avg_value, "
                + "COALESCE(SUM(event_value), 0) AS total_value FROM search_experiment_events "
                + "WHERE experiment_name = ? AND variant = ?",
            args.toArray()
        );
        Double avgValue = toDouble(row.get("avg_value"));
        return new EventSummary(
            toLong(row.get("conversions")),
            avgValue == null || avgValue == 0.0 ? null : avgValue,
            toDoubleOrZero(row.get("total_value"))
        );
    }

    private Experiment toExperiment(Map<String, Object> row) {
        return new Experiment(
            row.get("id") == null ? null : toLong(row.get("id")),
            (String) row.get("name"),
            (String) row.get("description"),
            readVariants(row.get("variants")),
            ExperimentStatus.fromValue((String) row.get("status")),
            toDoubleOrZero(row.get("traffic_percentage")),
            toInstant(row.get("start_date")),
            toInstant(row.get("end_date")),
            (String) row.get("primary_metric"),
            (String) row.get("owner"),
            (String) row.get("hypothesis"),
            toInstant(row.get("created_at"))
        );
    }

    private Map<String, Map<String, Object>> readVariants(Object raw) {
        if (raw == null) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(String.valueOf(raw), VARIANTS_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored experiment variants are not valid JSON", e);
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ExperimentValidationException("Experiment payload is not serializable: " + e.getOriginalMessage());
        }
    }

    private static long toLong(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        return 0L;
    }

    private static Double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return null;
    }

    private static double toDoubleOrZero(Object value) {
        Double result = toDouble(value);
        return result == null ? 0.0 : result;
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Timestamp timestamp) {
            return timestamp.toInstant();
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toInstant(ZoneOffset.UTC);
        }
        return null;
    }

    public record EventSummary(long conversions, Double avgValue, double totalValue) {}
}
