package com.querylab.search.experiment;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

@Service
public class ExperimentManager {
    private static final Logger log = LoggerFactory.getLogger(ExperimentManager.class);
    private static final String DEFAULT_PRIMARY_METRIC = "click_rate";
    static final String CONVERSION_EVENT = "conversion";

    private final ExperimentRepository repository;
    private final ExperimentProperties properties;
    private final Clock clock;

    public ExperimentManager(ExperimentRepository repository, ExperimentProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    public boolean isEnabled() {
        return properties.isEnabled();
    }

    public Experiment createExperiment(
        String name,
        String description,
        Map<String, Map<String, Object>> variants,
        Double trafficPercentage,
        String primaryMetric,
        String owner,
        String hypothesis
    ) {
        if (name == null || name.isBlank()) {
            throw new ExperimentValidationException("Experiment name is required");
        }
        if (variants == null || variants.size() < 2) {
            throw new ExperimentValidationException("Experiment must have at least 2 variants");
        }
        double traffic = trafficPercentage == null ? properties.getDefaultTrafficPercentage() : trafficPercentage;
        if (traffic <= 0.0 || traffic > 100.0) {
            throw new ExperimentValidationException("traffic_percentage must be in (0, 100]");
        }
        if (!variants.containsKey(properties.getControlVariant())) {
            log.warn("experiment {} has no '{}' variant; the first variant is used as control",
                name, properties.getControlVariant());
        }

        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : variants.entrySet()) {
            copy.put(entry.getKey(), entry.getValue() == null ? Collections.emptyMap() : entry.getValue());
        }
        String trimmedName = name.trim();
        Instant now = clock.instant();
        Experiment draft = new Experiment(
            null,
            trimmedName,
            description,
            copy,
            ExperimentStatus.DRAFT,
            traffic,
            null,
            null,
            primaryMetric == null || primaryMetric.isBlank() ? DEFAULT_PRIMARY_METRIC : primaryMetric,
            owner,
            hypothesis,
            now
        );
        long id;
        try {
            id = repository.insertExperiment(draft);
        } catch (DuplicateKeyException e) {
            throw new ExperimentConflictException("Experiment '" + trimmedName + "' already exists");
        }
        log.info("created experiment {} with variants {}", trimmedName, copy.keySet());
        return new Experiment(id, trimmedName, description, copy, ExperimentStatus.DRAFT, traffic, null, null,
            draft.getPrimaryMetric(), owner, hypothesis, now);
    }

    public Experiment startExperiment(String name) {
        Experiment experiment = requireExperiment(name);
        if (!experiment.getStatus().canStart()) {
            throw illegalTransition(experiment, ExperimentStatus.RUNNING);
        }
        Instant startDate = experiment.getStartDate() == null ? clock.instant() : experiment.getStartDate();
        return transition(experiment, ExperimentStatus.RUNNING, startDate, experiment.getEndDate());
    }

    public Experiment pauseExperiment(String name) {
        Experiment experiment = requireExperiment(name);
        if (!experiment.getStatus().canPause()) {
            throw illegalTransition(experiment, ExperimentStatus.PAUSED);
        }
        return transition(experiment, ExperimentStatus.PAUSED, experiment.getStartDate(), experiment.getEndDate());
    }

    public Experiment stopExperiment(String name) {
        Experiment experiment = requireExperiment(name);
        if (!experiment.getStatus().canStop()) {
            throw illegalTransition(experiment, ExperimentStatus.COMPLETED);
        }
        return transition(experiment, ExperimentStatus.COMPLETED, experiment.getStartDate(), clock.instant());
    }

    public Experiment cancelExperiment(String name) {
        Experiment experiment = requireExperiment(name);
        if (!experiment.getStatus().canCancel()) {
            throw illegalTransition(experiment, ExperimentStatus.CANCELLED);
        }
        return transition(experiment, ExperimentStatus.CANCELLED, experiment.getStartDate(), clock.instant());
    }

    public List<Experiment> listExperiments(ExperimentStatus status) {
        return repository.findAll(status);
    }

    public Experiment getExperiment(String name) {
        return requireExperiment(name);
    }

    /**
     * Returns the user's sticky variant, assigning one on first call. {@code null} when the manager is
     * disabled, the experiment is not running or the user falls outside the traffic allocation.
     */
    public VariantAssignment getVariant(String experimentName, String userId) {
        if (!properties.isEnabled() || userId == null || userId.isBlank()) {
            return null;
        }
        Experiment experiment = repository.findByName(experimentName);
        if (experiment == null || !experiment.isRunning()) {
            return null;
        }

        ExperimentAssignment existing = repository.findAssignment(experimentName, userId);
        if (existing != null) {
            return toVariantAssignment(experiment, existing.variant());
        }

        if (!VariantAssigner.isInTraffic(userId, experiment.getTrafficPercentage())) {
            return null;
        }
        String variant = VariantAssigner.assign(experimentName, userId, experiment.getVariantNames());
        if (variant == null) {
            return null;
        }
        try {
            repository.insertAssignment(new ExperimentAssignment(experimentName, userId, variant, clock.instant()));
        } catch (DuplicateKeyException e) {
            ExperimentAssignment stored = repository.findAssignment(experimentName, userId);
            if (stored == null) {
                throw e;
            }
            log.debug("concurrent assignment for experiment={} user={}, using stored variant", experimentName, userId);
            return toVariantAssignment(experiment, stored.variant());
        }
        return toVariantAssignment(experiment, variant);
    }

    public boolean trackEvent(
        String experimentName,
        String userId,
        String eventType,
        Double eventValue,
        Map<String, Object> metadata
    ) {
        if (!properties.isEnabled() || userId == null || eventType == null || eventType.isBlank()) {
            return false;
        }
        ExperimentAssignment assignment = repository.findAssignment(experimentName, userId);
        if (assignment == null) {
            log.debug("ignoring {} event for unassigned user={} experiment={}", eventType, userId, experimentName);
            return false;
        }
        repository.insertEvent(new ExperimentEvent(
            experimentName,
            userId,
            assignment.variant(),
            eventType,
            eventValue,
            metadata,
            clock.instant()
        ));
        return true;
    }

    public boolean trackConversion(String experimentName, String userId, Double value) {
        return trackConversion(experimentName, userId, value, null);
    }

    public boolean trackConversion(String experimentName, String userId, Double value, Map<String, Object> metadata) {
        return trackEvent(experimentName, userId, CONVERSION_EVENT, value == null ? 1.0 : value, metadata);
    }

    public ExperimentResults getResults(String experimentName) {
        Experiment experiment = requireExperiment(experimentName);
        List<VariantStats> stats = new ArrayList<>();
        for (String variant : experiment.getVariantNames()) {
            stats.add(variantStats(experimentName, variant));
        }

        String winner = null;
        boolean significant = false;
        Double pValue = null;
        if (stats.size() >= 2) {
            VariantStats control = findControl(stats);
            VariantStats treatment = findTreatment(stats, control);
            int minSample = properties.getMinSampleSize();
            if (control.participants() >= minSample && treatment.participants() >= minSample) {
                pValue = SignificanceCalculator.twoSidedPValue(control, treatment);
                significant = SignificanceCalculator.isSignificant(pValue, properties.getConfidenceLevel());
                if (significant) {
                    winner = treatment.conversionRate() > control.conversionRate()
                        ? treatment.variant()
                        : control.variant();
                }
            }
        }

        if (significant && properties.isAutoStopOnSignificance() && experiment.isRunning()) {
            log.info("experiment {} reached significance (p={}), stopping", experimentName, pValue);
            experiment = transition(experiment, ExperimentStatus.COMPLETED, experiment.getStartDate(), clock.instant());
        }

        long totalParticipants = 0L;
        for (VariantStats variantStats : stats) {
            totalParticipants += variantStats.participants();
        }
        return new ExperimentResults(
            experimentName,
            experiment.getStatus(),
            experiment.getStartDate(),
            experiment.getEndDate(),
            durationDays(experiment),
            totalParticipants,
            stats,
            winner,
            significant,
            pValue,
            properties.getConfidenceLevel(),
            recommendation(experiment.getStatus(), stats.size(), totalParticipants, winner, significant)
        );
    }

    String recommendation(
        ExperimentStatus status,
        int variantCount,
        long totalParticipants,
        String winner,
        boolean significant
    ) {
        if (status == ExperimentStatus.DRAFT) {
            return "Experiment not yet started. Start the experiment to begin collecting data.";
        }
        long required = (long) properties.getMinSampleSize() * variantCount;
        if (totalParticipants < required) {
            return "Need more data. Collect " + (required - totalParticipants)
                + " more participants for reliable results.";
        }
        if (significant && winner != null) {
            return "Significant result! '" + winner + "' variant is the winner. Consider rolling out.";
        }
        if (!significant) {
            return "No significant difference detected. Continue running or consider ending if sufficient data.";
        }
        return "Review results and make a decision based on business context.";
    }

    private VariantStats variantStats(String experimentName, String variant) {
        long participants = repository.countParticipants(experimentName, variant);
        ExperimentRepository.EventSummary summary =
            repository.summarizeEvents(experimentName, variant, properties.getConversionEventTypes());
        return VariantStats.of(variant, participants, summary.conversions(), summary.avgValue(), summary.totalValue());
    }

    private VariantStats findControl(List<VariantStats> stats) {
        for (VariantStats candidate : stats) {
            if (candidate.variant().equals(properties.getControlVariant())) {
                return candidate;
            }
        }
        return stats.get(0);
    }

    private static VariantStats findTreatment(List<VariantStats> stats, VariantStats control) {
        for (VariantStats candidate : stats) {
            if (candidate != control) {
                return candidate;
            }
        }
        return stats.get(1);
    }

    private long durationDays(Experiment experiment) {
        if (experiment.getStartDate() == null) {
            return 0L;
        }
        Instant end = experiment.getEndDate() == null ? clock.instant() : experiment.getEndDate();
        return Math.max(0L, Duration.between(experiment.getStartDate(), end).toDays());
    }

    private Experiment requireExperiment(String name) {
        Experiment experiment = name == null ? null : repository.findByName(name);
        if (experiment == null) {
            throw new ExperimentNotFoundException("Experiment '" + name + "' not found");
        }
        return experiment;
    }

    private Experiment transition(Experiment experiment, ExperimentStatus target, Instant startDate, Instant endDate) {
        repository.updateStatus(experiment.getName(), target, startDate, endDate);
        log.info("experiment {} {} -> {}", experiment.getName(), experiment.getStatus().value(), target.value());
        return new Experiment(
            experiment.getId(),
            experiment.getName(),
            experiment.getDescription(),
            experiment.getVariants(),
            target,
            experiment.getTrafficPercentage(),
            startDate,
            endDate,
            experiment.getPrimaryMetric(),
            experiment.getOwner(),
            experiment.getHypothesis(),
            experiment.getCreatedAt()
        );
    }

    private static ExperimentStateException illegalTransition(Experiment experiment, ExperimentStatus target) {
        return new ExperimentStateException(
            "Cannot move experiment '" + experiment.getName() + "' from "
                + experiment.getStatus().value() + " to " + target.value()
        );
    }

    private static VariantAssignment toVariantAssignment(Experiment experiment, String variant) {
        return new VariantAssignment(variant, experiment.variantConfig(variant), experiment.getName());
    }
}
