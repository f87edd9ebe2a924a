package com.querylab.search.ranking;

import com.querylab.search.analytics.ClickAggregate;
import com.querylab.search.analytics.SearchHistoryRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ClickBoostRanker {
    private static final Logger log = LoggerFactory.getLogger(ClickBoostRanker.class);

    private final SearchHistoryRepository historyRepository;
    private final RankingProperties properties;
    private final Clock clock;

    public ClickBoostRanker(SearchHistoryRepository historyRepository, RankingProperties properties, Clock clock) {
        this.historyRepository = historyRepository;
        this.properties = properties;
        this.clock = clock;
    }

    public RankingSettings defaultSettings() {
        return RankingSettings.from(properties);
    }

    public ClickSignal getClickSignal(String entityType, String entityId) {
        return getClickSignal(entityType, entityId, defaultSettings().getClickDecayDays());
    }

    public ClickSignal getClickSignal(String entityType, String entityId, int days) {
        Instant since = clock.instant().minus(Duration.ofDays(Math.max(1, days)));
        try {
            ClickAggregate aggregate = historyRepository.findClickAggregate(entityId, since);
            if (aggregate == null || aggregate.totalClicks() == 0) {
                return null;
            }
            long impressions = historyRepository.countImpressions(since);
            return toSignal(entityType, entityId, aggregate, impressions);
        } catch (RuntimeException e) {
            log.warn("click signal lookup failed entity={}/{}: {}", entityType, entityId, e.getMessage());
            return null;
        }
    }

    public double getClickBoost(String entityType, String entityId) {
        return getClickBoost(entityType, entityId, defaultSettings());
    }

    public double getClickBoost(String entityType, String entityId, RankingSettings settings) {
        if (!settings.isEnableClickBoost()) {
            return 0.0;
        }
        ClickSignal signal = getClickSignal(entityType, entityId, settings.getClickDecayDays());
        return boostFor(signal, settings);
    }

    public Map<String, Double> getBatchClickBoosts(String entityType, Collection<String> entityIds) {
        return getBatchClickBoosts(entityType, entityIds, defaultSettings());
    }

    /**
     * Boosts for many entities from one aggregate query plus one impressions query. Entities
     * without a non-zero boost are left out of the result.
     */
    public Map<String, Double> getBatchClickBoosts(
        String entityType,
        Collection<String> entityIds,
        RankingSettings settings
    ) {
        Map<String, Double> boosts = new LinkedHashMap<>();
        if (!settings.isEnableClickBoost() || entityIds == null || entityIds.isEmpty()) {
            return boosts;
        }
        Instant since = clock.instant().minus(Duration.ofDays(settings.getClickDecayDays()));
        try {
            List<ClickAggregate> aggregates = historyRepository.findClickAggregates(entityIds, since);
            if (aggregates.isEmpty()) {
                return boosts;
            }
            long impressions = historyRepository.countImpressions(since);
            for (ClickAggregate aggregate : aggregates) {
                double boost = boostFor(toSignal(entityType, aggregate.entityId(), aggregate, impressions), settings);
                if (boost > 0.0) {
                    boosts.put(aggregate.entityId(), boost);
                }
            }
            return boosts;
        } catch (RuntimeException e) {
            log.warn("batch click boost lookup failed entity_type={} ids={}: {}", entityType, entityIds.size(), e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    public double calculateFinalRank(double baseRank, String entityType, double clickBoost, Integer freshnessDays) {
        return calculateFinalRank(baseRank, entityType, clickBoost, freshnessDays, defaultSettings());
    }

    public double calculateFinalRank(
        double baseRank,
        String entityType,
        double clickBoost,
        Integer freshnessDays,
        RankingSettings settings
    ) {
        double rank = baseRank;
        if (settings.isEnableClickBoost() && clickBoost > 0) {
            rank *= 1 + clickBoost * settings.getClickBoostWeight();
        }
        Double entityBoost = entityType == null ? null : settings.getEntityBoosts().get(entityType);
        if (entityBoost != null) {
            rank *= entityBoost;
        }
        if (settings.isEnableFreshnessBoost() && freshnessDays != null) {
            double freshnessFactor = Math.exp(-freshnessDays / (double) settings.getFreshnessDecayDays());
            rank *= 1 + freshnessFactor * settings.getFreshnessWeight();
        }
        return rank;
    }

    public List<ClickAggregate> getTopClickedEntities(int days, int limit) {
        Instant since = clock.instant().minus(Duration.ofDays(Math.max(1, days)));
        try {
            return historyRepository.findTopClicked(since, Math.max(1, limit));
        } catch (RuntimeException e) {
            log.warn("top clicked lookup failed: {}", e.getMessage());
            return List.of();
        }
    }

    double boostFor(ClickSignal signal, RankingSettings settings) {
        if (signal == null || signal.getTotalClicks() < settings.getMinClicksForBoost()) {
            return 0.0;
        }
        double boost = signal.clickBoost();
        if (signal.getLastClicked() != null) {
            long daysSince = Math.max(0L, Duration.between(signal.getLastClicked(), clock.instant()).toDays());
            boost *= Math.exp(-daysSince / (double) settings.getClickDecayDays());
        }
        return boost;
    }

    private static ClickSignal toSignal(String entityType, String entityId, ClickAggregate aggregate, long impressions) {
        long denominator = impressions <= 0 ? 1 : impressions;
        double avgPosition = aggregate.avgPosition() == null ? 1.0 : aggregate.avgPosition();
        return new ClickSignal(
            entityType,
            entityId,
            aggregate.totalClicks(),
            aggregate.uniqueSearches(),
            avgPosition,
            aggregate.lastClicked(),
            (double) aggregate.totalClicks() / denominator
        );
    }
}
