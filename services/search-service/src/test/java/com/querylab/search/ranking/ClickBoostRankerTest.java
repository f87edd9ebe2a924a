package com.querylab.search.ranking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.querylab.search.analytics.ClickAggregate;
import com.querylab.search.analytics.SearchHistoryRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class ClickBoostRankerTest {
    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");

    @Mock
    private SearchHistoryRepository repository;

    private RankingProperties properties;
    private ClickBoostRanker ranker;

    @BeforeEach
    void setUp() {
        properties = new RankingProperties();
        ranker = new ClickBoostRanker(repository, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void batchBoostsSkipEntitiesBelowClickThreshold() {
        when(repository.findClickAggregates(anyCollection(), any(Instant.class))).thenReturn(List.of(
            new ClickAggregate("hot", 5, 4, 1.0, NOW),
            new ClickAggregate("cold", 2, 2, 1.0, NOW)
        ));
        when(repository.countImpressions(any(Instant.class))).thenReturn(10L);

        Map<String, Double> boosts = ranker.getBatchClickBoosts("doc", List.of("hot", "cold", "none"));

        assertThat(boosts).containsOnlyKeys("hot");
        assertThat(boosts.get("hot")).isCloseTo(1.0 / (1.0 + Math.log(2.0)), within(1e-9));
    }

    @Test
    void boostDecaysWithDaysSinceLastClick() {
        RankingSettings settings = ranker.defaultSettings();
        ClickSignal fresh = new ClickSignal("doc", "a", 10, 5, 1.0, NOW, 0.5);
        ClickSignal stale = new ClickSignal("doc", "a", 10, 5, 1.0, NOW.minus(Duration.ofDays(10)), 0.5);
        ClickSignal older = new ClickSignal("doc", "a", 10, 5, 1.0, NOW.minus(Duration.ofDays(20)), 0.5);

        double freshBoost = ranker.boostFor(fresh, settings);
        double staleBoost = ranker.boostFor(stale, settings);
        double olderBoost = ranker.boostFor(older, settings);

        assertThat(freshBoost).isGreaterThan(staleBoost);
        assertThat(staleBoost).isGreaterThan(olderBoost);
        assertThat(staleBoost).isCloseTo(freshBoost * Math.exp(-10.0 / 30.0), within(1e-9));
    }

    @Test
    void boostIsBoundedByOne() {
        ClickSignal signal = new ClickSignal("doc", "a", 100, 50, 0.0, NOW, 5.0);

        assertThat(signal.clickBoost()).isEqualTo(1.0);
    }

    @Test
    void repositoryFailureYieldsNoBoosts() {
        when(repository.findClickAggregates(anyCollection(), any(Instant.class)))
            .thenThrow(new DataAccessResourceFailureException("db down"));

        assertThat(ranker.getBatchClickBoosts("doc", List.of("a"))).isEmpty();
    }

    @Test
    void disabledClickBoostSkipsLookups() {
        properties.setEnableClickBoost(false);

        assertThat(ranker.getBatchClickBoosts("doc", List.of("a"))).isEmpty();
        assertThat(ranker.getClickBoost("doc", "a")).isZero();
        verifyNoInteractions(repository);
    }

    @Test
    void singleSignalReturnsNullWithoutClicks() {
        when(repository.findClickAggregate("a", NOW.minus(Duration.ofDays(30)))).thenReturn(null);

        assertThat(ranker.getClickSignal("doc", "a")).isNull();
    }

    @Test
    void finalRankCombinesClickEntityAndFreshnessFactors() {
        properties.setEntityBoosts(Map.of("doc", 2.0));
        properties.setEnableFreshnessBoost(true);

        double rank = ranker.calculateFinalRank(1.0, "doc", 0.5, 0);

        assertThat(rank).isCloseTo(1.0 * 1.1 * 2.0 * 1.1, within(1e-9));
    }

    @Test
    void finalRankLeavesUnknownTypesUntouched() {
        assertThat(ranker.calculateFinalRank(3.0, "video", 0.0, null)).isEqualTo(3.0);
    }

    @Test
    void variantOverridesReplaceWeightAndThreshold() {
        RankingSettings settings = ranker.defaultSettings().withOverrides(Map.of(
            "click_boost_weight", 0.5,
            "min_clicks_for_boost", 1,
            "unrelated", "x"
        ));

        assertThat(settings.getClickBoostWeight()).isEqualTo(0.5);
        assertThat(settings.getMinClicksForBoost()).isEqualTo(1);
        assertThat(settings.getClickDecayDays()).isEqualTo(30);
        assertThat(ranker.defaultSettings().withOverrides(Map.of())).isNotNull();
    }

    @Test
    void nonPositiveDecayWindowIsClampedToOneDay() {
        properties.setClickDecayDays(0);
        RankingSettings settings = ranker.defaultSettings();
        ClickSignal signal = new ClickSignal("doc", "a", 10, 5, 1.0, NOW.minus(Duration.ofDays(2)), 0.5);

        double boost = ranker.boostFor(signal, settings);

        assertThat(settings.getClickDecayDays()).isEqualTo(1);
        assertThat(Double.isFinite(boost)).isTrue();
        assertThat(boost).isCloseTo(signal.clickBoost() * Math.exp(-2.0), within(1e-9));
    }

    @Test
    void topClickedReadsWindowAndLimit() {
        List<ClickAggregate> rows = List.of(new ClickAggregate("doc-7", 11, 6, 1.5, NOW));
        when(repository.findTopClicked(NOW.minus(Duration.ofDays(7)), 5)).thenReturn(rows);
        when(repository.findTopClicked(NOW.minus(Duration.ofDays(1)), 1)).thenReturn(List.of());

        assertThat(ranker.getTopClickedEntities(7, 5)).isEqualTo(rows);
        assertThat(ranker.getTopClickedEntities(0, 0)).isEmpty();
    }

    @Test
    void topClickedFailureYieldsEmptyList() {
        when(repository.findTopClicked(any(Instant.class), anyInt()))
            .thenThrow(new DataAccessResourceFailureException("db down"));

        assertThat(ranker.getTopClickedEntities(30, 20)).isEmpty();
    }
}
