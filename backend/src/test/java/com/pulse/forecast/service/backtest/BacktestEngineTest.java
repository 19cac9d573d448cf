package com.pulse.forecast.service.backtest;

import com.pulse.forecast.model.BacktestResult;
import com.pulse.forecast.model.Direction;
import com.pulse.forecast.model.FeatureOutcomePair;
import com.pulse.forecast.model.FeatureRecord;
import com.pulse.forecast.model.Horizon;
import com.pulse.forecast.model.ModelVersion;
import com.pulse.forecast.model.Outcome;
import com.pulse.forecast.model.TradingAction;
import com.pulse.forecast.repository.BacktestResultRepository;
import com.pulse.forecast.service.prediction.ModelRegistry;
import com.pulse.forecast.service.prediction.MultiOutputPredictor;
import com.pulse.forecast.service.prediction.TrainingDataService;
import com.pulse.forecast.util.TestFeatureFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BacktestEngineTest {

    private static final Instant START = Instant.parse("2024-03-04T23:00:00Z");

    private MultiOutputPredictor multiOutputPredictor;
    private ModelRegistry modelRegistry;
    private TrainingDataService trainingDataService;
    private BacktestResultRepository backtestResultRepository;
    private BacktestEngine engine;
    private ModelVersion version;

    @BeforeEach
    void setUp() {
        multiOutputPredictor = mock(MultiOutputPredictor.class);
        modelRegistry = mock(ModelRegistry.class);
        trainingDataService = mock(TrainingDataService.class);
        backtestResultRepository = mock(BacktestResultRepository.class);
        engine = new BacktestEngine(multiOutputPredictor, modelRegistry, trainingDataService,
                backtestResultRepository, Jackson2ObjectMapperBuilder.json().build());
        version = ModelVersion.builder()
                .versionId("fm-20240304T070000-0a1b2c3d")
                .trainingCutoff(START.minus(Duration.ofDays(1)))
                .status(ModelVersion.Status.ACTIVE)
                .build();
    }

    @Test
    void lookaheadPairsAreExcludedFromReplay() {
        List<FeatureOutcomePair> pairs = pairs();
        alwaysRecommend(TradingAction.BUY);

        BacktestMetrics metrics = engine.backtest(pairs, version);

        assertThat(metrics.pairsReplayed()).isEqualTo(2);
        assertThat(metrics.excludedLookahead()).isEqualTo(1);
        assertThat(metrics.trades()).isEqualTo(2);
        assertThat(metrics.wins()).isEqualTo(1);
        assertThat(metrics.winRate()).isCloseTo(0.5, within(1e-9));
        assertThat(metrics.avgReturn()).isCloseTo(0.5, within(1e-9));
        assertThat(metrics.maxDrawdown()).isCloseTo(1.0, within(1e-9));
        assertThat(metrics.sharpe()).isCloseTo(1.0 / 3.0, within(1e-9));
        assertThat(metrics.perActionWinRates()).containsEntry(TradingAction.BUY, 0.5);
        assertThat(metrics.startTime()).isEqualTo(START);
        assertThat(metrics.endTime()).isEqualTo(START.plus(Duration.ofDays(1)));
    }

    @Test
    void shortActionsEarnTheNegatedReturn() {
        alwaysRecommend(TradingAction.SELL);

        BacktestMetrics metrics = engine.backtest(pairs(), version);

        assertThat(metrics.trades()).isEqualTo(2);
        assertThat(metrics.wins()).isEqualTo(1);
        assertThat(metrics.avgReturn()).isCloseTo(-0.5, within(1e-9));
        assertThat(metrics.maxDrawdown()).isCloseTo(2.0, within(1e-9));
    }

    @Test
    void holdNeverTrades() {
        alwaysRecommend(TradingAction.HOLD);

        BacktestMetrics metrics = engine.backtest(pairs(), version);

        assertThat(metrics.pairsReplayed()).isEqualTo(2);
        assertThat(metrics.trades()).isZero();
        assertThat(metrics.winRate()).isZero();
        assertThat(metrics.perActionWinRates()).isEmpty();
    }

    @Test
    void pendingPairsWithoutDailyExitAreSkipped() {
        FeatureRecord feature = feature(9L, START);
        Outcome pending = Outcome.builder()
                .featureId(9L)
                .symbol("CBA.AX")
                .entryPrice(100.0)
                .status(Outcome.Status.PENDING)
                .recordedTimestamp(START.plus(Duration.ofHours(5)))
                .build();
        TestFeatureFactory.fill(pending, feature, Horizon.H1, 101.0);
        alwaysRecommend(TradingAction.BUY);

        BacktestMetrics metrics = engine.backtest(List.of(new FeatureOutcomePair(feature, pending)), version);

        assertThat(metrics.pairsReplayed()).isZero();
        assertThat(metrics.excludedLookahead()).isZero();
    }

    @Test
    void runReplaysPairsAfterTheCutoffAndStoresTheResult() {
        List<FeatureOutcomePair> pairs = pairs();
        when(modelRegistry.find(version.getVersionId())).thenReturn(version);
        when(trainingDataService.completePairsAfter(version.getTrainingCutoff())).thenReturn(pairs);
        when(backtestResultRepository.save(any(BacktestResult.class))).thenAnswer(inv -> {
            BacktestResult result = inv.getArgument(0);
            result.setId(12L);
            return result;
        });
        alwaysRecommend(TradingAction.STRONG_BUY);

        BacktestEngine.BacktestRun run = engine.run(version.getVersionId());

        assertThat(run.resultId()).isEqualTo(12L);
        assertThat(run.modelVersionId()).isEqualTo(version.getVersionId());
        ArgumentCaptor<BacktestResult> saved = ArgumentCaptor.forClass(BacktestResult.class);
        verify(backtestResultRepository).save(saved.capture());
        assertThat(saved.getValue().getMetricsJson())
                .contains("\"trades\":2")
                .contains("\"excludedLookahead\":1");
        assertThat(saved.getValue().getStartTime()).isEqualTo(START);
    }

    private void alwaysRecommend(TradingAction action) {
        when(multiOutputPredictor.score(any(FeatureRecord.class), eq(version)))
                .thenAnswer(inv -> TestFeatureFactory.prediction(inv.getArgument(0), action, Direction.UP));
    }

    /**
     * Two clean pairs returning +2% and -1% on the day, plus one whose daily exit was stored two
     * hours after the feature.
     */
    private List<FeatureOutcomePair> pairs() {
        List<FeatureOutcomePair> pairs = new ArrayList<>();
        FeatureRecord up = feature(1L, START);
        pairs.add(new FeatureOutcomePair(up, TestFeatureFactory.completeOutcome(up, 100.0, 100.5, 101.0, 102.0)));
        FeatureRecord down = feature(2L, START.plus(Duration.ofDays(1)));
        pairs.add(new FeatureOutcomePair(down, TestFeatureFactory.completeOutcome(down, 100.0, 99.8, 99.5, 99.0)));
        FeatureRecord leaked = feature(3L, START.plus(Duration.ofDays(2)));
        Outcome leakedOutcome = TestFeatureFactory.completeOutcome(leaked, 100.0, 101.0, 103.0, 110.0);
        leakedOutcome.setExitRecordedAt1d(leaked.getTimestamp().plus(Duration.ofHours(2)));
        pairs.add(new FeatureOutcomePair(leaked, leakedOutcome));
        return pairs;
    }

    private FeatureRecord feature(long id, Instant timestamp) {
        FeatureRecord feature = TestFeatureFactory.feature("CBA.AX", timestamp);
        feature.setId(id);
        return feature;
    }
}
