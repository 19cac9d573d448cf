package com.pulse.forecast.service.backtest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulse.forecast.exception.ForecastException;
import com.pulse.forecast.model.BacktestResult;
import com.pulse.forecast.model.FeatureOutcomePair;
import com.pulse.forecast.model.Horizon;
import com.pulse.forecast.model.ModelVersion;
import com.pulse.forecast.model.Outcome;
import com.pulse.forecast.model.Prediction;
import com.pulse.forecast.model.TradingAction;
import com.pulse.forecast.repository.BacktestResultRepository;
import com.pulse.forecast.service.prediction.ModelRegistry;
import com.pulse.forecast.service.prediction.MultiOutputPredictor;
import com.pulse.forecast.service.prediction.TrainingDataService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Replays stored feature/outcome pairs through a model version in timestamp order. The action is
 * taken on the longest horizon: long actions earn the realized return, short actions its negation
 * and HOLD stays flat.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BacktestEngine {

    private static final Horizon ACTION_HORIZON = Horizon.longest();

    private final MultiOutputPredictor multiOutputPredictor;
    private final ModelRegistry modelRegistry;
    private final TrainingDataService trainingDataService;
    private final BacktestResultRepository backtestResultRepository;
    private final ObjectMapper objectMapper;

    /**
     * Replays the version over the pairs recorded after its training cutoff and stores the result.
     */
    public BacktestRun run(String versionId) {
        ModelVersion version = modelRegistry.find(versionId);
        return run(version, trainingDataService.completePairsAfter(version.getTrainingCutoff()));
    }

    public BacktestRun run(ModelVersion version, List<FeatureOutcomePair> pairs) {
        BacktestMetrics metrics = backtest(pairs, version);
        BacktestResult result = BacktestResult.builder()
                .modelVersionId(version.getVersionId())
                .startTime(metrics.startTime())
                .endTime(metrics.endTime())
                .metricsJson(writeJson(metrics))
                .createdAt(Instant.now())
                .build();
        BacktestResult saved = backtestResultRepository.save(result);
        log.info("Backtest stored versionId={} trades={} winRate={} sharpe={} excludedLookahead={}",
                version.getVersionId(), metrics.trades(), metrics.winRate(), metrics.sharpe(),
                metrics.excludedLookahead());
        return new BacktestRun(saved.getId(), version.getVersionId(), metrics);
    }

    public BacktestMetrics backtest(List<FeatureOutcomePair> pairs, ModelVersion version) {
        List<FeatureOutcomePair> ordered = pairs.stream()
                .sorted(Comparator.comparing(FeatureOutcomePair::timestamp))
                .toList();
        List<Trade> trades = new ArrayList<>();
        Map<TradingAction, int[]> actionCounts = new EnumMap<>(TradingAction.class);
        int replayed = 0;
        int excluded = 0;
        Instant start = null;
        Instant end = null;
        for (FeatureOutcomePair pair : ordered) {
            Outcome outcome = pair.outcome();
            if (!outcome.isFilled(ACTION_HORIZON)) {
                continue;
            }
            if (isLookahead(pair)) {
                excluded++;
                log.warn("Look-ahead pair excluded from backtest symbol={} featureTime={} exitRecordedAt={}",
                        pair.symbol(), pair.timestamp(), exitTime(outcome));
                continue;
            }
            replayed++;
            if (start == null) {
                start = pair.timestamp();
            }
            end = pair.timestamp();
            Prediction prediction = multiOutputPredictor.score(pair.feature(), version);
            TradingAction action = prediction.getOptimalAction();
            if (!action.trades()) {
                continue;
            }
            double realized = outcome.returnPct(ACTION_HORIZON);
            double tradeReturn = action.isLong() ? realized : -realized;
            trades.add(new Trade(action, tradeReturn));
            int[] counts = actionCounts.computeIfAbsent(action, key -> new int[2]);
            counts[0]++;
            if (tradeReturn > 0) {
                counts[1]++;
            }
        }
        if (trades.isEmpty()) {
            return new BacktestMetrics(replayed, 0, 0, 0.0, 0.0, 0.0, 0.0, excluded, Map.of(), start, end);
        }
        int wins = (int) trades.stream().filter(t -> t.returnPct() > 0).count();
        double avgReturn = trades.stream().mapToDouble(Trade::returnPct).average().orElse(0.0);
        Map<TradingAction, Double> perAction = new EnumMap<>(TradingAction.class);
        actionCounts.forEach((action, counts) -> perAction.put(action, (double) counts[1] / counts[0]));
        return new BacktestMetrics(replayed, trades.size(), wins, (double) wins / trades.size(), avgReturn,
                calculateSharpe(trades), calculateMaxDrawdown(trades), excluded, perAction, start, end);
    }

    private boolean isLookahead(FeatureOutcomePair pair) {
        Instant recordedAt = exitTime(pair.outcome());
        return recordedAt == null || recordedAt.isBefore(ACTION_HORIZON.after(pair.timestamp()));
    }

    private Instant exitTime(Outcome outcome) {
        Instant exitRecordedAt = outcome.exitRecordedAt(ACTION_HORIZON);
        return exitRecordedAt != null ? exitRecordedAt : outcome.getRecordedTimestamp();
    }

    private double calculateMaxDrawdown(List<Trade> trades) {
        double equity = 0.0;
        double peak = 0.0;
        double maxDrawdown = 0.0;
        for (Trade trade : trades) {
            equity += trade.returnPct();
            if (equity > peak) {
                peak = equity;
            }
            double drawdown = peak - equity;
            if (drawdown > maxDrawdown) {
                maxDrawdown = drawdown;
            }
        }
        return maxDrawdown;
    }

    private double calculateSharpe(List<Trade> trades) {
        double mean = trades.stream().mapToDouble(Trade::returnPct).average().orElse(0.0);
        double variance = trades.stream().mapToDouble(t -> Math.pow(t.returnPct() - mean, 2)).average().orElse(0.0);
        double stdDev = Math.sqrt(variance);
        return stdDev == 0 ? 0 : mean / stdDev;
    }

    private String writeJson(BacktestMetrics metrics) {
        try {
            return objectMapper.writeValueAsString(metrics);
        } catch (JsonProcessingException ex) {
            throw new ForecastException("Backtest metrics could not be serialised", ex);
        }
    }

    private record Trade(TradingAction action, double returnPct) {}

    public record BacktestRun(Long resultId, String modelVersionId, BacktestMetrics metrics) {}
}
