package com.pulse.forecast.service.backtest;

import com.pulse.forecast.config.ForecastProperties;
import com.pulse.forecast.model.Direction;
import com.pulse.forecast.model.Outcome;
import com.pulse.forecast.model.Prediction;
import com.pulse.forecast.model.TradingAction;
import com.pulse.forecast.repository.PredictionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Win rate per recommended action over stored predictions with a realized outcome. A rate of
 * exactly 0 or 100 percent over a meaningful sample is not a realistic trading pattern and is
 * reported as an anomaly.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WinRateAnalyzer {

    private final PredictionRepository predictionRepository;
    private final ForecastProperties forecastProperties;

    @Transactional(readOnly = true)
    public WinRateReport analyze() {
        List<Object[]> rows = predictionRepository.findWithRealizedOutcome();
        return byAction(rows.stream().map(row -> new RealizedPrediction((Prediction) row[0], (Outcome) row[1])).toList());
    }

    public WinRateReport byAction(List<RealizedPrediction> realized) {
        Map<TradingAction, int[]> counts = new EnumMap<>(TradingAction.class);
        for (RealizedPrediction item : realized) {
            TradingAction action = item.prediction().getOptimalAction();
            int[] tally = counts.computeIfAbsent(action, key -> new int[2]);
            tally[0]++;
            if (isWin(action, item.outcome())) {
                tally[1]++;
            }
        }
        int minSamples = forecastProperties.getGuard().getWinRateMinSamples();
        Map<TradingAction, ActionWinRate> rates = new EnumMap<>(TradingAction.class);
        List<String> anomalies = new ArrayList<>();
        counts.forEach((action, tally) -> {
            double winRate = (double) tally[1] / tally[0];
            boolean degenerate = tally[0] >= minSamples && (tally[1] == 0 || tally[1] == tally[0]);
            rates.put(action, new ActionWinRate(tally[0], tally[1], winRate, degenerate));
            if (degenerate) {
                String anomaly = action + " win rate " + Math.round(winRate * 100) + "% over " + tally[0] + " samples";
                anomalies.add(anomaly);
                log.warn("Unrealistic win rate action={} samples={} winRate={}", action, tally[0], winRate);
            }
        });
        return new WinRateReport(rates, anomalies);
    }

    private boolean isWin(TradingAction action, Outcome outcome) {
        double realized = outcome.getRealizedReturnPct();
        if (action.isLong()) {
            return realized > 0;
        }
        if (action.isShort()) {
            return realized < 0;
        }
        return outcome.getRealizedDirection() == Direction.FLAT;
    }

    public record RealizedPrediction(Prediction prediction, Outcome outcome) {}

    public record ActionWinRate(int samples, int wins, double winRate, boolean anomalous) {}

    public record WinRateReport(Map<TradingAction, ActionWinRate> byAction, List<String> anomalies) {

        public boolean hasAnomalies() {
            return !anomalies.isEmpty();
        }
    }
}
