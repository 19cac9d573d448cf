package com.pulse.forecast.service.prediction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulse.forecast.exception.ForecastException;
import com.pulse.forecast.exception.InsufficientDataException;
import com.pulse.forecast.model.FeatureOutcomePair;
import com.pulse.forecast.model.ModelVersion;
import com.pulse.forecast.service.backtest.BacktestEngine;
import com.pulse.forecast.service.backtest.ModelPerformanceTracker;
import com.pulse.forecast.service.backtest.PerformanceReport;
import com.pulse.forecast.service.backtest.PromotionDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Retrains from committed pairs, stores the candidate and runs it through evaluation, backtest and
 * the promotion gate. Only one build runs at a time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelTrainingService {

    public static final String SKIP_IN_PROGRESS = "training_in_progress";
    public static final String SKIP_INSUFFICIENT_DATA = "insufficient_data";

    private final TrainingDataService trainingDataService;
    private final MultiOutputPredictor multiOutputPredictor;
    private final ModelRegistry modelRegistry;
    private final ModelPerformanceTracker modelPerformanceTracker;
    private final BacktestEngine backtestEngine;
    private final ObjectMapper objectMapper;
    private final ReentrantLock trainingLock = new ReentrantLock();

    public TrainingOutcome retrain(Instant asOf) {
        if (!trainingLock.tryLock()) {
            log.warn("Retraining skipped reason={}", SKIP_IN_PROGRESS);
            return TrainingOutcome.skipped(SKIP_IN_PROGRESS, null);
        }
        try {
            List<FeatureOutcomePair> pairs = trainingDataService.completePairsUpTo(asOf);
            TrainingResult result;
            try {
                result = multiOutputPredictor.fit(pairs);
            } catch (InsufficientDataException ex) {
                log.warn("Retraining skipped reason={} available={} required={}",
                        SKIP_INSUFFICIENT_DATA, ex.getAvailable(), ex.getRequired());
                return TrainingOutcome.skipped(SKIP_INSUFFICIENT_DATA, ex.getMessage());
            }
            ModelVersion candidate = modelRegistry.saveCandidate(result, asOf);
            PerformanceReport report = modelPerformanceTracker.evaluateCandidate(candidate);
            BacktestEngine.BacktestRun backtest = backtestEngine.run(candidate,
                    trainingDataService.completePairsAfter(candidate.getTrainingCutoff()));
            candidate.setMetricsJson(metricsJson(report, backtest, result));
            PromotionDecision decision = modelPerformanceTracker.promote(candidate, report);
            log.info("Retraining finished versionId={} result={} reason={}",
                    candidate.getVersionId(), decision.result(), decision.reason());
            return new TrainingOutcome(false, null, null, candidate.getVersionId(), decision, report);
        } finally {
            trainingLock.unlock();
        }
    }

    private String metricsJson(PerformanceReport report, BacktestEngine.BacktestRun backtest, TrainingResult result) {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("evaluation", report);
        metrics.put("backtest", backtest.metrics());
        metrics.put("familyWeights", result.ensemble().familyWeights());
        try {
            return objectMapper.writeValueAsString(metrics);
        } catch (JsonProcessingException ex) {
            throw new ForecastException("Model metrics could not be serialised", ex);
        }
    }

    public record TrainingOutcome(boolean skipped, String skipReason, String detail, String versionId,
                                  PromotionDecision decision, PerformanceReport report) {

        static TrainingOutcome skipped(String reason, String detail) {
            return new TrainingOutcome(true, reason, detail, null, null, null);
        }
    }
}
