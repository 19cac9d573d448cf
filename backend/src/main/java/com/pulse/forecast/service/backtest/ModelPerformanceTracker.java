package com.pulse.forecast.service.backtest;

import com.pulse.forecast.config.ForecastProperties;
import com.pulse.forecast.exception.ModelRejectedException;
import com.pulse.forecast.model.FeatureOutcomePair;
import com.pulse.forecast.model.Horizon;
import com.pulse.forecast.model.ModelVersion;
import com.pulse.forecast.model.Outcome;
import com.pulse.forecast.model.Prediction;
import com.pulse.forecast.service.prediction.ModelRegistry;
import com.pulse.forecast.service.prediction.MultiOutputPredictor;
import com.pulse.forecast.service.prediction.TrainingDataService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores model versions on rows they never saw and applies the promotion gate. A rejected candidate
 * leaves the currently active version in place.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelPerformanceTracker {

    private final TrainingDataService trainingDataService;
    private final MultiOutputPredictor multiOutputPredictor;
    private final ModelRegistry modelRegistry;
    private final ForecastProperties forecastProperties;

    /**
     * Scores any stored version on the rows after its cutoff. Nothing is written back.
     */
    public PerformanceReport evaluate(String versionId) {
        ModelVersion version = modelRegistry.find(versionId);
        return score(version, trainingDataService.completePairsAfter(version.getTrainingCutoff()));
    }

    /**
     * Scores a fresh candidate and stores the scores on its row, ahead of the promotion gate.
     *
     * @throws IllegalStateException when the version is no longer a CANDIDATE
     */
    public PerformanceReport evaluateCandidate(ModelVersion candidate) {
        if (candidate.getStatus() != ModelVersion.Status.CANDIDATE) {
            throw new IllegalStateException("Only candidates record evaluation scores; "
                    + candidate.getVersionId() + " is " + candidate.getStatus());
        }
        List<FeatureOutcomePair> pairs = trainingDataService.completePairsAfter(candidate.getTrainingCutoff());
        PerformanceReport report = score(candidate, pairs);
        report.horizons().forEach((horizon, score) -> candidate.recordAccuracy(horizon, score.accuracy(), score.mae()));
        candidate.setValidationSampleCount(report.samples());
        modelRegistry.update(candidate);
        return report;
    }

    /**
     * Direction accuracy and magnitude MAE per horizon over the given pairs.
     */
    public PerformanceReport score(ModelVersion version, List<FeatureOutcomePair> pairs) {
        Map<Horizon, int[]> hits = new EnumMap<>(Horizon.class);
        Map<Horizon, double[]> errors = new EnumMap<>(Horizon.class);
        for (Horizon horizon : Horizon.values()) {
            hits.put(horizon, new int[1]);
            errors.put(horizon, new double[1]);
        }
        int samples = 0;
        for (FeatureOutcomePair pair : pairs) {
            Outcome outcome = pair.outcome();
            if (!outcome.isComplete()) {
                continue;
            }
            Prediction prediction = multiOutputPredictor.score(pair.feature(), version);
            samples++;
            for (Horizon horizon : Horizon.values()) {
                if (prediction.direction(horizon) == outcome.direction(horizon)) {
                    hits.get(horizon)[0]++;
                }
                errors.get(horizon)[0] += Math.abs(prediction.magnitude(horizon) - outcome.returnPct(horizon));
            }
        }
        Map<Horizon, PerformanceReport.HorizonScore> scores = new EnumMap<>(Horizon.class);
        if (samples > 0) {
            for (Horizon horizon : Horizon.values()) {
                scores.put(horizon, new PerformanceReport.HorizonScore(
                        (double) hits.get(horizon)[0] / samples, errors.get(horizon)[0] / samples));
            }
        }
        boolean sufficient = samples >= forecastProperties.getPromotion().getMinEvaluationSamples();
        log.info("Model evaluated versionId={} samples={} sufficient={} scores={}",
                version.getVersionId(), samples, sufficient, scores);
        return new PerformanceReport(version.getVersionId(), samples, sufficient, scores);
    }

    /**
     * PROMOTED only when every horizon clears the accuracy floor and the MAE ceiling.
     */
    public PromotionDecision promote(ModelVersion version, PerformanceReport report) {
        List<String> failures = gateFailures(report);
        if (failures.isEmpty()) {
            modelRegistry.activate(version);
            return new PromotionDecision(version.getVersionId(), PromotionDecision.Result.PROMOTED, "passed");
        }
        String reason = String.join("; ", failures);
        modelRegistry.reject(version, reason);
        return new PromotionDecision(version.getVersionId(), PromotionDecision.Result.REJECTED, reason);
    }

    public PromotionDecision promoteOrThrow(ModelVersion version, PerformanceReport report) {
        PromotionDecision decision = promote(version, report);
        if (!decision.promoted()) {
            throw new ModelRejectedException(version.getVersionId(), decision.reason());
        }
        return decision;
    }

    List<String> gateFailures(PerformanceReport report) {
        ForecastProperties.Promotion promotion = forecastProperties.getPromotion();
        List<String> failures = new ArrayList<>();
        if (!report.sufficient()) {
            failures.add("insufficient_evaluation_samples " + report.samples() + " < "
                    + promotion.getMinEvaluationSamples());
            return failures;
        }
        for (Horizon horizon : Horizon.values()) {
            PerformanceReport.HorizonScore score = report.horizons().get(horizon);
            if (score == null) {
                failures.add(horizon.label() + " not scored");
                continue;
            }
            if (score.accuracy() < promotion.getMinAccuracy()) {
                failures.add(String.format(Locale.ROOT, "%s accuracy %.3f < %.2f", horizon.label(), score.accuracy(),
                        promotion.getMinAccuracy()));
            }
            if (score.mae() > promotion.getMaxMae()) {
                failures.add(String.format(Locale.ROOT, "%s mae %.3f > %.2f", horizon.label(), score.mae(), promotion.getMaxMae()));
            }
        }
        return failures;
    }
}
