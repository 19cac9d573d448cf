package com.pulse.forecast.service.prediction;

import com.pulse.forecast.config.ForecastProperties;
import com.pulse.forecast.exception.DuplicatePredictionException;
import com.pulse.forecast.exception.InsufficientDataException;
import com.pulse.forecast.exception.ModelUnavailableException;
import com.pulse.forecast.ml.EnsembleTrainer;
import com.pulse.forecast.ml.HorizonForecast;
import com.pulse.forecast.ml.LstmSequenceModel;
import com.pulse.forecast.ml.RandomForestModel;
import com.pulse.forecast.ml.TrainedEnsemble;
import com.pulse.forecast.ml.TrainingSample;
import com.pulse.forecast.model.FeatureOutcomePair;
import com.pulse.forecast.model.FeatureRecord;
import com.pulse.forecast.model.Horizon;
import com.pulse.forecast.model.ModelVersion;
import com.pulse.forecast.model.Prediction;
import com.pulse.forecast.model.TradingAction;
import com.pulse.forecast.repository.PredictionRepository;
import com.pulse.forecast.service.feature.FeatureVectorSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Scores feature rows with the active ensemble and fits new ensembles from feature/outcome pairs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MultiOutputPredictor {

    private final ModelRegistry modelRegistry;
    private final FeatureVectorSchema featureVectorSchema;
    private final ActionDecisionTable actionDecisionTable;
    private final PredictionRepository predictionRepository;
    private final TrainingDataService trainingDataService;
    private final FeatureWindowService featureWindowService;
    private final ForecastProperties forecastProperties;

    /**
     * Builds (but does not store) the prediction for one feature row.
     *
     * @throws ModelUnavailableException when no model is active or it was trained on another schema
     */
    public Prediction predict(FeatureRecord feature) {
        ModelRegistry.ActiveModel active = modelRegistry.active()
                .orElseThrow(() -> new ModelUnavailableException("No active model version"));
        requireCurrentSchema(active.version());
        return toPrediction(feature, active.version().getVersionId(), active.ensemble());
    }

    /**
     * Scores a feature with a given stored version, whatever its status. Evaluation and replay use
     * this to score candidates that are not active yet.
     */
    public Prediction score(FeatureRecord feature, ModelVersion version) {
        requireCurrentSchema(version);
        return toPrediction(feature, version.getVersionId(), modelRegistry.load(version));
    }

    private void requireCurrentSchema(ModelVersion version) {
        if (!featureVectorSchema.hash().equals(version.getFeatureSchemaHash())) {
            throw new ModelUnavailableException("Model " + version.getVersionId()
                    + " was trained on feature schema " + version.getFeatureSchemaHash());
        }
    }

    Prediction toPrediction(FeatureRecord feature, String versionId, TrainedEnsemble ensemble) {
        Map<Horizon, HorizonForecast> forecasts = ensemble.forecast(featureWindowService.window(feature));
        HorizonForecast h1 = forecasts.get(Horizon.H1);
        HorizonForecast h4 = forecasts.get(Horizon.H4);
        HorizonForecast d1 = forecasts.get(Horizon.D1);
        HorizonForecast longest = forecasts.get(Horizon.longest());
        TradingAction action = actionDecisionTable.decide(longest.direction(), longest.confidence(), longest.magnitude());
        return Prediction.builder()
                .featureId(feature.getId())
                .symbol(feature.getSymbol())
                .predictionDate(feature.getCycleDate())
                .direction1h(h1.direction())
                .direction4h(h4.direction())
                .direction1d(d1.direction())
                .magnitude1h(h1.magnitude())
                .magnitude4h(h4.magnitude())
                .magnitude1d(d1.magnitude())
                .confidence1h(h1.confidence())
                .confidence4h(h4.confidence())
                .confidence1d(d1.confidence())
                .confidenceAvg((h1.confidence() + h4.confidence() + d1.confidence()) / 3.0)
                .optimalAction(action)
                .modelVersionId(versionId)
                .createdTimestamp(feature.getTimestamp())
                .build();
    }

    /**
     * Inserts the prediction. The store holds at most one prediction per symbol-day.
     *
     * @throws DuplicatePredictionException when the symbol already has today's prediction
     */
    public Prediction savePrediction(Prediction prediction) {
        prediction.setPersistedAt(Instant.now());
        try {
            Prediction saved = predictionRepository.save(prediction);
            log.info("Prediction stored symbol={} date={} action={} confidence1d={} version={}",
                    saved.getSymbol(), saved.getPredictionDate(), saved.getOptimalAction(),
                    saved.getConfidence1d(), saved.getModelVersionId());
            return saved;
        } catch (DataIntegrityViolationException ex) {
            throw new DuplicatePredictionException(prediction.getSymbol(), prediction.getPredictionDate(), ex);
        }
    }

    public Prediction predictAndSave(FeatureRecord feature) {
        return savePrediction(predict(feature));
    }

    /**
     * Fits a new ensemble. The newest holdout fraction of the pairs is left out for evaluation and
     * never touches the fit; the split falls between two distinct timestamps.
     *
     * @throws InsufficientDataException when fewer than the configured minimum of pairs exist
     */
    public TrainingResult fit(List<FeatureOutcomePair> pairs) {
        ForecastProperties.Training training = forecastProperties.getTraining();
        int required = training.getMinSamples();
        if (pairs.size() < required) {
            throw new InsufficientDataException(pairs.size(), required);
        }
        List<FeatureOutcomePair> ordered = pairs.stream()
                .sorted(Comparator.comparing(FeatureOutcomePair::timestamp))
                .toList();
        int trainCount = ordered.size() - (int) Math.round(ordered.size() * training.getHoldoutFraction());
        while (trainCount > 0 && trainCount < ordered.size()
                && ordered.get(trainCount).timestamp().equals(ordered.get(trainCount - 1).timestamp())) {
            trainCount--;
        }
        int holdout = ordered.size() - trainCount;
        if (trainCount < required * (1.0 - training.getHoldoutFraction()) / 2 || holdout == 0) {
            // timestamps are too clustered to leave a clean holdout
            throw new InsufficientDataException(trainCount, required);
        }
        List<TrainingSample> samples = trainingDataService.toSamples(ordered.subList(0, trainCount));
        EnsembleTrainer trainer = new EnsembleTrainer(
                new RandomForestModel.Settings(training.getTrees(), training.getMaxDepth(),
                        training.getMinSamplesLeaf(), training.getSeed()),
                new LstmSequenceModel.Settings(training.getSequenceEpochs(), training.getSequenceLearningRate(),
                        training.getSequenceHiddenUnits(), training.getSequenceBatchSize(), training.getSeed()),
                training.getCalibrationFraction());
        TrainedEnsemble ensemble = trainer.train(samples, featureVectorSchema.hash(), featureVectorSchema.names());
        Instant cutoff = ordered.get(trainCount - 1).timestamp();
        log.info("Ensemble fitted samples={} holdout={} cutoff={} weights={}",
                trainCount, holdout, cutoff, ensemble.familyWeights());
        return new TrainingResult(ensemble, cutoff, trainCount, holdout);
    }
}
