package com.pulse.forecast.service.prediction;

import com.pulse.forecast.config.ForecastProperties;
import com.pulse.forecast.exception.DuplicatePredictionException;
import com.pulse.forecast.exception.InsufficientDataException;
import com.pulse.forecast.exception.ModelUnavailableException;
import com.pulse.forecast.ml.ForecastModel;
import com.pulse.forecast.ml.HorizonEstimate;
import com.pulse.forecast.ml.TrainedEnsemble;
import com.pulse.forecast.model.Direction;
import com.pulse.forecast.model.FeatureOutcomePair;
import com.pulse.forecast.model.FeatureRecord;
import com.pulse.forecast.model.Horizon;
import com.pulse.forecast.model.ModelVersion;
import com.pulse.forecast.model.Prediction;
import com.pulse.forecast.model.TradingAction;
import com.pulse.forecast.repository.FeatureRecordRepository;
import com.pulse.forecast.repository.OutcomeRepository;
import com.pulse.forecast.repository.PredictionRepository;
import com.pulse.forecast.service.feature.FeatureVectorSchema;
import com.pulse.forecast.util.TestFeatureFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MultiOutputPredictorTest {

    private static final Instant START = Instant.parse("2024-01-02T23:00:00Z");
    private static final Instant FEATURE_TIME = Instant.parse("2024-03-12T22:00:00Z");

    private final FeatureVectorSchema schema = new FeatureVectorSchema();
    private ModelRegistry modelRegistry;
    private PredictionRepository predictionRepository;
    private MultiOutputPredictor predictor;

    @BeforeEach
    void setUp() {
        ForecastProperties properties = new ForecastProperties();
        properties.getTraining().setTrees(5);
        properties.getTraining().setSequenceEpochs(5);
        properties.getTraining().setSequenceWindow(3);
        modelRegistry = mock(ModelRegistry.class);
        predictionRepository = mock(PredictionRepository.class);
        FeatureWindowService windows = new FeatureWindowService(mock(FeatureRecordRepository.class), schema, properties);
        predictor = new MultiOutputPredictor(modelRegistry, schema, new ActionDecisionTable(properties),
                predictionRepository, new TrainingDataService(mock(OutcomeRepository.class), windows), windows,
                properties);
    }

    @Test
    void fitRefusesSmallTrainingSets() {
        List<FeatureOutcomePair> pairs = TestFeatureFactory.learnablePairs(12, START);

        assertThatThrownBy(() -> predictor.fit(pairs))
                .isInstanceOfSatisfying(InsufficientDataException.class, ex -> {
                    assertThat(ex.getAvailable()).isEqualTo(12);
                    assertThat(ex.getRequired()).isEqualTo(50);
                });
    }

    @Test
    void fitHoldsOutTheNewestRows() {
        List<FeatureOutcomePair> pairs = TestFeatureFactory.learnablePairs(60, START);

        TrainingResult result = predictor.fit(pairs);

        assertThat(result.trainingSamples()).isEqualTo(48);
        assertThat(result.holdoutSamples()).isEqualTo(12);
        assertThat(result.trainingCutoff()).isEqualTo(START.plus(Duration.ofDays(47)));
        assertThat(result.ensemble().schemaHash()).isEqualTo(schema.hash());
        assertThat(result.ensemble().featureNames()).isEqualTo(schema.names());
    }

    @Test
    void noActiveModelMeansNoPrediction() {
        when(modelRegistry.active()).thenReturn(Optional.empty());

        assertThatThrownBy(() -> predictor.predict(feature()))
                .isInstanceOf(ModelUnavailableException.class);
    }

    @Test
    void modelFromAnotherSchemaIsRefused() {
        ModelVersion version = version("fm-old", "0000");
        when(modelRegistry.active()).thenReturn(Optional.of(new ModelRegistry.ActiveModel(version, upEnsemble())));

        assertThatThrownBy(() -> predictor.predict(feature()))
                .isInstanceOf(ModelUnavailableException.class)
                .hasMessageContaining("fm-old");
    }

    @Test
    void predictionCarriesAllHorizonsAndFeatureTime() {
        ModelVersion version = version("fm-1", schema.hash());
        when(modelRegistry.active()).thenReturn(Optional.of(new ModelRegistry.ActiveModel(version, upEnsemble())));

        Prediction prediction = predictor.predict(feature());

        for (Horizon horizon : Horizon.values()) {
            assertThat(prediction.direction(horizon)).isEqualTo(Direction.UP);
            assertThat(prediction.confidence(horizon)).isEqualTo(0.9, within(1e-9));
            assertThat(prediction.magnitude(horizon)).isEqualTo(2.5, within(1e-9));
        }
        assertThat(prediction.getOptimalAction()).isEqualTo(TradingAction.STRONG_BUY);
        assertThat(prediction.getCreatedTimestamp()).isEqualTo(FEATURE_TIME);
        assertThat(prediction.getModelVersionId()).isEqualTo("fm-1");
        assertThat(prediction.getFeatureId()).isEqualTo(11L);
        assertThat(prediction.getPredictionDate()).isEqualTo(LocalDate.of(2024, 3, 13));
    }

    @Test
    void candidatesAreScoredWithoutBeingActive() {
        ModelVersion candidate = version("fm-candidate", schema.hash());
        candidate.setStatus(ModelVersion.Status.CANDIDATE);
        when(modelRegistry.load(candidate)).thenReturn(upEnsemble());

        Prediction prediction = predictor.score(feature(), candidate);

        assertThat(prediction.getModelVersionId()).isEqualTo("fm-candidate");
        assertThat(prediction.getDirection1d()).isEqualTo(Direction.UP);
    }

    @Test
    void secondPredictionForSameDayIsRejected() {
        ModelVersion version = version("fm-1", schema.hash());
        when(modelRegistry.active()).thenReturn(Optional.of(new ModelRegistry.ActiveModel(version, upEnsemble())));
        when(predictionRepository.save(any(Prediction.class)))
                .thenThrow(new DataIntegrityViolationException("uk_predictions_symbol_date"));

        assertThatThrownBy(() -> predictor.predictAndSave(feature()))
                .isInstanceOf(DuplicatePredictionException.class)
                .hasMessageContaining("CBA.AX");
    }

    @Test
    void savedPredictionIsStamped() {
        when(predictionRepository.save(any(Prediction.class))).thenAnswer(inv -> inv.getArgument(0));
        Prediction prediction = TestFeatureFactory.prediction(feature(), TradingAction.BUY, Direction.UP);
        prediction.setPersistedAt(null);

        Prediction saved = predictor.savePrediction(prediction);

        assertThat(saved.getPersistedAt()).isNotNull();
    }

    private FeatureRecord feature() {
        FeatureRecord feature = TestFeatureFactory.feature("CBA.AX", FEATURE_TIME);
        feature.setId(11L);
        return feature;
    }

    private ModelVersion version(String versionId, String hash) {
        return ModelVersion.builder()
                .versionId(versionId)
                .featureSchemaHash(hash)
                .status(ModelVersion.Status.ACTIVE)
                .trainedAt(START)
                .trainingCutoff(START)
                .modelPayload("{}")
                .createdAt(START)
                .build();
    }

    private TrainedEnsemble upEnsemble() {
        ForecastModel upModel = new ForecastModel() {
            @Override
            public String family() {
                return "fixed";
            }

            @Override
            public Map<Horizon, HorizonEstimate> predict(double[][] window) {
                Map<Horizon, HorizonEstimate> estimates = new EnumMap<>(Horizon.class);
                for (Horizon horizon : Horizon.values()) {
                    estimates.put(horizon, new HorizonEstimate(new double[]{0.9, 0.05, 0.05}, 2.5));
                }
                return estimates;
            }
        };
        return new TrainedEnsemble(schema.hash(), schema.names(),
                List.of(new TrainedEnsemble.Member(upModel, 1.0)), Map.of());
    }
}
