package com.pulse.forecast.service.prediction;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulse.forecast.exception.NotFoundException;
import com.pulse.forecast.ml.EnsembleTrainer;
import com.pulse.forecast.ml.HorizonForecast;
import com.pulse.forecast.ml.LstmSequenceModel;
import com.pulse.forecast.ml.RandomForestModel;
import com.pulse.forecast.ml.TrainedEnsemble;
import com.pulse.forecast.ml.TrainingSample;
import com.pulse.forecast.model.Direction;
import com.pulse.forecast.model.Horizon;
import com.pulse.forecast.model.ModelVersion;
import com.pulse.forecast.repository.ModelVersionRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DataJpaTest
@Import({ModelRegistry.class, ModelRegistryTest.TestConfig.class})
class ModelRegistryTest {

    private static final Instant FIRST_TRAINING = Instant.parse("2024-03-10T07:00:00Z");
    private static final Instant SECOND_TRAINING = Instant.parse("2024-03-11T07:00:00Z");

    @Autowired
    private ModelRegistry modelRegistry;

    @Autowired
    private ModelVersionRepository modelVersionRepository;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void candidateIsStoredWithTrainingMetadata() {
        ModelVersion candidate = modelRegistry.saveCandidate(result(FIRST_TRAINING), FIRST_TRAINING);

        assertThat(candidate.getVersionId()).matches("fm-20240310T070000-[0-9a-f]{8}");
        assertThat(candidate.getStatus()).isEqualTo(ModelVersion.Status.CANDIDATE);
        assertThat(candidate.getTrainingCutoff()).isEqualTo(FIRST_TRAINING.minus(Duration.ofDays(2)));
        assertThat(candidate.getTrainingSampleCount()).isEqualTo(24);
        assertThat(candidate.getValidationSampleCount()).isEqualTo(6);
        assertThat(modelRegistry.active()).isEmpty();
    }

    @Test
    void activationSupersedesThePreviousVersion() {
        ModelVersion first = modelRegistry.activate(modelRegistry.saveCandidate(result(FIRST_TRAINING), FIRST_TRAINING));
        ModelVersion second = modelRegistry.activate(modelRegistry.saveCandidate(result(SECOND_TRAINING), SECOND_TRAINING));

        assertThat(modelRegistry.find(first.getVersionId()).getStatus()).isEqualTo(ModelVersion.Status.SUPERSEDED);
        assertThat(modelVersionRepository.findByStatus(ModelVersion.Status.ACTIVE))
                .extracting(ModelVersion::getVersionId)
                .containsExactly(second.getVersionId());
        assertThat(modelRegistry.active())
                .hasValueSatisfying(active -> assertThat(active.version().getVersionId()).isEqualTo(second.getVersionId()));
    }

    @Test
    void rejectedCandidateLeavesActiveVersionInPlace() {
        ModelVersion active = modelRegistry.activate(modelRegistry.saveCandidate(result(FIRST_TRAINING), FIRST_TRAINING));
        ModelVersion candidate = modelRegistry.saveCandidate(result(SECOND_TRAINING), SECOND_TRAINING);
        candidate.setAccuracy1d(0.41);

        modelRegistry.reject(candidate, "1d accuracy 0.410 < 0.60");

        ModelVersion rejected = modelRegistry.find(candidate.getVersionId());
        assertThat(rejected.getStatus()).isEqualTo(ModelVersion.Status.REJECTED);
        assertThat(rejected.getRejectionReason()).contains("1d accuracy");
        assertThat(rejected.getAccuracy1d()).isEqualTo(0.41);
        assertThat(modelRegistry.active())
                .hasValueSatisfying(current -> assertThat(current.version().getVersionId()).isEqualTo(active.getVersionId()));
    }

    @Test
    void storedPayloadScoresLikeTheFittedEnsemble() {
        TrainingResult result = result(FIRST_TRAINING);
        ModelVersion candidate = modelRegistry.saveCandidate(result, FIRST_TRAINING);

        ModelRegistry freshRegistry = new ModelRegistry(modelVersionRepository, objectMapper);
        TrainedEnsemble reloaded = freshRegistry.load(freshRegistry.find(candidate.getVersionId()));

        double[][] window = {{-0.9, -1.8, -1.0}, {0.8, 1.7, 0.9}};
        Map<Horizon, HorizonForecast> expected = result.ensemble().forecast(window);
        Map<Horizon, HorizonForecast> actual = reloaded.forecast(window);
        for (Horizon horizon : Horizon.values()) {
            assertThat(actual.get(horizon).direction()).isEqualTo(expected.get(horizon).direction());
            assertThat(actual.get(horizon).confidence()).isCloseTo(expected.get(horizon).confidence(), within(1e-9));
            assertThat(actual.get(horizon).magnitude()).isCloseTo(expected.get(horizon).magnitude(), within(1e-9));
        }
        assertThat(reloaded.familyWeights()).isEqualTo(result.ensemble().familyWeights());
    }

    @Test
    void unknownVersionIsNotFound() {
        assertThatThrownBy(() -> modelRegistry.find("fm-missing"))
                .isInstanceOf(NotFoundException.class);
    }

    private TrainingResult result(Instant trainedAt) {
        List<TrainingSample> samples = new ArrayList<>();
        Instant start = trainedAt.minus(Duration.ofDays(25));
        double[] previous = null;
        for (int i = 0; i < 24; i++) {
            double sign = i % 2 == 0 ? 1.0 : -1.0;
            int label = sign > 0 ? Direction.UP.index() : Direction.DOWN.index();
            double[] row = {sign, 2.0 * sign, sign + (i % 3) * 0.05};
            double[][] window = {previous == null ? row : previous, row};
            samples.add(new TrainingSample(start.plus(Duration.ofDays(i)), window,
                    new int[]{label, label, label},
                    new double[]{sign * 0.4, sign, sign * 1.5}));
            previous = row;
        }
        EnsembleTrainer trainer = new EnsembleTrainer(new RandomForestModel.Settings(4, 3, 1, 11L),
                new LstmSequenceModel.Settings(10, 0.01, 8, 8, 11L), 0.2);
        TrainedEnsemble ensemble = trainer.train(samples, "schema-hash", List.of("a", "b", "c"));
        return new TrainingResult(ensemble, samples.get(samples.size() - 1).timestamp(), 24, 6);
    }

    @TestConfiguration
    static class TestConfig {
        @Bean
        ObjectMapper objectMapper() {
            return Jackson2ObjectMapperBuilder.json().build();
        }
    }
}
