package com.pulse.forecast.ml;

import com.pulse.forecast.model.Horizon;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fits both model families on the older part of a chronological sample list and uses the newest
 * slice to weight the families and calibrate confidence. Nothing is refit on the slice.
 */
@Slf4j
public class EnsembleTrainer {

    private static final double MIN_FAMILY_WEIGHT = 0.05;
    private static final double CALIBRATION_SHRINKAGE = 5.0;

    private final RandomForestModel.Settings forestSettings;
    private final LstmSequenceModel.Settings sequenceSettings;
    private final double calibrationFraction;

    public EnsembleTrainer(RandomForestModel.Settings forestSettings, LstmSequenceModel.Settings sequenceSettings,
                           double calibrationFraction) {
        this.forestSettings = forestSettings;
        this.sequenceSettings = sequenceSettings;
        this.calibrationFraction = calibrationFraction;
    }

    public TrainedEnsemble train(List<TrainingSample> chronological, String schemaHash, List<String> featureNames) {
        int n = chronological.size();
        if (n < 4) {
            throw new IllegalArgumentException("At least 4 samples are needed to train, got " + n);
        }
        int calibrationSize = Math.max(1, (int) Math.round(n * calibrationFraction));
        int fitSize = n - calibrationSize;
        List<TrainingSample> fitSet = chronological.subList(0, fitSize);
        List<TrainingSample> calibrationSet = chronological.subList(fitSize, n);

        List<ForecastModel> families = List.of(
                RandomForestModel.fit(fitSet, featureNames, forestSettings),
                LstmSequenceModel.fit(fitSet, sequenceSettings));
        List<TrainedEnsemble.Member> members = new ArrayList<>();
        for (ForecastModel family : families) {
            double accuracy = accuracy(family, calibrationSet);
            members.add(new TrainedEnsemble.Member(family, Math.max(MIN_FAMILY_WEIGHT, accuracy)));
            log.info("Family fitted family={} calibrationAccuracy={} fitRows={} calibrationRows={}",
                    family.family(), accuracy, fitSize, calibrationSize);
        }

        TrainedEnsemble uncalibrated = new TrainedEnsemble(schemaHash, featureNames, members, Map.of());
        Map<Horizon, ConfidenceCalibrator> calibrators = new EnumMap<>(Horizon.class);
        for (Horizon horizon : Horizon.values()) {
            double[] raw = new double[calibrationSet.size()];
            boolean[] correct = new boolean[calibrationSet.size()];
            for (int i = 0; i < calibrationSet.size(); i++) {
                TrainingSample sample = calibrationSet.get(i);
                HorizonEstimate estimate = uncalibrated.vote(sample.window()).get(horizon);
                raw[i] = estimate.maxProbability();
                correct[i] = estimate.direction().index() == sample.direction(horizon);
            }
            calibrators.put(horizon, ConfidenceCalibrator.fit(raw, correct, CALIBRATION_SHRINKAGE));
        }
        return new TrainedEnsemble(schemaHash, featureNames, members, calibrators);
    }

    private double accuracy(ForecastModel model, List<TrainingSample> samples) {
        int hits = 0;
        int total = 0;
        for (TrainingSample sample : samples) {
            Map<Horizon, HorizonEstimate> estimates = model.predict(sample.window());
            for (Horizon horizon : Horizon.values()) {
                total++;
                if (estimates.get(horizon).direction().index() == sample.direction(horizon)) {
                    hits++;
                }
            }
        }
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
