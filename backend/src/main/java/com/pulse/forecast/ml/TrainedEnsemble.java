package com.pulse.forecast.ml;

import com.pulse.forecast.model.Direction;
import com.pulse.forecast.model.Horizon;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to score a window of raw feature rows: the weighted family members and the
 * per-horizon calibrators. Serialised as the model version payload.
 */
public record TrainedEnsemble(
        String schemaHash,
        List<String> featureNames,
        List<Member> members,
        Map<Horizon, ConfidenceCalibrator> calibrators
) {

    public Map<Horizon, HorizonForecast> forecast(double[][] window) {
        Map<Horizon, HorizonForecast> forecasts = new EnumMap<>(Horizon.class);
        vote(window).forEach((horizon, estimate) -> {
            ConfidenceCalibrator calibrator = calibrators.getOrDefault(horizon, ConfidenceCalibrator.identity());
            forecasts.put(horizon, new HorizonForecast(
                    estimate.direction(),
                    calibrator.calibrate(estimate.maxProbability()),
                    estimate.magnitude(),
                    estimate.probabilities()));
        });
        return forecasts;
    }

    /**
     * Weighted average of every member's estimate, before calibration.
     */
    Map<Horizon, HorizonEstimate> vote(double[][] window) {
        double totalWeight = members.stream().mapToDouble(Member::weight).sum();
        Map<Horizon, double[]> probabilities = new EnumMap<>(Horizon.class);
        Map<Horizon, Double> magnitudes = new EnumMap<>(Horizon.class);
        for (Member member : members) {
            double share = member.weight() / totalWeight;
            member.model().predict(window).forEach((horizon, estimate) -> {
                double[] sum = probabilities.computeIfAbsent(horizon, h -> new double[Direction.CLASS_COUNT]);
                for (int k = 0; k < sum.length; k++) {
                    sum[k] += share * estimate.probabilities()[k];
                }
                magnitudes.merge(horizon, share * estimate.magnitude(), Double::sum);
            });
        }
        Map<Horizon, HorizonEstimate> result = new EnumMap<>(Horizon.class);
        probabilities.forEach((horizon, sum) -> result.put(horizon, new HorizonEstimate(sum, magnitudes.get(horizon))));
        return result;
    }

    public Map<String, Double> familyWeights() {
        Map<String, Double> weights = new LinkedHashMap<>();
        members.forEach(member -> weights.put(member.model().family(), member.weight()));
        return weights;
    }

    public record Member(ForecastModel model, double weight) {}
}
