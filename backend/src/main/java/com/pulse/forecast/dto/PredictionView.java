package com.pulse.forecast.dto;

import com.pulse.forecast.model.Direction;
import com.pulse.forecast.model.Horizon;
import com.pulse.forecast.model.Prediction;
import com.pulse.forecast.model.TradingAction;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

public record PredictionView(
        String symbol,
        LocalDate predictionDate,
        TradingAction optimalAction,
        double confidenceAvg,
        Map<String, HorizonView> horizons,
        String modelVersionId,
        Instant createdTimestamp
) {

    public static PredictionView from(Prediction prediction) {
        Map<String, HorizonView> horizons = new LinkedHashMap<>();
        for (Horizon horizon : Horizon.values()) {
            horizons.put(horizon.label(), new HorizonView(prediction.direction(horizon),
                    prediction.magnitude(horizon), prediction.confidence(horizon)));
        }
        return new PredictionView(prediction.getSymbol(), prediction.getPredictionDate(),
                prediction.getOptimalAction(), prediction.getConfidenceAvg(), horizons,
                prediction.getModelVersionId(), prediction.getCreatedTimestamp());
    }

    public record HorizonView(Direction direction, double magnitude, double confidence) {}
}
