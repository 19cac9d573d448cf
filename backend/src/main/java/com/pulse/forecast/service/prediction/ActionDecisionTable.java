package com.pulse.forecast.service.prediction;

import com.pulse.forecast.config.ForecastProperties;
import com.pulse.forecast.model.Direction;
import com.pulse.forecast.model.TradingAction;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Maps the longest-horizon forecast to a trading action.
 */
@Component
@RequiredArgsConstructor
public class ActionDecisionTable {

    private final ForecastProperties forecastProperties;

    public TradingAction decide(Direction direction, double confidence, double magnitudePct) {
        if (direction == null || direction == Direction.FLAT) {
            return TradingAction.HOLD;
        }
        ForecastProperties.Actions thresholds = forecastProperties.getActions();
        double size = Math.abs(magnitudePct);
        boolean up = direction == Direction.UP;
        if (confidence >= thresholds.getStrongConfidence() && size >= thresholds.getStrongMagnitudePct()) {
            return up ? TradingAction.STRONG_BUY : TradingAction.STRONG_SELL;
        }
        if (confidence >= thresholds.getConfidence() && size >= thresholds.getMagnitudePct()) {
            return up ? TradingAction.BUY : TradingAction.SELL;
        }
        return TradingAction.HOLD;
    }
}
