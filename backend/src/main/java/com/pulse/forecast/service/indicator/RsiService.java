package com.pulse.forecast.service.indicator;

import com.pulse.forecast.config.IndicatorProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.OptionalDouble;

/**
 * Wilder RSI over closing prices.
 */
@Service
@RequiredArgsConstructor
public class RsiService {

    private final IndicatorProperties indicatorProperties;

    /**
     * Empty when the series is shorter than {@code period + 1}; the caller decides on a default.
     */
    public OptionalDouble calculate(double[] closes) {
        int period = indicatorProperties.getRsiPeriod();
        if (closes == null || closes.length < period + 1) {
            return OptionalDouble.empty();
        }
        double avgGain = 0.0;
        double avgLoss = 0.0;
        for (int i = 1; i <= period; i++) {
            double change = closes[i] - closes[i - 1];
            avgGain += Math.max(change, 0.0);
            avgLoss += Math.max(-change, 0.0);
        }
        avgGain /= period;
        avgLoss /= period;
        for (int i = period + 1; i < closes.length; i++) {
            double change = closes[i] - closes[i - 1];
            avgGain = ((avgGain * (period - 1)) + Math.max(change, 0.0)) / period;
            avgLoss = ((avgLoss * (period - 1)) + Math.max(-change, 0.0)) / period;
        }
        if (avgLoss == 0) {
            return OptionalDouble.of(avgGain == 0 ? 50.0 : 100.0);
        }
        double rs = avgGain / avgLoss;
        return OptionalDouble.of(100.0 - (100.0 / (1.0 + rs)));
    }
}
