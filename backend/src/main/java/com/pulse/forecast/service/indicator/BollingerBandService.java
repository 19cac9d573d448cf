package com.pulse.forecast.service.indicator;

import com.pulse.forecast.config.IndicatorProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
@RequiredArgsConstructor
public class BollingerBandService {

    private final IndicatorProperties indicatorProperties;

    public Optional<BollingerBands> calculate(double[] closes) {
        int period = indicatorProperties.getBollingerPeriod();
        if (closes == null || closes.length < period) {
            return Optional.empty();
        }
        int start = closes.length - period;
        double mean = 0.0;
        for (int i = start; i < closes.length; i++) {
            mean += closes[i];
        }
        mean /= period;
        double variance = 0.0;
        for (int i = start; i < closes.length; i++) {
            double diff = closes[i] - mean;
            variance += diff * diff;
        }
        double deviation = Math.sqrt(variance / period) * indicatorProperties.getBollingerDeviation();
        double upper = mean + deviation;
        double lower = mean - deviation;
        double width = mean == 0 ? 0 : (upper - lower) / mean;
        return Optional.of(new BollingerBands(upper, mean, lower, width));
    }

    /**
     * {@code width} is the band spread relative to the middle band.
     */
    public record BollingerBands(double upper, double middle, double lower, double width) {}
}
