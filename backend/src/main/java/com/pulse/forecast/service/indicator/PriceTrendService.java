package com.pulse.forecast.service.indicator;

import com.pulse.forecast.config.IndicatorProperties;
import com.pulse.forecast.model.Candle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Moving-average ratios, percentage price changes, realized volatility and relative volume.
 */
@Service
@RequiredArgsConstructor
public class PriceTrendService {

    private final IndicatorProperties indicatorProperties;

    /**
     * Last close divided by its simple moving average over {@code period} closes.
     */
    public OptionalDouble smaRatio(double[] closes, int period) {
        if (closes == null || closes.length < period) {
            return OptionalDouble.empty();
        }
        double sum = 0.0;
        for (int i = closes.length - period; i < closes.length; i++) {
            sum += closes[i];
        }
        double sma = sum / period;
        return sma <= 0 ? OptionalDouble.empty() : OptionalDouble.of(closes[closes.length - 1] / sma);
    }

    /**
     * Percentage change between the last close and the close {@code bars} bars earlier.
     */
    public OptionalDouble priceChangePct(double[] closes, int bars) {
        if (closes == null || closes.length <= bars) {
            return OptionalDouble.empty();
        }
        double base = closes[closes.length - 1 - bars];
        if (base <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((closes[closes.length - 1] - base) / base * 100.0);
    }

    /**
     * Annualised standard deviation of daily percentage returns over the last 20 bars.
     */
    public OptionalDouble volatility(double[] closes) {
        int window = 20;
        if (closes == null || closes.length < window + 1) {
            return OptionalDouble.empty();
        }
        double[] returns = new double[window];
        for (int i = 0; i < window; i++) {
            int index = closes.length - window + i;
            double previous = closes[index - 1];
            if (previous <= 0) {
                return OptionalDouble.empty();
            }
            returns[i] = (closes[index] - previous) / previous;
        }
        double mean = 0.0;
        for (double value : returns) {
            mean += value;
        }
        mean /= window;
        double variance = 0.0;
        for (double value : returns) {
            variance += (value - mean) * (value - mean);
        }
        variance /= (window - 1);
        return OptionalDouble.of(Math.sqrt(variance) * Math.sqrt(252) * 100.0);
    }

    public OptionalDouble volumeRatio(List<Candle> candles) {
        int period = indicatorProperties.getVolumePeriod();
        if (candles == null || candles.size() < period + 1) {
            return OptionalDouble.empty();
        }
        double sum = 0.0;
        for (int i = candles.size() - 1 - period; i < candles.size() - 1; i++) {
            sum += candles.get(i).getVolume();
        }
        double average = sum / period;
        if (average <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(candles.get(candles.size() - 1).getVolume() / average);
    }

    /**
     * Last bar's high-low range as a percentage of its close.
     */
    public OptionalDouble dailyRangePct(List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            return OptionalDouble.empty();
        }
        Candle last = candles.get(candles.size() - 1);
        if (last.getClose() <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((last.getHigh() - last.getLow()) / last.getClose() * 100.0);
    }
}
