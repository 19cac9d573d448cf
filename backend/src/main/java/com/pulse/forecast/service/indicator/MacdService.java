package com.pulse.forecast.service.indicator;

import com.pulse.forecast.config.IndicatorProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class MacdService {

    private final IndicatorProperties indicatorProperties;

    public Optional<MacdResult> calculate(double[] closes) {
        int fast = indicatorProperties.getMacdFastPeriod();
        int slow = indicatorProperties.getMacdSlowPeriod();
        int signal = indicatorProperties.getMacdSignalPeriod();
        if (closes == null || closes.length < slow + signal - 1) {
            return Optional.empty();
        }
        double[] fastSeries = ema(closes, fast);
        double[] slowSeries = ema(closes, slow);
        // both EMAs are defined from index slow - 1 onwards
        double[] macdSeries = new double[closes.length - (slow - 1)];
        for (int i = slow - 1; i < closes.length; i++) {
            macdSeries[i - (slow - 1)] = fastSeries[i] - slowSeries[i];
        }
        double[] signalSeries = ema(macdSeries, signal);
        double macdLine = macdSeries[macdSeries.length - 1];
        double signalLine = signalSeries[signalSeries.length - 1];
        return Optional.of(new MacdResult(macdLine, signalLine, macdLine - signalLine));
    }

    /**
     * EMA seeded with the SMA of the first {@code period} values. Entries before the seed are NaN.
     */
    static double[] ema(double[] values, int period) {
        double[] series = new double[values.length];
        Arrays.fill(series, Double.NaN);
        if (values.length < period) {
            return series;
        }
        double seed = 0.0;
        for (int i = 0; i < period; i++) {
            seed += values[i];
        }
        seed /= period;
        series[period - 1] = seed;
        double k = 2.0 / (period + 1);
        double ema = seed;
        for (int i = period; i < values.length; i++) {
            ema = (values[i] * k) + (ema * (1 - k));
            series[i] = ema;
        }
        return series;
    }

    public record MacdResult(double macdLine, double signalLine, double histogram) {}
}
