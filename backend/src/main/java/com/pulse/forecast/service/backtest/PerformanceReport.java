package com.pulse.forecast.service.backtest;

import com.pulse.forecast.model.Horizon;

import java.util.Map;

/**
 * Out-of-sample scores of one model version.
 */
public record PerformanceReport(String versionId, int samples, boolean sufficient, Map<Horizon, HorizonScore> horizons) {

    public record HorizonScore(double accuracy, double mae) {}
}
