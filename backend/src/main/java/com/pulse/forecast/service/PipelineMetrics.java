package com.pulse.forecast.service;

import com.pulse.forecast.model.PipelinePhase;
import com.pulse.forecast.model.RunStatus;
import com.pulse.forecast.service.guard.GuardReport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Locale;

@Service
@RequiredArgsConstructor
public class PipelineMetrics {

    private final MeterRegistry meterRegistry;

    public void recordPhase(PipelinePhase phase, RunStatus status) {
        counter("forecast_phase_runs_total", "phase", phase, "status", status).increment();
    }

    public void recordSymbol(String result) {
        counter("forecast_symbols_total", "result", result).increment();
    }

    public void recordOutcomes(int recorded, int backfilled, int stalePrices) {
        Counter.builder("forecast_outcomes_recorded_total").register(meterRegistry).increment(recorded);
        Counter.builder("forecast_outcomes_backfilled_total").register(meterRegistry).increment(backfilled);
        Counter.builder("forecast_stale_prices_total").register(meterRegistry).increment(stalePrices);
    }

    public void recordGuard(GuardReport report) {
        report.violations().forEach(violation ->
                counter("forecast_guard_violations_total", "check", violation.check().checkName()).increment());
    }

    public void recordTraining(String result) {
        counter("forecast_training_runs_total", "result", result).increment();
    }

    private Counter counter(String name, Object... tags) {
        Counter.Builder builder = Counter.builder(name);
        for (int i = 0; i + 1 < tags.length; i += 2) {
            builder.tag(String.valueOf(tags[i]), String.valueOf(tags[i + 1]).toLowerCase(Locale.ROOT));
        }
        return builder.register(meterRegistry);
    }
}
