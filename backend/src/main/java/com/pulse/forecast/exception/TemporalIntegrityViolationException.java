package com.pulse.forecast.exception;

import com.pulse.forecast.service.guard.GuardReport;

public class TemporalIntegrityViolationException extends ForecastException {

    private final transient GuardReport report;

    public TemporalIntegrityViolationException(GuardReport report) {
        super("Temporal integrity violated: " + report.describe());
        this.report = report;
    }

    public GuardReport getReport() {
        return report;
    }
}
