package com.pulse.forecast.service.guard;

public enum GuardCheck {
    DUPLICATE_PREDICTIONS("duplicate_predictions"),
    FEATURE_OUTCOME_COUNT("feature_outcome_count"),
    NO_FUTURE_LEAKAGE("no_future_leakage"),
    SCHEMA_PRESENCE("schema_presence"),
    REFERENTIAL_INTEGRITY("referential_integrity"),
    OUTCOME_LOOKAHEAD("outcome_lookahead"),
    RETURN_CONSISTENCY("return_consistency"),
    PHASE_ORDER("phase_order");

    private final String checkName;

    GuardCheck(String checkName) {
        this.checkName = checkName;
    }

    public String checkName() {
        return checkName;
    }
}
