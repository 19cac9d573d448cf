package com.pulse.forecast.model;

import java.time.Instant;

/**
 * A feature row joined with its realized outcome, the unit of training, evaluation and replay.
 */
public record FeatureOutcomePair(FeatureRecord feature, Outcome outcome) {

    public Instant timestamp() {
        return feature.getTimestamp();
    }

    public String symbol() {
        return feature.getSymbol();
    }
}
