package com.pulse.forecast.ml;

import com.pulse.forecast.model.Horizon;

import java.time.Instant;

/**
 * One labelled row with the rows leading up to it. {@code window} runs oldest to newest and ends
 * with the labelled row. {@code directions} and {@code returns} are indexed by {@link Horizon#ordinal()}.
 */
public record TrainingSample(Instant timestamp, double[][] window, int[] directions, double[] returns) {

    public double[] features() {
        return window[window.length - 1];
    }

    public int direction(Horizon horizon) {
        return directions[horizon.ordinal()];
    }

    public double returnPct(Horizon horizon) {
        return returns[horizon.ordinal()];
    }
}
