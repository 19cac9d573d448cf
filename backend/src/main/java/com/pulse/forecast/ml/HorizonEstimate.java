package com.pulse.forecast.ml;

import com.pulse.forecast.model.Direction;

/**
 * Class probabilities indexed by {@link Direction#index()} and a signed magnitude in percent.
 */
public record HorizonEstimate(double[] probabilities, double magnitude) {

    public Direction direction() {
        int best = 0;
        for (int i = 1; i < probabilities.length; i++) {
            if (probabilities[i] > probabilities[best]) {
                best = i;
            }
        }
        return Direction.fromIndex(best);
    }

    public double maxProbability() {
        return probabilities[direction().index()];
    }
}
