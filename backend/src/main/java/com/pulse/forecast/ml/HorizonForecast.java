package com.pulse.forecast.ml;

import com.pulse.forecast.model.Direction;

/**
 * Ensemble output for one horizon after weighted voting and calibration.
 */
public record HorizonForecast(Direction direction, double confidence, double magnitude, double[] probabilities) {}
