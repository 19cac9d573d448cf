package com.pulse.forecast.service.prediction;

import com.pulse.forecast.ml.TrainedEnsemble;

import java.time.Instant;

/**
 * A freshly fitted ensemble. Rows after {@code trainingCutoff} were held out for evaluation.
 */
public record TrainingResult(TrainedEnsemble ensemble, Instant trainingCutoff, int trainingSamples, int holdoutSamples) {}
