package com.pulse.forecast.ml;

/**
 * Histogram-binning calibration of the winning class probability. Each bin's observed hit rate is
 * shrunk towards the raw score, so sparse bins stay close to the model's own estimate.
 */
public record ConfidenceCalibrator(int[] counts, double[] hits, double shrinkage) {

    private static final int BINS = 10;

    public static ConfidenceCalibrator identity() {
        return new ConfidenceCalibrator(new int[BINS], new double[BINS], 5.0);
    }

    public static ConfidenceCalibrator fit(double[] rawConfidences, boolean[] correct, double shrinkage) {
        int[] counts = new int[BINS];
        double[] hits = new double[BINS];
        for (int i = 0; i < rawConfidences.length; i++) {
            int bin = bin(rawConfidences[i]);
            counts[bin]++;
            if (correct[i]) {
                hits[bin]++;
            }
        }
        return new ConfidenceCalibrator(counts, hits, shrinkage);
    }

    public double calibrate(double raw) {
        double clamped = Math.max(0.0, Math.min(1.0, raw));
        int bin = bin(clamped);
        double calibrated = (hits[bin] + shrinkage * clamped) / (counts[bin] + shrinkage);
        return Math.max(0.0, Math.min(1.0, calibrated));
    }

    private static int bin(double value) {
        return Math.min(BINS - 1, Math.max(0, (int) (value * BINS)));
    }
}
