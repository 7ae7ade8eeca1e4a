package com.cloudcost.anomaly.analytics;

import java.util.Arrays;

/**
 * Outlier-resistant location, scale and slope estimators used by the detectors.
 */
public final class RobustStatistics {

    /** Makes MAD a consistent estimator of the standard deviation for normal data. */
    public static final double MODIFIED_Z_CONSTANT = 0.6745d;

    private RobustStatistics() {
    }

    public static double median(double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("median of an empty series is undefined");
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int middle = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[middle];
        }
        return (sorted[middle - 1] + sorted[middle]) / 2.0d;
    }

    public static double medianAbsoluteDeviation(double[] values, double median) {
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        return median(deviations);
    }

    public static double modifiedZScore(double value, double median, double mad) {
        return MODIFIED_Z_CONSTANT * (value - median) / mad;
    }

    /**
     * Theil-Sen estimator: the median of the slopes between every pair of points, with the
     * array index as the x coordinate. A single aberrant point only contaminates the n-1 slopes
     * that touch it.
     */
    public static double theilSenSlope(double[] values) {
        int n = values.length;
        if (n < 2) {
            return 0d;
        }
        double[] slopes = new double[n * (n - 1) / 2];
        int k = 0;
        for (int i = 0; i < n - 1; i++) {
            for (int j = i + 1; j < n; j++) {
                slopes[k++] = (values[j] - values[i]) / (j - i);
            }
        }
        return median(slopes);
    }
}
