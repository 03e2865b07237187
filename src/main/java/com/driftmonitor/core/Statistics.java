package com.driftmonitor.core;

/**
 * Descriptive statistics over plain sample arrays. Standard deviation is the population
 * form, matching how baselines are summarised.
 */
public final class Statistics {

    private Statistics() {
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    public static double stdDev(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double variance = 0.0;
        for (double v : values) {
            variance += (v - mean) * (v - mean);
        }
        return Math.sqrt(variance / values.length);
    }

    public static double min(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
        }
        return values.length == 0 ? 0.0 : min;
    }

    public static double max(double[] values) {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            max = Math.max(max, v);
        }
        return values.length == 0 ? 0.0 : max;
    }

    /**
     * Pearson correlation of the values against their position in the sequence; 0 when
     * fewer than three values or when either side has no variance.
     */
    public static double trend(double[] values) {
        int n = values.length;
        if (n < 3) {
            return 0.0;
        }
        double meanX = (n - 1) / 2.0;
        double meanY = mean(values);
        double cov = 0.0;
        double varX = 0.0;
        double varY = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = i - meanX;
            double dy = values[i] - meanY;
            cov += dx * dy;
            varX += dx * dx;
            varY += dy * dy;
        }
        if (varX == 0.0 || varY == 0.0) {
            return 0.0;
        }
        return cov / Math.sqrt(varX * varY);
    }
}
