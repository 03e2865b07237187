package com.driftmonitor.core;

import com.driftmonitor.config.MonitoringSettings;

import java.time.Clock;

/**
 * Population Stability Index over equal-width bins spanning the baseline range. PSI carries no
 * p-value, so the verdict is reported as 0 (drift) or 1 (stable) to keep p-value based
 * consumers consistent.
 */
public class PopulationStabilityDetector extends AbstractDriftDetector {

    public static final String NAME = "psi";

    private static final double SMOOTHING = 1.0e-10;

    public PopulationStabilityDetector(MonitoringSettings settings, Clock clock) {
        super(settings, clock);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected Score score(double[] reference, double[] current) {
        double psi = psi(reference, current, settings.getPsiBins());
        double pValue = psi > settings.getPsiThreshold() ? 0.0 : 1.0;
        return new Score(1.0 - Math.exp(-psi), pValue);
    }

    static double psi(double[] reference, double[] current, int bins) {
        double lo = Statistics.min(reference);
        double hi = Statistics.max(reference);
        double[] ref = proportions(reference, lo, hi, bins);
        double[] cur = proportions(current, lo, hi, bins);
        double psi = 0.0;
        for (int i = 0; i < bins; i++) {
            double r = ref[i] + SMOOTHING;
            double c = cur[i] + SMOOTHING;
            psi += (c - r) * Math.log(c / r);
        }
        return psi;
    }

    private static double[] proportions(double[] values, double lo, double hi, int bins) {
        double[] counts = new double[bins];
        double width = (hi - lo) / bins;
        for (double v : values) {
            int bin;
            if (width == 0.0) {
                bin = v < lo ? 0 : (v > hi ? bins - 1 : bins / 2);
            } else {
                bin = (int) Math.floor((v - lo) / width);
            }
            counts[Math.max(0, Math.min(bins - 1, bin))]++;
        }
        for (int i = 0; i < bins; i++) {
            counts[i] /= values.length;
        }
        return counts;
    }
}
